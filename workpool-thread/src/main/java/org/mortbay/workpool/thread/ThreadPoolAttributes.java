//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.mortbay.workpool.thread;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>The configuration of a {@link ThreadPool}.</p>
 * <p>A {@link ThreadPool} copies its attributes when it is created, so that
 * changing them afterwards has no effect on that pool.</p>
 * <p>The default thread count, queue size and timeout may be overridden with
 * the system properties {@value #THREAD_COUNT_PROPERTY},
 * {@value #QUEUE_SIZE_PROPERTY} and {@value #TIMEOUT_PROPERTY} (in
 * milliseconds). Invalid values are ignored.</p>
 */
public class ThreadPoolAttributes
{
    private static final Logger LOG = LoggerFactory.getLogger(ThreadPoolAttributes.class);

    public static final String THREAD_COUNT_PROPERTY = "org.mortbay.workpool.threadCount";
    public static final String QUEUE_SIZE_PROPERTY = "org.mortbay.workpool.queueSize";
    public static final String TIMEOUT_PROPERTY = "org.mortbay.workpool.timeoutMs";

    public static final int DEFAULT_THREADS = 4;
    public static final int MAX_THREADS = 64;
    public static final int DEFAULT_QUEUE_SIZE = 16;
    public static final long DEFAULT_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(10);

    private CancelType _cancelType = CancelType.DEFERRED;
    private boolean _timedWait;
    private long _timeoutNanos;
    private boolean _blockOnAdd;
    private boolean _blockOnError;
    private int _threadCount;
    private int _queueSize;

    public ThreadPoolAttributes()
    {
        _threadCount = (int)property(THREAD_COUNT_PROPERTY, DEFAULT_THREADS, 1, MAX_THREADS);
        _queueSize = (int)property(QUEUE_SIZE_PROPERTY, DEFAULT_QUEUE_SIZE, 1, Integer.MAX_VALUE);
        _timeoutNanos = TimeUnit.MILLISECONDS.toNanos(property(TIMEOUT_PROPERTY, DEFAULT_TIMEOUT_MS, 1, Long.MAX_VALUE));
    }

    /**
     * @param attributes the attributes to copy
     */
    public ThreadPoolAttributes(ThreadPoolAttributes attributes)
    {
        _cancelType = attributes._cancelType;
        _timedWait = attributes._timedWait;
        _timeoutNanos = attributes._timeoutNanos;
        _blockOnAdd = attributes._blockOnAdd;
        _blockOnError = attributes._blockOnError;
        _threadCount = attributes._threadCount;
        _queueSize = attributes._queueSize;
    }

    static long property(String name, long defaultValue, long min, long max)
    {
        String value = System.getProperty(name);
        if (value == null)
            return defaultValue;
        try
        {
            long result = Long.parseLong(value.trim());
            if (result >= min && result <= max)
                return result;
            LOG.warn("Ignoring {}={}, not in [{}..{}]", name, value, min, max);
        }
        catch (NumberFormatException x)
        {
            LOG.warn("Ignoring {}={}, not a number", name, value);
        }
        return defaultValue;
    }

    public CancelType getCancelType()
    {
        return _cancelType;
    }

    /**
     * @param cancelType how workers are cancelled by a forceful shutdown
     * @return these attributes
     */
    public ThreadPoolAttributes setCancelType(CancelType cancelType)
    {
        _cancelType = Objects.requireNonNull(cancelType);
        return this;
    }

    public boolean isTimedWait()
    {
        return _timedWait;
    }

    /**
     * @param timedWait whether blocking adds and {@link ThreadPool#waitIdle()}
     * give up after {@link #getTimeout(TimeUnit) the timeout}
     * @return these attributes
     */
    public ThreadPoolAttributes setTimedWait(boolean timedWait)
    {
        _timedWait = timedWait;
        return this;
    }

    public long getTimeout(TimeUnit unit)
    {
        return unit.convert(_timeoutNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param timeout the timeout of blocking adds and idle waits, kept to the nanosecond
     * @param unit the unit of the timeout
     * @return these attributes
     */
    public ThreadPoolAttributes setTimeout(long timeout, TimeUnit unit)
    {
        long nanos = unit.toNanos(timeout);
        if (nanos <= 0)
            throw new IllegalArgumentException("Invalid timeout: " + timeout + " " + unit);
        _timeoutNanos = nanos;
        return this;
    }

    public boolean isBlockOnAdd()
    {
        return _blockOnAdd;
    }

    /**
     * @param blockOnAdd whether adding to a full queue waits for space
     * rather than failing with {@link WorkRejectedException}
     * @return these attributes
     */
    public ThreadPoolAttributes setBlockOnAdd(boolean blockOnAdd)
    {
        _blockOnAdd = blockOnAdd;
        return this;
    }

    public boolean isBlockOnError()
    {
        return _blockOnError;
    }

    /**
     * @param blockOnError whether a worker whose task throws stops taking
     * tasks until {@link ThreadPool#restartWorker(int) restarted}
     * @return these attributes
     */
    public ThreadPoolAttributes setBlockOnError(boolean blockOnError)
    {
        _blockOnError = blockOnError;
        return this;
    }

    public int getThreadCount()
    {
        return _threadCount;
    }

    public ThreadPoolAttributes setThreadCount(int threadCount)
    {
        if (threadCount < 1 || threadCount > MAX_THREADS)
            throw new IllegalArgumentException("Invalid thread count: " + threadCount);
        _threadCount = threadCount;
        return this;
    }

    public int getQueueSize()
    {
        return _queueSize;
    }

    public ThreadPoolAttributes setQueueSize(int queueSize)
    {
        if (queueSize < 1)
            throw new IllegalArgumentException("Invalid queue size: " + queueSize);
        _queueSize = queueSize;
        return this;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{threads=%d,queue=%d,block=%b,timed=%b,timeout=%dns,blockOnError=%b,cancel=%s}",
            getClass().getSimpleName(),
            hashCode(),
            _threadCount,
            _queueSize,
            _blockOnAdd,
            _timedWait,
            _timeoutNanos,
            _blockOnError,
            _cancelType);
    }
}
