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

/**
 * <p>A snapshot of the state of one worker of a {@link ThreadPool}.</p>
 * <p>The worker may have changed state by the time the snapshot is read.</p>
 */
public class WorkerInfo
{
    public enum Status
    {
        /**
         * Not started yet, or exited.
         */
        STOPPED,
        /**
         * Waiting for work.
         */
        IDLE,
        /**
         * Running a task.
         */
        RUNNING,
        /**
         * Stopped by a failed task, until restarted.
         */
        BLOCKED,
        /**
         * Leaving its loop because the pool is shutting down.
         */
        DESTROYING
    }

    private final int _index;
    private final String _name;
    private final Status _status;
    private final long _completed;
    private final long _failed;
    private final Throwable _lastFailure;

    WorkerInfo(int index, String name, Status status, long completed, long failed, Throwable lastFailure)
    {
        _index = index;
        _name = name;
        _status = status;
        _completed = completed;
        _failed = failed;
        _lastFailure = lastFailure;
    }

    public int getIndex()
    {
        return _index;
    }

    public String getName()
    {
        return _name;
    }

    public Status getStatus()
    {
        return _status;
    }

    /**
     * @return the number of tasks that returned normally
     */
    public long getCompleted()
    {
        return _completed;
    }

    /**
     * @return the number of tasks that threw
     */
    public long getFailed()
    {
        return _failed;
    }

    /**
     * @return what the last failed task threw, or null
     */
    public Throwable getLastFailure()
    {
        return _lastFailure;
    }

    @Override
    public String toString()
    {
        return String.format("%s{%d,%s,%s,completed=%d,failed=%d}", getClass().getSimpleName(), _index, _name, _status, _completed, _failed);
    }
}
