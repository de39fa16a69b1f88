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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

import org.mortbay.workpool.queue.ConcurrentQueue;
import org.mortbay.workpool.queue.QueueDestroyedException;
import org.mortbay.workpool.queue.WaitCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A fixed set of worker threads consuming tasks from a bounded
 * {@link ConcurrentQueue}.</p>
 * <p>The workers are started when the pool is created and run until the
 * pool is {@link #destroy(ShutdownMode) destroyed}. What happens when a task
 * is added to a full queue depends on the {@link ThreadPoolAttributes}: the
 * caller either gets a {@link WorkRejectedException} or waits for space,
 * possibly with a timeout.</p>
 * <p>A task that throws is logged and recorded in its worker's {@link WorkerInfo}.
 * By default the worker goes on with the next task; with
 * {@link ThreadPoolAttributes#setBlockOnError(boolean) block on error} it is
 * {@link WorkerInfo.Status#BLOCKED blocked} instead, and runs no more tasks
 * until {@link #restartWorker(int) restarted}.</p>
 */
public class ThreadPool implements Executor
{
    private static final Logger LOG = LoggerFactory.getLogger(ThreadPool.class);
    private static final AtomicInteger __pools = new AtomicInteger();

    // Idle workers wake up at this interval to check for shutdown.
    private static final long POLL_INTERVAL_MS = 250;

    private final String _name;
    private final ThreadPoolAttributes _attributes;
    private final ConcurrentQueue<Runnable> _queue;
    private final ReentrantLock _idleLock = new ReentrantLock();
    private final Condition _idle = _idleLock.newCondition();
    private final AtomicBoolean _destroyed = new AtomicBoolean();
    private final Worker[] _workers;
    private int _busy;
    private volatile ShutdownMode _shutdown = ShutdownMode.RUNNING;

    public ThreadPool()
    {
        this(new ThreadPoolAttributes());
    }

    public ThreadPool(ThreadPoolAttributes attributes)
    {
        this("workpool-" + __pools.incrementAndGet(), attributes);
    }

    /**
     * <p>Creates the pool and starts its workers, named {@code <name>-<index>}.</p>
     * <p>If a worker cannot be started, the workers already started are
     * stopped and the failure is rethrown.</p>
     *
     * @param name the name of the pool
     * @param attributes the attributes, copied
     */
    public ThreadPool(String name, ThreadPoolAttributes attributes)
    {
        _name = Objects.requireNonNull(name);
        _attributes = new ThreadPoolAttributes(attributes);
        _queue = new ConcurrentQueue<>(_attributes.getQueueSize(), this::dropped);
        _workers = new Worker[_attributes.getThreadCount()];
        try
        {
            for (int i = 0; i < _workers.length; i++)
            {
                Worker worker = new Worker(i);
                _workers[i] = worker;
                worker._thread.start();
            }
        }
        catch (RuntimeException | Error x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Could not start {}", this, x);
            try
            {
                destroy(ShutdownMode.GRACEFUL);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                x.addSuppressed(e);
            }
            throw x;
        }
        if (LOG.isDebugEnabled())
            LOG.debug("Started {} with {}", this, _attributes);
    }

    /**
     * <p>Creates a worker thread, not started.</p>
     *
     * @param runnable the worker loop
     * @param name the name of the thread
     * @return the new thread
     */
    protected Thread newThread(Runnable runnable, String name)
    {
        return new Thread(runnable, name);
    }

    public String getName()
    {
        return _name;
    }

    /**
     * @return a copy of the attributes of this pool
     */
    public ThreadPoolAttributes getAttributes()
    {
        return new ThreadPoolAttributes(_attributes);
    }

    /**
     * <p>Adds a task, waiting for space in the queue or not according to
     * the {@link ThreadPoolAttributes#isBlockOnAdd() block on add} and
     * {@link ThreadPoolAttributes#isTimedWait() timed wait} attributes.</p>
     *
     * @param task the task to run
     * @throws WorkRejectedException if the queue is full and the pool does not block,
     * or if the pool is shutting down, or if the wait was cancelled
     * @throws TimeoutException if the pool uses timed waits and no space became available in time
     * @throws InterruptedException if interrupted while waiting for space
     */
    public void addWork(Runnable task) throws InterruptedException, TimeoutException
    {
        Objects.requireNonNull(task);
        if (!_attributes.isBlockOnAdd())
            enqueue(task, -1);
        else if (_attributes.isTimedWait())
            enqueue(task, _attributes.getTimeout(TimeUnit.NANOSECONDS));
        else
            enqueue(task, 0);
    }

    /**
     * <p>Adds a task that applies the given function to the given arguments.</p>
     *
     * @see #addWork(Runnable)
     */
    public <A, B> void addWork(BiConsumer<? super A, ? super B> function, A arg1, B arg2) throws InterruptedException, TimeoutException
    {
        Objects.requireNonNull(function);
        addWork(() -> function.accept(arg1, arg2));
    }

    /**
     * <p>Adds a task, waiting at most the given time for space in the queue
     * whatever the attributes of the pool.</p>
     *
     * @param task the task to run
     * @param timeout the maximum time to wait, must be positive
     * @param unit the unit of the timeout
     * @throws WorkRejectedException if the pool is shutting down or the wait was cancelled
     * @throws TimeoutException if no space became available in time
     * @throws InterruptedException if interrupted while waiting for space
     */
    public void timedAddWork(Runnable task, long timeout, TimeUnit unit) throws InterruptedException, TimeoutException
    {
        Objects.requireNonNull(task);
        if (timeout <= 0)
            throw new IllegalArgumentException("Invalid timeout: " + timeout);
        enqueue(task, unit.toNanos(timeout));
    }

    @Override
    public void execute(Runnable task)
    {
        try
        {
            addWork(task);
        }
        catch (InterruptedException x)
        {
            Thread.currentThread().interrupt();
            throw new RejectedExecutionException(x);
        }
        catch (TimeoutException x)
        {
            throw new RejectedExecutionException(x);
        }
    }

    /**
     * @param nanos negative to not wait, 0 to wait forever
     */
    private void enqueue(Runnable task, long nanos) throws InterruptedException, TimeoutException
    {
        if (_shutdown != ShutdownMode.RUNNING)
            throw new WorkRejectedException("Shutting down " + this);

        try (ConcurrentQueue<Runnable>.Guard ignored = nanos < 0 ? _queue.lock() : _queue.waitForNotFull(nanos, TimeUnit.NANOSECONDS))
        {
            if (_shutdown != ShutdownMode.RUNNING)
                throw new WorkRejectedException("Shutting down " + this);
            if (!_queue.enqueue(task))
                throw new WorkRejectedException("Queue full " + this);
            if (LOG.isDebugEnabled())
                LOG.debug("Queued {} in {}", task, this);
        }
        catch (WaitCancelledException x)
        {
            throw new WorkRejectedException("Wait cancelled " + this, x);
        }
        catch (QueueDestroyedException x)
        {
            throw new WorkRejectedException("Destroyed " + this, x);
        }
    }

    /**
     * <p>Waits until the queue is empty and no worker is running a task.</p>
     * <p>If the pool uses {@link ThreadPoolAttributes#isTimedWait() timed waits},
     * waits at most the {@link ThreadPoolAttributes#getTimeout(TimeUnit) timeout}.</p>
     *
     * @throws IllegalStateException if called from a worker of this pool
     * @throws WaitCancelledException if {@link #cancelWait()} was called
     * @throws TimeoutException if the pool uses timed waits and did not become idle in time
     * @throws InterruptedException if interrupted while waiting
     */
    public void waitIdle() throws InterruptedException, WaitCancelledException, TimeoutException
    {
        awaitIdle(_attributes.isTimedWait() ? _attributes.getTimeout(TimeUnit.NANOSECONDS) : 0);
    }

    /**
     * <p>Waits at most the given time until the queue is empty and no worker is running a task.</p>
     *
     * @param timeout the maximum time to wait, must be positive
     * @param unit the unit of the timeout
     * @see #waitIdle()
     */
    public void timedWaitIdle(long timeout, TimeUnit unit) throws InterruptedException, WaitCancelledException, TimeoutException
    {
        if (timeout <= 0)
            throw new IllegalArgumentException("Invalid timeout: " + timeout);
        awaitIdle(unit.toNanos(timeout));
    }

    private void awaitIdle(long nanos) throws InterruptedException, WaitCancelledException, TimeoutException
    {
        if (isWorkerThread())
            throw new IllegalStateException("Cannot wait for idle from worker " + Thread.currentThread().getName());

        long deadline = System.nanoTime() + nanos;
        while (true)
        {
            // A worker counts itself busy before releasing the queue lock,
            // so an empty queue with no busy worker is idle.
            try (ConcurrentQueue<Runnable>.Guard ignored = waitForEmpty(nanos, deadline))
            {
                if (isIdle())
                    return;
            }

            _idleLock.lock();
            try
            {
                while (_busy > 0)
                {
                    if (nanos == 0)
                        _idle.await();
                    else
                        _idle.awaitNanos(remaining(deadline));
                }
            }
            finally
            {
                _idleLock.unlock();
            }
        }
    }

    private ConcurrentQueue<Runnable>.Guard waitForEmpty(long nanos, long deadline) throws InterruptedException, WaitCancelledException, TimeoutException
    {
        if (nanos == 0)
            return _queue.waitForEmpty();
        return _queue.waitForEmpty(remaining(deadline), TimeUnit.NANOSECONDS);
    }

    private static long remaining(long deadline) throws TimeoutException
    {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0)
            throw new TimeoutException();
        return remaining;
    }

    private boolean isIdle()
    {
        _idleLock.lock();
        try
        {
            return _busy == 0;
        }
        finally
        {
            _idleLock.unlock();
        }
    }

    /**
     * <p>Cancels every wait on the task queue: callers blocked adding work get
     * a {@link WorkRejectedException}, callers of {@link #waitIdle()} get a
     * {@link WaitCancelledException}. Idle workers keep waiting for work.</p>
     */
    public void cancelWait()
    {
        _queue.cancelWait();
    }

    /**
     * <p>Releases the worker if it is {@link WorkerInfo.Status#BLOCKED blocked}
     * after a failed task, clearing its {@link WorkerInfo#getLastFailure() last failure}.</p>
     *
     * @param index the index of the worker, from 0 to {@link #getThreadCount()} excluded
     * @return whether the worker was blocked
     */
    public boolean restartWorker(int index)
    {
        return _workers[Objects.checkIndex(index, _workers.length)].restart();
    }

    /**
     * <p>Releases every {@link WorkerInfo.Status#BLOCKED blocked} worker.</p>
     *
     * @return the number of workers released
     * @see #restartWorker(int)
     */
    public int refresh()
    {
        int restarted = 0;
        for (Worker worker : _workers)
        {
            if (worker != null && worker.restart())
                restarted++;
        }
        return restarted;
    }

    /**
     * <p>Interrupts the worker if it is running a task. A task blocked in an
     * interruptible call, such as a sleep or a lock wait, aborts it.</p>
     *
     * @param index the index of the worker, from 0 to {@link #getThreadCount()} excluded
     * @return whether the worker was running a task
     */
    public boolean interruptWorker(int index)
    {
        return _workers[Objects.checkIndex(index, _workers.length)].interruptTask();
    }

    /**
     * <p>Interrupts every worker running a task.</p>
     *
     * @return the number of workers interrupted
     * @see #interruptWorker(int)
     */
    public int interruptAll()
    {
        int interrupted = 0;
        for (Worker worker : _workers)
        {
            if (worker != null && worker.interruptTask())
                interrupted++;
        }
        return interrupted;
    }

    /**
     * <p>Stops the workers and destroys the task queue.</p>
     * <p>Blocked workers are released first, and failed tasks no longer block
     * their worker. A {@link ShutdownMode#GRACEFUL graceful} shutdown then waits for the
     * pool to be idle and lets the workers run whatever was queued meanwhile.
     * A {@link ShutdownMode#FORCEFUL forceful} shutdown lets running tasks
     * complete, interrupting them if the {@link CancelType} is
     * {@link CancelType#ASYNCHRONOUS asynchronous}, and drops queued tasks.
     * In both cases this method returns once every worker has exited, so a
     * {@link CancelType#DEFERRED deferred} forceful shutdown waits for a task
     * stuck in a blocking call unless {@link #interruptAll()} aborts it.</p>
     *
     * @param mode how to shut down
     * @throws IllegalArgumentException if the mode is null or {@link ShutdownMode#RUNNING}
     * @throws IllegalStateException if the pool was already destroyed, or if called from a worker
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    public void destroy(ShutdownMode mode) throws InterruptedException
    {
        if (mode == null || mode == ShutdownMode.RUNNING)
            throw new IllegalArgumentException("Invalid shutdown mode: " + mode);
        if (isWorkerThread())
            throw new IllegalStateException("Cannot destroy from worker " + Thread.currentThread().getName());
        if (!_destroyed.compareAndSet(false, true))
            throw new IllegalStateException("Already destroyed " + this);

        if (LOG.isDebugEnabled())
            LOG.debug("Destroying {} {}", mode, this);

        int restarted = refresh();
        if (restarted > 0 && LOG.isDebugEnabled())
            LOG.debug("Released {} blocked worker(s) of {}", restarted, this);

        if (mode == ShutdownMode.GRACEFUL)
            drain();

        try (ConcurrentQueue<Runnable>.Guard ignored = _queue.lock())
        {
            _shutdown = mode;
        }
        _queue.cancelWait();

        if (mode == ShutdownMode.FORCEFUL && _attributes.getCancelType() == CancelType.ASYNCHRONOUS)
        {
            for (Worker worker : _workers)
            {
                if (worker != null)
                    worker._thread.interrupt();
            }
        }

        for (Worker worker : _workers)
        {
            if (worker != null)
                worker._thread.join();
        }

        _queue.destroy();
        if (LOG.isDebugEnabled())
            LOG.debug("Destroyed {}", this);
    }

    private void drain() throws InterruptedException
    {
        while (true)
        {
            try
            {
                awaitIdle(0);
                return;
            }
            catch (WaitCancelledException x)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Idle wait cancelled while destroying {}", this, x);
            }
            catch (TimeoutException x)
            {
                throw new IllegalStateException(x);
            }
        }
    }

    private void dropped(Runnable task)
    {
        if (LOG.isDebugEnabled())
            LOG.debug("Dropped {} from {}", task, this);
    }

    public boolean isDestroyed()
    {
        return _destroyed.get();
    }

    public ShutdownMode getShutdownMode()
    {
        return _shutdown;
    }

    public int getThreadCount()
    {
        return _workers.length;
    }

    /**
     * @return the capacity of the task queue
     */
    public int getQueueSize()
    {
        return _attributes.getQueueSize();
    }

    /**
     * @return the number of tasks waiting in the queue
     */
    public int getQueued()
    {
        try
        {
            return _queue.size();
        }
        catch (QueueDestroyedException x)
        {
            return 0;
        }
    }

    public int getIdleThreads()
    {
        return count(WorkerInfo.Status.IDLE);
    }

    public int getBusyThreads()
    {
        return count(WorkerInfo.Status.RUNNING);
    }

    public int getBlockedThreads()
    {
        return count(WorkerInfo.Status.BLOCKED);
    }

    private int count(WorkerInfo.Status status)
    {
        int count = 0;
        for (Worker worker : _workers)
        {
            if (worker != null && worker._status == status)
                count++;
        }
        return count;
    }

    /**
     * @param index the index of the worker, from 0 to {@link #getThreadCount()} excluded
     * @return a snapshot of the worker
     */
    public WorkerInfo getWorkerInfo(int index)
    {
        return _workers[Objects.checkIndex(index, _workers.length)].info();
    }

    public List<WorkerInfo> getWorkerInfos()
    {
        List<WorkerInfo> infos = new ArrayList<>(_workers.length);
        for (Worker worker : _workers)
        {
            infos.add(worker.info());
        }
        return infos;
    }

    private boolean isWorkerThread()
    {
        Thread thread = Thread.currentThread();
        for (Worker worker : _workers)
        {
            if (worker != null && worker._thread == thread)
                return true;
        }
        return false;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,%s,threads=%d,queue=%d}",
            getClass().getSimpleName(),
            hashCode(),
            _name,
            _shutdown,
            _workers.length,
            _attributes.getQueueSize());
    }

    private class Worker implements Runnable
    {
        private final int _index;
        private final Thread _thread;
        private final AtomicLong _completed = new AtomicLong();
        private final AtomicLong _failed = new AtomicLong();
        private final ReentrantLock _infoLock = new ReentrantLock();
        private final Condition _restarted = _infoLock.newCondition();
        private volatile WorkerInfo.Status _status = WorkerInfo.Status.STOPPED;
        private volatile Throwable _lastFailure;
        private boolean _blocked;

        private Worker(int index)
        {
            _index = index;
            _thread = newThread(this, _name + "-" + index);
        }

        @Override
        public void run()
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Starting {}", this);
            try
            {
                while (true)
                {
                    _status = WorkerInfo.Status.IDLE;
                    Runnable task = take();
                    if (task == null)
                        break;
                    runTask(task);
                    awaitRestart();
                }
            }
            finally
            {
                _status = WorkerInfo.Status.STOPPED;
                if (LOG.isDebugEnabled())
                    LOG.debug("Stopped {}", this);
            }
        }

        /**
         * @return the next task, or null if the worker must exit
         */
        private Runnable take()
        {
            while (true)
            {
                try
                {
                    ShutdownMode mode = _shutdown;
                    if (mode == ShutdownMode.FORCEFUL || mode == ShutdownMode.GRACEFUL && _queue.isEmpty())
                    {
                        _status = WorkerInfo.Status.DESTROYING;
                        return null;
                    }

                    try (ConcurrentQueue<Runnable>.Guard ignored = _queue.waitForNotEmpty(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS))
                    {
                        if (_shutdown == ShutdownMode.FORCEFUL)
                            continue;
                        Runnable task = _queue.dequeue();
                        _idleLock.lock();
                        try
                        {
                            _busy++;
                        }
                        finally
                        {
                            _idleLock.unlock();
                        }
                        _status = WorkerInfo.Status.RUNNING;
                        return task;
                    }
                }
                catch (TimeoutException | WaitCancelledException | InterruptedException x)
                {
                    // Check the shutdown mode again.
                    if (LOG.isDebugEnabled())
                        LOG.debug("No work for {}: {}", this, x.toString());
                }
                catch (QueueDestroyedException x)
                {
                    _status = WorkerInfo.Status.DESTROYING;
                    return null;
                }
            }
        }

        private void runTask(Runnable task)
        {
            boolean failed = false;
            try
            {
                task.run();
                _completed.incrementAndGet();
            }
            catch (Throwable x)
            {
                failed = true;
                _failed.incrementAndGet();
                _lastFailure = x;
                LOG.warn("Task {} failed in {}", task, _thread.getName(), x);
            }
            finally
            {
                _infoLock.lock();
                try
                {
                    // Clear any interrupt aimed at the task.
                    Thread.interrupted();
                    _blocked = failed && _attributes.isBlockOnError() && !_destroyed.get();
                    _status = _blocked ? WorkerInfo.Status.BLOCKED : WorkerInfo.Status.IDLE;
                }
                finally
                {
                    _infoLock.unlock();
                }
                _idleLock.lock();
                try
                {
                    if (--_busy == 0)
                        _idle.signalAll();
                }
                finally
                {
                    _idleLock.unlock();
                }
            }
        }

        private void awaitRestart()
        {
            _infoLock.lock();
            try
            {
                if (_blocked && LOG.isDebugEnabled())
                    LOG.debug("Blocked {} until restarted", this);
                while (_blocked)
                {
                    _restarted.awaitUninterruptibly();
                }
            }
            finally
            {
                _infoLock.unlock();
            }
        }

        private boolean restart()
        {
            _infoLock.lock();
            try
            {
                if (!_blocked)
                    return false;
                _blocked = false;
                _lastFailure = null;
                _status = WorkerInfo.Status.IDLE;
                _restarted.signal();
                if (LOG.isDebugEnabled())
                    LOG.debug("Restarted {}", this);
                return true;
            }
            finally
            {
                _infoLock.unlock();
            }
        }

        private boolean interruptTask()
        {
            _infoLock.lock();
            try
            {
                if (_status != WorkerInfo.Status.RUNNING)
                    return false;
                _thread.interrupt();
                return true;
            }
            finally
            {
                _infoLock.unlock();
            }
        }

        private WorkerInfo info()
        {
            return new WorkerInfo(_index, _thread.getName(), _status, _completed.get(), _failed.get(), _lastFailure);
        }

        @Override
        public String toString()
        {
            return String.format("%s@%x{%s,%s}", getClass().getSimpleName(), hashCode(), _thread.getName(), _status);
        }
    }
}
