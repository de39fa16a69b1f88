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

package org.mortbay.workpool.queue;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A thread safe FIFO queue, optionally bounded, with explicit waits on
 * the four transitions of its state: empty, full, not empty and not full.</p>
 * <p>Every operation briefly owns a single internal lock. A caller may also
 * take that lock manually, either with {@link #lock()} or by a successful
 * {@code waitFor*} call, so that several operations run as one critical
 * section:</p>
 * <pre>
 * try (ConcurrentQueue&lt;Job&gt;.Guard guard = queue.waitForNotEmpty())
 * {
 *     Job job = queue.dequeue();
 *     ...
 * }
 * </pre>
 * <p>While a thread holds the manual lock, the wake ups caused by its own
 * operations are deferred and broadcast once, when the lock is released.</p>
 * <p>{@link #cancelWait()} wakes every waiting thread without consuming
 * any element, and the queue remains usable. {@link #destroy()} wakes every
 * waiting thread too, but the queue becomes unusable.</p>
 *
 * @param <E> The element type
 */
public class ConcurrentQueue<E>
{
    private static final Logger LOG = LoggerFactory.getLogger(ConcurrentQueue.class);

    public static final int UNLIMITED = ArrayFifo.UNLIMITED;

    private final ArrayFifo<E> _fifo;
    private final ReentrantLock _lock = new ReentrantLock();
    private final Condition _isEmpty = _lock.newCondition();
    private final Condition _isFull = _lock.newCondition();
    private final Condition _notEmpty = _lock.newCondition();
    private final Condition _notFull = _lock.newCondition();
    private final Condition _lockFree = _lock.newCondition();
    private final AtomicInteger _waitingForLock = new AtomicInteger();
    private volatile boolean _destroying;
    private volatile Thread _owner;
    private Guard _guard;
    private int _waitingForCondition;
    private long _cancelGeneration;
    private boolean _signalIsEmpty;
    private boolean _signalIsFull;
    private boolean _signalNotEmpty;
    private boolean _signalNotFull;

    /**
     * Creates an unbounded queue.
     */
    public ConcurrentQueue()
    {
        this(UNLIMITED, null);
    }

    /**
     * @param capacity the maximum number of elements, or {@link #UNLIMITED}
     */
    public ConcurrentQueue(int capacity)
    {
        this(capacity, null);
    }

    /**
     * @param capacity the maximum number of elements, or {@link #UNLIMITED}
     * @param disposer applied to every element discarded by {@link #clear()} or {@link #destroy()}, may be null
     */
    public ConcurrentQueue(int capacity, Consumer<? super E> disposer)
    {
        _fifo = new ArrayFifo<>(capacity, disposer);
    }

    public int getCapacity()
    {
        return _fifo.getCapacity();
    }

    public int size()
    {
        boolean acquired = lockQueue();
        try
        {
            return _fifo.size();
        }
        finally
        {
            releaseQueue(acquired);
        }
    }

    public boolean isEmpty()
    {
        boolean acquired = lockQueue();
        try
        {
            return _fifo.isEmpty();
        }
        finally
        {
            releaseQueue(acquired);
        }
    }

    /**
     * @return whether the queue holds {@link #getCapacity()} elements, always false if unbounded
     */
    public boolean isFull()
    {
        boolean acquired = lockQueue();
        try
        {
            return _fifo.isFull();
        }
        finally
        {
            releaseQueue(acquired);
        }
    }

    public boolean isDestroyed()
    {
        return _destroying;
    }

    /**
     * @return whether the calling thread holds the manual lock
     */
    public boolean isLockedByCurrentThread()
    {
        return _owner == Thread.currentThread();
    }

    /**
     * <p>Appends an element to the tail of the queue.</p>
     *
     * @param item the element to append
     * @return false if the queue is full, in which case it is left unchanged
     * @throws QueueDestroyedException if the queue was destroyed
     */
    public boolean enqueue(E item)
    {
        Objects.requireNonNull(item);
        boolean acquired = lockQueue();
        try
        {
            if (!_fifo.offer(item))
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Full, rejected {} in {}", item, this);
                return false;
            }
            _signalNotEmpty = true;
            if (_fifo.isFull())
                _signalIsFull = true;
            sendSignals();
            return true;
        }
        finally
        {
            releaseQueue(acquired);
        }
    }

    /**
     * <p>Removes the element at the head of the queue.</p>
     *
     * @return the head element, or null if the queue is empty
     * @throws QueueDestroyedException if the queue was destroyed
     */
    public E dequeue()
    {
        boolean acquired = lockQueue();
        try
        {
            E item = _fifo.poll();
            if (item == null)
                return null;
            _signalNotFull = true;
            if (_fifo.isEmpty())
                _signalIsEmpty = true;
            sendSignals();
            return item;
        }
        finally
        {
            releaseQueue(acquired);
        }
    }

    /**
     * @return the head element without removing it, or null if the queue is empty
     * @throws QueueDestroyedException if the queue was destroyed
     */
    public E peek()
    {
        boolean acquired = lockQueue();
        try
        {
            return _fifo.peek();
        }
        finally
        {
            releaseQueue(acquired);
        }
    }

    /**
     * <p>Removes all the elements, passing them to the disposer if any.</p>
     *
     * @throws QueueDestroyedException if the queue was destroyed
     */
    public void clear()
    {
        boolean acquired = lockQueue();
        try
        {
            _fifo.clear();
            _signalNotFull = true;
            _signalIsEmpty = true;
            sendSignals();
        }
        finally
        {
            releaseQueue(acquired);
        }
    }

    /**
     * <p>Takes the manual lock, so that the calling thread may perform
     * several operations atomically.</p>
     *
     * @return the guard that releases the lock when closed
     * @throws DeadlockException if the calling thread already holds the manual lock
     * @throws QueueDestroyedException if the queue was destroyed
     */
    public Guard lock()
    {
        checkNotDestroyed();
        checkNotOwner();
        lockQueue();
        return manualLock();
    }

    /**
     * <p>Releases the manual lock and broadcasts the wake ups deferred while it was held.</p>
     *
     * @throws IllegalMonitorStateException if the calling thread does not hold the manual lock
     */
    public void unlock()
    {
        if (_owner != Thread.currentThread())
            throw new IllegalMonitorStateException("Not locked by " + Thread.currentThread().getName());
        _owner = null;
        Guard guard = _guard;
        _guard = null;
        if (guard != null)
            guard._released = true;
        sendSignals();
        releaseQueue(true);
    }

    /**
     * <p>Wakes every thread waiting in a {@code waitFor*} method, which then
     * throws {@link WaitCancelledException} without checking its condition.</p>
     * <p>Only the waits started before this call are cancelled: a wait started
     * afterwards, even while woken threads are still leaving, is not affected.
     * If no thread is waiting, this is a no-op.</p>
     *
     * @throws QueueDestroyedException if the queue was destroyed
     */
    public void cancelWait()
    {
        boolean acquired = lockQueue();
        try
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Cancelling {} waiter(s) on {}", _waitingForCondition, this);
            if (_waitingForCondition > 0)
            {
                _cancelGeneration++;
                wakeAll();
            }
        }
        finally
        {
            releaseQueue(acquired);
        }
    }

    /**
     * <p>Destroys the queue.</p>
     * <p>Threads waiting in a {@code waitFor*} method or for the internal lock
     * are woken and throw {@link QueueDestroyedException}; this method returns
     * only once no thread is left waiting for the internal lock. The remaining
     * elements are passed to the disposer if any.</p>
     *
     * @throws QueueDestroyedException if the queue was already destroyed
     */
    public void destroy()
    {
        checkNotDestroyed();
        boolean acquired = lockQueue();
        _destroying = true;
        try
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Destroying {}", this);
            wakeAll();
            while (_waitingForLock.get() > 0)
            {
                _lockFree.awaitUninterruptibly();
            }
            _fifo.clear();
            if (!acquired)
            {
                // Destroyed by the manual owner.
                _owner = null;
                if (_guard != null)
                    _guard._released = true;
                _guard = null;
            }
        }
        finally
        {
            _lock.unlock();
        }
    }

    /**
     * <p>Waits until the queue is empty.</p>
     *
     * @return the guard of the manual lock, held by the calling thread
     * @throws InterruptedException if the calling thread is interrupted
     * @throws WaitCancelledException if {@link #cancelWait()} was called
     * @throws DeadlockException if the calling thread already holds the manual lock
     * @throws QueueDestroyedException if the queue was or is being destroyed
     */
    public Guard waitForEmpty() throws InterruptedException, WaitCancelledException
    {
        return untimed(_isEmpty, _fifo::isEmpty);
    }

    /**
     * <p>Waits at most the given time until the queue is empty.</p>
     *
     * @param timeout the maximum time to wait, or 0 to wait forever
     * @param unit the unit of the timeout
     * @return the guard of the manual lock, held by the calling thread
     * @throws InterruptedException if the calling thread is interrupted
     * @throws WaitCancelledException if {@link #cancelWait()} was called
     * @throws TimeoutException if the queue did not become empty in time
     */
    public Guard waitForEmpty(long timeout, TimeUnit unit) throws InterruptedException, WaitCancelledException, TimeoutException
    {
        return waitFor(_isEmpty, _fifo::isEmpty, timeout, unit);
    }

    /**
     * <p>Waits until the queue is not empty.</p>
     *
     * @return the guard of the manual lock, held by the calling thread
     * @throws InterruptedException if the calling thread is interrupted
     * @throws WaitCancelledException if {@link #cancelWait()} was called
     * @throws DeadlockException if the calling thread already holds the manual lock
     * @throws QueueDestroyedException if the queue was or is being destroyed
     */
    public Guard waitForNotEmpty() throws InterruptedException, WaitCancelledException
    {
        return untimed(_notEmpty, () -> !_fifo.isEmpty());
    }

    public Guard waitForNotEmpty(long timeout, TimeUnit unit) throws InterruptedException, WaitCancelledException, TimeoutException
    {
        return waitFor(_notEmpty, () -> !_fifo.isEmpty(), timeout, unit);
    }

    /**
     * <p>Waits until the queue is full.</p>
     *
     * @return the guard of the manual lock, held by the calling thread
     * @throws UnsupportedOperationException if the queue is unbounded
     * @throws InterruptedException if the calling thread is interrupted
     * @throws WaitCancelledException if {@link #cancelWait()} was called
     */
    public Guard waitForFull() throws InterruptedException, WaitCancelledException
    {
        checkBounded();
        return untimed(_isFull, _fifo::isFull);
    }

    public Guard waitForFull(long timeout, TimeUnit unit) throws InterruptedException, WaitCancelledException, TimeoutException
    {
        checkBounded();
        return waitFor(_isFull, _fifo::isFull, timeout, unit);
    }

    /**
     * <p>Waits until the queue is not full.</p>
     *
     * @return the guard of the manual lock, held by the calling thread
     * @throws UnsupportedOperationException if the queue is unbounded
     * @throws InterruptedException if the calling thread is interrupted
     * @throws WaitCancelledException if {@link #cancelWait()} was called
     */
    public Guard waitForNotFull() throws InterruptedException, WaitCancelledException
    {
        checkBounded();
        return untimed(_notFull, () -> !_fifo.isFull());
    }

    public Guard waitForNotFull(long timeout, TimeUnit unit) throws InterruptedException, WaitCancelledException, TimeoutException
    {
        checkBounded();
        return waitFor(_notFull, () -> !_fifo.isFull(), timeout, unit);
    }

    private Guard untimed(Condition condition, BooleanSupplier predicate) throws InterruptedException, WaitCancelledException
    {
        try
        {
            return waitFor(condition, predicate, 0, TimeUnit.NANOSECONDS);
        }
        catch (TimeoutException x)
        {
            throw new IllegalStateException(x);
        }
    }

    private Guard waitFor(Condition condition, BooleanSupplier predicate, long timeout, TimeUnit unit) throws InterruptedException, WaitCancelledException, TimeoutException
    {
        if (timeout < 0)
            throw new IllegalArgumentException("Invalid timeout: " + timeout);
        Objects.requireNonNull(unit);
        checkNotDestroyed();
        checkNotOwner();

        boolean timed = timeout > 0;
        long nanos = unit.toNanos(timeout);
        lockQueue();
        boolean locked = false;
        long generation = _cancelGeneration;
        _waitingForCondition++;
        try
        {
            while (!predicate.getAsBoolean() && !_destroying && _cancelGeneration == generation)
            {
                if (!timed)
                {
                    condition.await();
                }
                else
                {
                    if (nanos <= 0)
                    {
                        if (LOG.isDebugEnabled())
                            LOG.debug("Timed out waiting on {}", this);
                        throw new TimeoutException();
                    }
                    nanos = condition.awaitNanos(nanos);
                }
            }

            // Destruction and cancellation take precedence over the condition.
            if (_destroying)
                throw new QueueDestroyedException("Destroyed while waiting");
            if (_cancelGeneration != generation)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Wait cancelled on {}", this);
                throw new WaitCancelledException();
            }

            Guard guard = manualLock();
            locked = true;
            return guard;
        }
        finally
        {
            _waitingForCondition--;
            if (!locked)
                releaseQueue(true);
        }
    }

    /**
     * @return true if the lock was acquired, false if the calling thread already holds the manual lock
     */
    private boolean lockQueue()
    {
        checkNotDestroyed();
        if (_owner == Thread.currentThread())
            return false;

        _waitingForLock.incrementAndGet();
        try
        {
            _lock.lock();
        }
        finally
        {
            _waitingForLock.decrementAndGet();
        }

        if (_destroying)
        {
            releaseQueue(true);
            throw new QueueDestroyedException("Destroyed while waiting for lock");
        }
        return true;
    }

    private void releaseQueue(boolean acquired)
    {
        if (!acquired)
            return;
        if (_destroying && _waitingForLock.get() == 0)
            _lockFree.signal();
        _lock.unlock();
    }

    private Guard manualLock()
    {
        _owner = Thread.currentThread();
        _guard = new Guard();
        return _guard;
    }

    private void sendSignals()
    {
        // Deferred until the manual owner unlocks.
        if (_owner == Thread.currentThread())
            return;

        if (_signalIsEmpty)
        {
            _signalIsEmpty = false;
            _isEmpty.signalAll();
        }
        if (_signalIsFull)
        {
            _signalIsFull = false;
            _isFull.signalAll();
        }
        if (_signalNotEmpty)
        {
            _signalNotEmpty = false;
            _notEmpty.signalAll();
        }
        if (_signalNotFull)
        {
            _signalNotFull = false;
            _notFull.signalAll();
        }
    }

    private void wakeAll()
    {
        _isEmpty.signalAll();
        _isFull.signalAll();
        _notEmpty.signalAll();
        _notFull.signalAll();
    }

    private void checkNotDestroyed()
    {
        if (_destroying)
            throw new QueueDestroyedException("Destroyed");
    }

    private void checkNotOwner()
    {
        if (_owner == Thread.currentThread())
            throw new DeadlockException("Already locked by " + Thread.currentThread().getName());
    }

    private void checkBounded()
    {
        if (getCapacity() == UNLIMITED)
            throw new UnsupportedOperationException("Unbounded queue is never full");
    }

    @Override
    public String toString()
    {
        Thread owner = _owner;
        return String.format("%s@%x{capacity=%d,owner=%s,destroying=%b}",
            getClass().getSimpleName(),
            hashCode(),
            getCapacity(),
            owner == null ? null : owner.getName(),
            _destroying);
    }

    /**
     * <p>The manual lock of a {@link ConcurrentQueue}, held by the thread
     * that obtained it.</p>
     * <p>Closing the guard is equivalent to {@link ConcurrentQueue#unlock()};
     * closing it again is a no-op. A guard must not be handed to another thread.</p>
     */
    public class Guard implements AutoCloseable
    {
        private final Thread _thread = Thread.currentThread();
        private boolean _released;

        private Guard()
        {
        }

        public ConcurrentQueue<E> getQueue()
        {
            return ConcurrentQueue.this;
        }

        @Override
        public void close()
        {
            if (Thread.currentThread() != _thread)
                throw new IllegalMonitorStateException("Guard of " + _thread.getName() + " closed by " + Thread.currentThread().getName());
            if (_released)
                return;
            unlock();
        }

        @Override
        public String toString()
        {
            return String.format("%s@%x{%s,released=%b}", Guard.class.getSimpleName(), hashCode(), _thread.getName(), _released);
        }
    }
}
