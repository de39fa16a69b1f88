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
import java.util.function.Consumer;

/**
 * <p>A FIFO backed by a growable circular array.</p>
 * <p>The FIFO has a capacity, which is the maximum number of elements it
 * may hold, or {@link #UNLIMITED} in which case the array grows as needed.</p>
 * <p>This class is not thread safe: callers must serialize access,
 * as {@link ConcurrentQueue} does with its own lock.</p>
 *
 * @param <E> The element type
 */
public class ArrayFifo<E>
{
    public static final int UNLIMITED = 0;
    public static final int DEFAULT_INITIAL = 16;

    private final int _capacity;
    private final Consumer<? super E> _disposer;
    private Object[] _elements;
    private int _head;
    private int _tail;
    private int _size;

    public ArrayFifo()
    {
        this(UNLIMITED, null);
    }

    public ArrayFifo(int capacity)
    {
        this(capacity, null);
    }

    /**
     * @param capacity the maximum number of elements, or {@link #UNLIMITED}
     * @param disposer applied to every element discarded by {@link #clear()}, may be null
     */
    public ArrayFifo(int capacity, Consumer<? super E> disposer)
    {
        if (capacity < 0)
            throw new IllegalArgumentException("Invalid capacity: " + capacity);
        _capacity = capacity;
        _disposer = disposer;
        _elements = new Object[capacity == UNLIMITED ? DEFAULT_INITIAL : Math.min(capacity, DEFAULT_INITIAL)];
    }

    /**
     * @return the maximum number of elements, or {@link #UNLIMITED}
     */
    public int getCapacity()
    {
        return _capacity;
    }

    public int size()
    {
        return _size;
    }

    public boolean isEmpty()
    {
        return _size == 0;
    }

    /**
     * @return true if the FIFO is bounded and holds {@link #getCapacity()} elements
     */
    public boolean isFull()
    {
        return _capacity != UNLIMITED && _size >= _capacity;
    }

    /**
     * @param e the element to append
     * @return false if the FIFO is full
     */
    public boolean offer(E e)
    {
        Objects.requireNonNull(e);
        if (isFull())
            return false;
        if (_size == _elements.length)
            grow();

        _elements[_tail] = e;
        _tail = (_tail + 1) % _elements.length;
        _size++;
        return true;
    }

    /**
     * @return the head element, removed, or null if empty
     */
    public E poll()
    {
        if (_size == 0)
            return null;
        E e = at(_head);
        _elements[_head] = null;
        _head = (_head + 1) % _elements.length;
        _size--;
        return e;
    }

    /**
     * @return the head element, not removed, or null if empty
     */
    public E peek()
    {
        if (_size == 0)
            return null;
        return at(_head);
    }

    /**
     * Removes every element, passing each one to the disposer if there is one.
     */
    public void clear()
    {
        while (_size > 0)
        {
            E e = poll();
            if (_disposer != null)
                _disposer.accept(e);
        }
        _head = 0;
        _tail = 0;
    }

    @SuppressWarnings("unchecked")
    private E at(int index)
    {
        return (E)_elements[index];
    }

    private void grow()
    {
        int length = _elements.length * 2;
        if (_capacity != UNLIMITED)
            length = Math.min(length, _capacity);
        Object[] elements = new Object[length];

        int split = _elements.length - _head;
        if (split >= _size)
        {
            System.arraycopy(_elements, _head, elements, 0, _size);
        }
        else
        {
            // 0                         _elements.length
            // ......_tail   _head..........
            System.arraycopy(_elements, _head, elements, 0, split);
            System.arraycopy(_elements, 0, elements, split, _size - split);
        }

        _elements = elements;
        _head = 0;
        _tail = _size;
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < _size; i++)
        {
            if (i > 0)
                builder.append(", ");
            builder.append(_elements[(_head + i) % _elements.length]);
        }
        return builder.append(']').toString();
    }
}
