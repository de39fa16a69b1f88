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

import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ThreadPoolAttributesTest
{
    @AfterEach
    public void clearProperties()
    {
        System.clearProperty(ThreadPoolAttributes.THREAD_COUNT_PROPERTY);
        System.clearProperty(ThreadPoolAttributes.QUEUE_SIZE_PROPERTY);
        System.clearProperty(ThreadPoolAttributes.TIMEOUT_PROPERTY);
    }

    @Test
    public void testDefaults()
    {
        ThreadPoolAttributes attributes = new ThreadPoolAttributes();
        assertEquals(CancelType.DEFERRED, attributes.getCancelType());
        assertFalse(attributes.isTimedWait());
        assertEquals(10, attributes.getTimeout(TimeUnit.SECONDS));
        assertFalse(attributes.isBlockOnAdd());
        assertFalse(attributes.isBlockOnError());
        assertEquals(ThreadPoolAttributes.DEFAULT_THREADS, attributes.getThreadCount());
        assertEquals(ThreadPoolAttributes.DEFAULT_QUEUE_SIZE, attributes.getQueueSize());
    }

    @Test
    public void testSetters()
    {
        ThreadPoolAttributes attributes = new ThreadPoolAttributes();
        assertSame(attributes, attributes.setCancelType(CancelType.ASYNCHRONOUS)
            .setTimedWait(true)
            .setTimeout(1500, TimeUnit.MILLISECONDS)
            .setBlockOnAdd(true)
            .setBlockOnError(true)
            .setThreadCount(ThreadPoolAttributes.MAX_THREADS)
            .setQueueSize(1));

        assertEquals(CancelType.ASYNCHRONOUS, attributes.getCancelType());
        assertTrue(attributes.isTimedWait());
        assertEquals(1500, attributes.getTimeout(TimeUnit.MILLISECONDS));
        assertEquals(1, attributes.getTimeout(TimeUnit.SECONDS));
        assertTrue(attributes.isBlockOnAdd());
        assertTrue(attributes.isBlockOnError());
        assertEquals(64, attributes.getThreadCount());
        assertEquals(1, attributes.getQueueSize());
    }

    @Test
    public void testSubMillisecondTimeoutKept()
    {
        ThreadPoolAttributes attributes = new ThreadPoolAttributes().setTimeout(1500, TimeUnit.MICROSECONDS);
        assertEquals(1500, attributes.getTimeout(TimeUnit.MICROSECONDS));
        assertEquals(1_500_000, attributes.getTimeout(TimeUnit.NANOSECONDS));
        assertEquals(1, attributes.getTimeout(TimeUnit.MILLISECONDS));

        attributes.setTimeout(1, TimeUnit.NANOSECONDS);
        assertEquals(1, attributes.getTimeout(TimeUnit.NANOSECONDS));
        assertEquals(1, new ThreadPoolAttributes(attributes).getTimeout(TimeUnit.NANOSECONDS));
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 0, ThreadPoolAttributes.MAX_THREADS + 1})
    public void testInvalidThreadCount(int threadCount)
    {
        ThreadPoolAttributes attributes = new ThreadPoolAttributes();
        assertThrows(IllegalArgumentException.class, () -> attributes.setThreadCount(threadCount));
        assertEquals(ThreadPoolAttributes.DEFAULT_THREADS, attributes.getThreadCount());
    }

    @Test
    public void testInvalidValues()
    {
        ThreadPoolAttributes attributes = new ThreadPoolAttributes();
        assertThrows(IllegalArgumentException.class, () -> attributes.setQueueSize(0));
        assertThrows(IllegalArgumentException.class, () -> attributes.setTimeout(0, TimeUnit.SECONDS));
        assertThrows(IllegalArgumentException.class, () -> attributes.setTimeout(-5, TimeUnit.SECONDS));
        assertThrows(IllegalArgumentException.class, () -> attributes.setTimeout(0, TimeUnit.NANOSECONDS));
        assertThrows(NullPointerException.class, () -> attributes.setCancelType(null));
    }

    @Test
    public void testCopy()
    {
        ThreadPoolAttributes attributes = new ThreadPoolAttributes()
            .setThreadCount(2)
            .setQueueSize(3)
            .setBlockOnAdd(true)
            .setBlockOnError(true);
        ThreadPoolAttributes copy = new ThreadPoolAttributes(attributes);
        attributes.setThreadCount(7).setBlockOnAdd(false).setBlockOnError(false);

        assertEquals(2, copy.getThreadCount());
        assertEquals(3, copy.getQueueSize());
        assertTrue(copy.isBlockOnAdd());
        assertTrue(copy.isBlockOnError());
    }

    @Test
    public void testSystemProperties()
    {
        System.setProperty(ThreadPoolAttributes.THREAD_COUNT_PROPERTY, "8");
        System.setProperty(ThreadPoolAttributes.QUEUE_SIZE_PROPERTY, " 32 ");
        System.setProperty(ThreadPoolAttributes.TIMEOUT_PROPERTY, "2500");

        ThreadPoolAttributes attributes = new ThreadPoolAttributes();
        assertEquals(8, attributes.getThreadCount());
        assertEquals(32, attributes.getQueueSize());
        assertEquals(2500, attributes.getTimeout(TimeUnit.MILLISECONDS));
    }

    @Test
    public void testInvalidSystemPropertiesIgnored()
    {
        System.setProperty(ThreadPoolAttributes.THREAD_COUNT_PROPERTY, "1000");
        System.setProperty(ThreadPoolAttributes.QUEUE_SIZE_PROPERTY, "many");
        System.setProperty(ThreadPoolAttributes.TIMEOUT_PROPERTY, "0");

        ThreadPoolAttributes attributes = new ThreadPoolAttributes();
        assertEquals(ThreadPoolAttributes.DEFAULT_THREADS, attributes.getThreadCount());
        assertEquals(ThreadPoolAttributes.DEFAULT_QUEUE_SIZE, attributes.getQueueSize());
        assertEquals(ThreadPoolAttributes.DEFAULT_TIMEOUT_MS, attributes.getTimeout(TimeUnit.MILLISECONDS));
    }
}
