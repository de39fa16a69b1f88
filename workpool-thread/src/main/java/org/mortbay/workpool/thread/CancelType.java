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
 * How the workers of a {@link ThreadPool} are cancelled by a
 * {@link ShutdownMode#FORCEFUL forceful} shutdown.
 */
public enum CancelType
{
    /**
     * <p>Workers leave their loop once their current task, if any, completes.</p>
     * <p>A running task is not interrupted, so a task stuck in a blocking call
     * delays the shutdown until it returns. {@link ThreadPool#interruptAll()}
     * may be used to abort such a task.</p>
     */
    DEFERRED,
    /**
     * As {@link #DEFERRED}, but workers are also interrupted so that a task
     * blocked in an interruptible call aborts promptly.
     */
    ASYNCHRONOUS
}
