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

import java.util.concurrent.RejectedExecutionException;

/**
 * Thrown when a task cannot be added to a {@link ThreadPool}, either because
 * its queue is full and the pool does not block, or because the pool is
 * shutting down.
 */
public class WorkRejectedException extends RejectedExecutionException
{
    public WorkRejectedException(String message)
    {
        super(message);
    }

    public WorkRejectedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
