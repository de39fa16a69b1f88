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

/**
 * <p>Thrown by a {@link ConcurrentQueue} operation that either started after
 * {@link ConcurrentQueue#destroy()} or was unblocked by it.</p>
 */
public class QueueDestroyedException extends IllegalStateException
{
    public QueueDestroyedException(String message)
    {
        super(message);
    }
}
