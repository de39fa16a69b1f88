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
 * <p>Thrown when a thread that already holds the manual lock of a
 * {@link ConcurrentQueue} tries to lock it again or to wait on it.</p>
 * <p>The lock is left held by that thread.</p>
 */
public class DeadlockException extends IllegalStateException
{
    public DeadlockException(String message)
    {
        super(message);
    }
}
