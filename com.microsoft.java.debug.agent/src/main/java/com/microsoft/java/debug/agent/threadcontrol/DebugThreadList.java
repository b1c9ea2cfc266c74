/*******************************************************************************
* Copyright (c) 2024 Microsoft Corporation and others.
* All rights reserved. This program and the accompanying materials
* are made available under the terms of the Eclipse Public License v1.0
* which accompanies this distribution, and is available at
* http://www.eclipse.org/legal/epl-v10.html
*
* Contributors:
*     Microsoft Corporation - initial API and implementation
*******************************************************************************/

package com.microsoft.java.debug.agent.threadcontrol;

import java.util.ArrayList;
import java.util.List;

import com.microsoft.java.debug.agent.DebugException;
import com.microsoft.java.debug.agent.Log;
import com.microsoft.java.debug.agent.collaborator.IDisposable;
import com.microsoft.java.debug.agent.runtime.ErrorCode;
import com.microsoft.java.debug.agent.runtime.IRuntimeThread;

/**
 * The agent's own threads. They are never suspended by the debugger.
 */
public class DebugThreadList {
    private final ThreadLock threadLock;
    private final int capacity;
    private final List<IRuntimeThread> debugThreads;

    DebugThreadList(ThreadLock threadLock, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("The debug thread capacity must be positive.");
        }
        this.threadLock = threadLock;
        this.capacity = capacity;
        this.debugThreads = new ArrayList<>(capacity);
    }

    /**
     * Register one of the agent's threads.
     *
     * @param thread the agent thread
     * @throws DebugException with {@link ErrorCode#OUT_OF_MEMORY} if the list is full
     */
    public void add(IRuntimeThread thread) throws DebugException {
        if (thread == null) {
            throw new IllegalArgumentException("Null thread is illegal for a debug thread.");
        }
        try (IDisposable lock = threadLock.acquire()) {
            if (debugThreads.size() >= capacity) {
                throw new DebugException(String.format("Cannot register more than %d debug threads", capacity),
                        ErrorCode.OUT_OF_MEMORY);
            }
            debugThreads.add(thread);
            Log.debug("debug thread %s registered", thread.name());
        }
    }

    /**
     * Remove one of the agent's threads.
     *
     * @param thread the agent thread
     * @throws DebugException with {@link ErrorCode#INVALID_THREAD} if the thread is not registered
     */
    public void remove(IRuntimeThread thread) throws DebugException {
        try (IDisposable lock = threadLock.acquire()) {
            if (!debugThreads.remove(thread)) {
                throw new DebugException("Not a debug thread", ErrorCode.INVALID_THREAD);
            }
        }
    }

    public boolean contains(IRuntimeThread thread) {
        try (IDisposable lock = threadLock.acquire()) {
            return debugThreads.contains(thread);
        }
    }

    public int size() {
        try (IDisposable lock = threadLock.acquire()) {
            return debugThreads.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
