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

package com.microsoft.java.debug.agent.runtime;

import java.util.List;

import com.microsoft.java.debug.agent.DebugException;

/**
 * The primitives the thread control core needs from the debuggee runtime.
 * Single-thread primitives report failure with a {@link DebugException} whose
 * {@link DebugException#getError()} is one of {@link ErrorCode}; list primitives
 * return one result per requested thread, in request order.
 */
public interface IRuntimeControl {
    /**
     * Get the state bits of the thread, see {@link ThreadStates}.
     */
    int getThreadState(IRuntimeThread thread) throws DebugException;

    void suspendThread(IRuntimeThread thread) throws DebugException;

    void resumeThread(IRuntimeThread thread) throws DebugException;

    List<ErrorCode> suspendThreadList(List<IRuntimeThread> threads) throws DebugException;

    List<ErrorCode> resumeThreadList(List<IRuntimeThread> threads) throws DebugException;

    /**
     * Suspend all virtual threads except the ones in the exclude list.
     */
    void suspendAllVirtualThreads(List<IRuntimeThread> except) throws DebugException;

    /**
     * Resume all virtual threads except the ones in the exclude list.
     */
    void resumeAllVirtualThreads(List<IRuntimeThread> except) throws DebugException;

    /**
     * Set the notification mode of an event kind. A null thread sets the mode globally.
     */
    void setEventNotificationMode(EventMode mode, EventIndex event, IRuntimeThread thread) throws DebugException;

    void popFrame(IRuntimeThread thread) throws DebugException;

    void interruptThread(IRuntimeThread thread) throws DebugException;

    void stopThread(IRuntimeThread thread, Object throwable) throws DebugException;

    /**
     * All live platform threads. Virtual threads are not included.
     */
    List<IRuntimeThread> getAllThreads() throws DebugException;

    /**
     * The runtime thread the caller is executing on, or null if it is not a runtime thread.
     */
    IRuntimeThread getCurrentThread();
}
