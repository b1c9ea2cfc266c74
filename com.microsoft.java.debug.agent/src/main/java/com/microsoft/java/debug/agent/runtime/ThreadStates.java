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

/**
 * Bits of the thread state word returned by {@link IRuntimeControl#getThreadState(IRuntimeThread)}.
 */
public final class ThreadStates {
    public static final int ALIVE = 0x0001;
    public static final int TERMINATED = 0x0002;
    public static final int RUNNABLE = 0x0004;
    public static final int WAITING_INDEFINITELY = 0x0010;
    public static final int WAITING_WITH_TIMEOUT = 0x0020;
    public static final int SLEEPING = 0x0040;
    public static final int WAITING = 0x0080;
    public static final int IN_OBJECT_WAIT = 0x0100;
    public static final int PARKED = 0x0200;
    public static final int BLOCKED_ON_MONITOR_ENTER = 0x0400;
    public static final int SUSPENDED = 0x100000;
    public static final int INTERRUPTED = 0x200000;
    public static final int IN_NATIVE = 0x400000;

    public static boolean isAlive(int state) {
        return (state & ALIVE) != 0;
    }

    /**
     * A state word of zero means the thread object exists but was never started.
     */
    public static boolean isNew(int state) {
        return state == 0;
    }

    private ThreadStates() {

    }
}
