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
 * Debugger-visible thread status, derived from the runtime state bits.
 */
public enum ThreadStatus {
    UNKNOWN(-1),
    ZOMBIE(0),
    RUNNING(1),
    SLEEPING(2),
    MONITOR(3),
    WAIT(4);

    public static final int SUSPEND_STATUS_SUSPENDED = 0x1;

    private final int id;

    ThreadStatus(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    /**
     * Map the runtime state bits to a thread status.
     *
     * @param state the runtime state bits
     * @return the thread status
     */
    public static ThreadStatus fromState(int state) {
        if (!ThreadStates.isAlive(state)) {
            // terminated and never started threads both report as zombies
            return ZOMBIE;
        }
        if ((state & ThreadStates.SLEEPING) != 0) {
            return SLEEPING;
        } else if ((state & ThreadStates.BLOCKED_ON_MONITOR_ENTER) != 0) {
            return MONITOR;
        } else if ((state & ThreadStates.WAITING) != 0) {
            return WAIT;
        } else if ((state & ThreadStates.RUNNABLE) != 0) {
            return RUNNING;
        }
        return UNKNOWN;
    }

    public static int suspendFlags(int state) {
        return (state & ThreadStates.SUSPENDED) != 0 ? SUSPEND_STATUS_SUSPENDED : 0;
    }
}
