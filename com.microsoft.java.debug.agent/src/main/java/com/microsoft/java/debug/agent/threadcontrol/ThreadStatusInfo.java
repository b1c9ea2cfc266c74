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

import com.microsoft.java.debug.agent.runtime.ThreadStatus;

public class ThreadStatusInfo {
    private final ThreadStatus status;
    private final int suspendFlags;

    public ThreadStatusInfo(ThreadStatus status, int suspendFlags) {
        this.status = status;
        this.suspendFlags = suspendFlags;
    }

    public ThreadStatus getStatus() {
        return status;
    }

    public int getSuspendFlags() {
        return suspendFlags;
    }

    public boolean isSuspended() {
        return (suspendFlags & ThreadStatus.SUSPEND_STATUS_SUSPENDED) != 0;
    }
}
