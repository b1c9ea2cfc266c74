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

import com.microsoft.java.debug.agent.runtime.EventIndex;
import com.microsoft.java.debug.agent.runtime.EventMode;
import com.microsoft.java.debug.agent.runtime.IRuntimeThread;

/**
 * An event notification mode change waiting for its thread to start.
 */
public class DeferredEventMode {
    private final IRuntimeThread thread;
    private final EventMode mode;
    private final EventIndex event;

    public DeferredEventMode(IRuntimeThread thread, EventMode mode, EventIndex event) {
        this.thread = thread;
        this.mode = mode;
        this.event = event;
    }

    public IRuntimeThread getThread() {
        return thread;
    }

    public EventMode getMode() {
        return mode;
    }

    public EventIndex getEvent() {
        return event;
    }

    @Override
    public String toString() {
        return String.format("%s %s for %s", mode, event, thread.name());
    }
}
