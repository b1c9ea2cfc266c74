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
import com.microsoft.java.debug.agent.runtime.IRuntimeThread;

/**
 * The parts of a dispatched event that thread control looks at.
 */
public class EventInfo {
    private final EventIndex event;
    private final IRuntimeThread thread;
    private final boolean virtual;
    private Object clazz;
    private Object method;
    private long location;

    /**
     * Create the info of an event reported on the given thread.
     *
     * @param event the event kind
     * @param thread the reporting thread
     */
    public EventInfo(EventIndex event, IRuntimeThread thread) {
        if (event == null) {
            throw new IllegalArgumentException("Null event is illegal for EventInfo.");
        }
        this.event = event;
        this.thread = thread;
        this.virtual = thread != null && thread.isVirtual();
    }

    public EventInfo(EventIndex event, IRuntimeThread thread, Object clazz, Object method, long location) {
        this(event, thread);
        this.clazz = clazz;
        this.method = method;
        this.location = location;
    }

    public EventIndex getEvent() {
        return event;
    }

    public IRuntimeThread getThread() {
        return thread;
    }

    public boolean isVirtual() {
        return virtual;
    }

    public Object getClazz() {
        return clazz;
    }

    public Object getMethod() {
        return method;
    }

    public long getLocation() {
        return location;
    }
}
