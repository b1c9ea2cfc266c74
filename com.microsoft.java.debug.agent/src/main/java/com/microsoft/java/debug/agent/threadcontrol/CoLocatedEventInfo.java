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

import java.util.Objects;

import com.microsoft.java.debug.agent.runtime.EventIndex;

/**
 * Remembers where the last of a pair of co-located events was reported, so
 * that the second event at the same location can be suppressed. An empty
 * info has no event.
 */
public class CoLocatedEventInfo {
    private EventIndex event;
    private Object clazz;
    private Object method;
    private long location;

    void save(EventIndex event, Object clazz, Object method, long location) {
        this.event = event;
        this.clazz = clazz;
        this.method = method;
        this.location = location;
    }

    void clear() {
        this.event = null;
        this.clazz = null;
        this.method = null;
        this.location = 0;
    }

    boolean matches(Object clazz, Object method, long location) {
        // a saved null class never matches
        return event != null && this.clazz != null
                && Objects.equals(this.method, method)
                && this.location == location
                && this.clazz.equals(clazz);
    }

    public EventIndex getEvent() {
        return event;
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
