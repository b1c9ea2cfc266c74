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

package com.microsoft.java.debug.agent.collaborator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the events reported for one thread until its dispatch completes.
 */
public class EventBag {
    private final List<Object> events = Collections.synchronizedList(new ArrayList<>());

    public void add(Object event) {
        events.add(event);
    }

    public List<Object> getEvents() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
