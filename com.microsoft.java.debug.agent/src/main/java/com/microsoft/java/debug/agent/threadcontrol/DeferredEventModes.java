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
import java.util.Iterator;
import java.util.List;

import com.microsoft.java.debug.agent.DebugException;
import com.microsoft.java.debug.agent.InternalAgentException;
import com.microsoft.java.debug.agent.Log;
import com.microsoft.java.debug.agent.runtime.EventIndex;
import com.microsoft.java.debug.agent.runtime.EventMode;
import com.microsoft.java.debug.agent.runtime.IRuntimeControl;
import com.microsoft.java.debug.agent.runtime.IRuntimeThread;

/**
 * Event mode requests for threads that have no started node yet. Guarded by the threadLock.
 */
public class DeferredEventModes {
    private final IRuntimeControl runtime;
    private final List<DeferredEventMode> entries = new ArrayList<>();

    DeferredEventModes(IRuntimeControl runtime) {
        this.runtime = runtime;
    }

    /**
     * Apply the mode change now if the thread is started, otherwise hold it
     * until the thread's start event.
     *
     * @param node the node of the thread, or null if the thread is unknown
     */
    void requestMode(ThreadNode node, IRuntimeThread thread, EventIndex event, EventMode mode) throws DebugException {
        if (node == null || !node.isStarted) {
            entries.add(new DeferredEventMode(thread, mode, event));
            Log.debug("deferred %s %s for thread=%s", mode, event, thread.name());
        } else {
            apply(node, thread, event, mode);
        }
    }

    /**
     * Apply and drop every entry of the starting thread.
     */
    void flushOnStart(IRuntimeThread thread, ThreadNode node) {
        Iterator<DeferredEventMode> it = entries.iterator();
        while (it.hasNext()) {
            DeferredEventMode entry = it.next();
            if (entry.getThread().equals(thread)) {
                try {
                    apply(node, thread, entry.getEvent(), entry.getMode());
                } catch (DebugException e) {
                    throw InternalAgentException.exit(e, "applying deferred event mode " + entry);
                }
                it.remove();
            }
        }
    }

    void clearAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    List<DeferredEventMode> snapshot() {
        return new ArrayList<>(entries);
    }

    void apply(ThreadNode node, IRuntimeThread thread, EventIndex event, EventMode mode) throws DebugException {
        runtime.setEventNotificationMode(mode, event, thread);
        if (event == EventIndex.SINGLE_STEP && node != null) {
            node.instructionStepMode = mode;
        }
    }
}
