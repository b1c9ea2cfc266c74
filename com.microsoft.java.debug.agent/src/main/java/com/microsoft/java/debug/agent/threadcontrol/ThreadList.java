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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.microsoft.java.debug.agent.runtime.IRuntimeThread;

/**
 * One of the registry's disjoint collections of thread nodes. Only accessed with the threadLock held.
 */
public class ThreadList implements Iterable<ThreadNode> {
    public enum Kind {
        /** Threads between their start and end events. */
        RUNNING,
        /** Virtual threads the agent is tracking, not necessarily all of them. */
        RUNNING_VIRTUAL,
        /** Threads referenced before they started or after they ended. */
        OTHER
    }

    private final Kind kind;
    private final Set<ThreadNode> nodes = new LinkedHashSet<>();

    ThreadList(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    void add(ThreadNode node) {
        nodes.add(node);
        node.list = this;
    }

    void remove(ThreadNode node) {
        if (nodes.remove(node)) {
            node.list = null;
        }
    }

    /**
     * Linear search by thread identity, for nodes whose side channel entry is missing.
     */
    ThreadNode search(IRuntimeThread thread) {
        for (ThreadNode node : nodes) {
            if (node.getThread().equals(thread)) {
                return node;
            }
        }
        return null;
    }

    public boolean contains(ThreadNode node) {
        return nodes.contains(node);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    List<ThreadNode> snapshot() {
        return new ArrayList<>(nodes);
    }

    @Override
    public Iterator<ThreadNode> iterator() {
        return snapshot().iterator();
    }

    @Override
    public String toString() {
        return kind.toString();
    }
}
