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
 * Holds a set of locks acquired in the given order and releases them in
 * the exact reverse order when closed.
 */
public class OrderedLocks implements IDisposable {
    private final List<ILockable> acquired = new ArrayList<>();
    private boolean closed = false;

    /**
     * Acquire the locks from first to last.
     *
     * @param locks the locks in global lock order
     */
    public OrderedLocks(List<? extends ILockable> locks) {
        if (locks == null) {
            throw new IllegalArgumentException("Null lock list is illegal for OrderedLocks.");
        }

        try {
            for (ILockable lock : locks) {
                lock.lock();
                acquired.add(lock);
            }
        } catch (RuntimeException ex) {
            close();
            throw ex;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<ILockable> reversed = new ArrayList<>(acquired);
        Collections.reverse(reversed);
        for (ILockable lock : reversed) {
            lock.unlock();
        }
        acquired.clear();
    }
}
