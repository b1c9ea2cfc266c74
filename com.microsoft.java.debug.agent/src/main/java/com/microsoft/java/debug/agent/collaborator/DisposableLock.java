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

import java.util.concurrent.locks.ReentrantLock;

public class DisposableLock implements IDisposable {
    private ReentrantLock lock;

    /**
     * Acquire the lock and wrap it so it is released when closed.
     *
     * @param lock the lock
     */
    public DisposableLock(ReentrantLock lock) {
        if (lock == null) {
            throw new IllegalArgumentException("Null lock is illegal for DisposableLock.");
        }

        lock.lock();
        this.lock = lock;
    }

    @Override
    public void close() {
        if (lock != null) {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
            lock = null;
        }
    }
}
