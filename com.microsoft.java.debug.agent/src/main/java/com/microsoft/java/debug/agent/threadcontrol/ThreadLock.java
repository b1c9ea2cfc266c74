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

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.microsoft.java.debug.agent.collaborator.DisposableLock;
import com.microsoft.java.debug.agent.collaborator.IDisposable;
import com.microsoft.java.debug.agent.collaborator.ILockable;

/**
 * The single lock guarding the thread lists, the debug thread list and all
 * suspend bookkeeping. Waiters on suspend state changes block on its condition.
 */
public class ThreadLock implements ILockable {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();

    public IDisposable acquire() {
        return new DisposableLock(lock);
    }

    @Override
    public void lock() {
        lock.lock();
    }

    @Override
    public void unlock() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /**
     * Wake every thread waiting for a suspend state change. Must be called with the lock held.
     */
    public void notifyAllWaiters() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalMonitorStateException("threadLock is not held by " + Thread.currentThread().getName());
        }
        stateChanged.signalAll();
    }

    void await() throws InterruptedException {
        stateChanged.await();
    }
}
