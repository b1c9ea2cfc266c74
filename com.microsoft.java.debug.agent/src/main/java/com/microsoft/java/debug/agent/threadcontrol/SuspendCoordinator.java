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
import java.util.Collections;
import java.util.List;

import com.microsoft.java.debug.agent.AgentSettings;
import com.microsoft.java.debug.agent.DebugException;
import com.microsoft.java.debug.agent.InternalAgentException;
import com.microsoft.java.debug.agent.Log;
import com.microsoft.java.debug.agent.collaborator.ICommonRef;
import com.microsoft.java.debug.agent.collaborator.IStepControl;
import com.microsoft.java.debug.agent.runtime.ErrorCode;
import com.microsoft.java.debug.agent.runtime.EventMode;
import com.microsoft.java.debug.agent.runtime.IRuntimeControl;
import com.microsoft.java.debug.agent.runtime.IRuntimeThread;
import com.microsoft.java.debug.agent.runtime.ThreadStates;

/**
 * Suspend and resume bookkeeping on top of the runtime primitives, which do
 * not nest. The suspend count of a node is what the debugger sees, the
 * physical suspend is issued only on the 0 to 1 transition and undone only
 * on the 1 to 0 transition.
 *
 * <p>Every method must be called with the threadLock held.</p>
 */
public class SuspendCoordinator {
    private final IRuntimeControl runtime;
    private final ThreadRegistry registry;
    private final ThreadLock threadLock;
    private final AgentSettings settings;
    private final ICommonRef commonRef;
    private final IStepControl stepControl;
    private int suspendAllCount = 0;

    SuspendCoordinator(IRuntimeControl runtime, ThreadRegistry registry, ThreadLock threadLock,
            AgentSettings settings, ICommonRef commonRef, IStepControl stepControl) {
        this.runtime = runtime;
        this.registry = registry;
        this.threadLock = threadLock;
        this.settings = settings;
        this.commonRef = commonRef;
        this.stepControl = stepControl;
    }

    public int getSuspendAllCount() {
        return suspendAllCount;
    }

    private ThreadList running() {
        return registry.get(ThreadList.Kind.RUNNING);
    }

    private ThreadList runningVirtual() {
        return registry.get(ThreadList.Kind.RUNNING_VIRTUAL);
    }

    private ThreadList other() {
        return registry.get(ThreadList.Kind.OTHER);
    }

    /**
     * Issue the physical suspend for a node whose count is about to leave 0.
     */
    private void commonSuspendByNode(ThreadNode node) throws DebugException {
        Log.debug("SuspendThread thread=%s", node);
        try {
            runtime.suspendThread(node.getThread());
        } catch (DebugException e) {
            if (e.is(ErrorCode.THREAD_SUSPENDED)) {
                // the count says unsuspended, so someone else suspended it
                if (settings.assertOn) {
                    throw InternalAgentException.exit(ErrorCode.THREAD_SUSPENDED, "thread " + node + " suspended behind our back");
                }
            }
            throw e;
        }
        // the physical suspend is ours, resume it when the count drops back to 0
        node.toBeResumed = true;
    }

    /**
     * Apply the suspend that was recorded while the thread could not be suspended yet.
     */
    void deferredSuspend(ThreadNode node) throws DebugException {
        if (node.isDebugThread) {
            return;
        }
        try {
            if (node.suspendCount > 0) {
                commonSuspendByNode(node);
            }
        } catch (DebugException e) {
            // roll back the count of the suspend that cannot be applied
            if (node.suspendCount > 0) {
                node.suspendCount--;
            }
            node.suspendOnStart = false;
            threadLock.notifyAllWaiters();
            throw e;
        }
        node.suspendOnStart = false;
        threadLock.notifyAllWaiters();
    }

    void suspendThreadByNode(ThreadNode node) throws DebugException {
        if (node.isDebugThread) {
            return;
        }
        if (node.suspendOnStart) {
            // the physical suspend happens when the thread starts
            node.suspendCount++;
            return;
        }
        if (node.suspendCount == 0) {
            try {
                commonSuspendByNode(node);
            } catch (DebugException e) {
                if (!e.is(ErrorCode.THREAD_NOT_ALIVE)) {
                    threadLock.notifyAllWaiters();
                    throw e;
                }
                Log.debug("thread=%s is not alive yet, suspending on start", node);
                node.suspendOnStart = true;
            }
        }
        node.suspendCount++;
        threadLock.notifyAllWaiters();
    }

    void resumeThreadByNode(ThreadNode node) throws DebugException {
        if (node.isDebugThread) {
            return;
        }
        if (node.suspendCount <= 0) {
            return;
        }
        node.suspendCount--;
        threadLock.notifyAllWaiters();
        if (node.suspendCount == 0 && node.toBeResumed) {
            if (settings.assertOn && node.suspendOnStart) {
                throw InternalAgentException.exit(ErrorCode.INTERNAL, "thread " + node + " is both to be resumed and suspended on start");
            }
            Log.debug("ResumeThread thread=%s", node);
            DebugException error = null;
            try {
                runtime.resumeThread(node.getThread());
            } catch (DebugException e) {
                error = e;
            }
            node.nextFrameGeneration();
            node.toBeResumed = false;
            if (error != null) {
                if (error.is(ErrorCode.THREAD_NOT_ALIVE) && !node.isStarted) {
                    // suspended before it ever ran, nothing to resume
                    Log.debug("thread=%s never started, ignoring resume failure", node);
                } else {
                    throw error;
                }
            }
        }
    }

    /**
     * Suspend one thread.
     *
     * @param thread the thread
     * @param deferred apply the suspend recorded before the thread started
     */
    public void suspendThread(IRuntimeThread thread, boolean deferred) throws DebugException {
        ThreadNode node = registry.findRunning(thread);
        if (node == null) {
            node = registry.insert(thread.isVirtual() ? runningVirtual() : other(), thread);
        }
        if (deferred) {
            deferredSuspend(node);
        } else {
            suspendThreadByNode(node);
        }
    }

    /**
     * Resume one thread. Unknown threads are not suspended by us, nothing to do.
     */
    public void resumeThread(IRuntimeThread thread) throws DebugException {
        ThreadNode node = registry.find(null, thread);
        if (node != null) {
            resumeThreadByNode(node);
        }
        registry.removeResumed(other());
    }

    public int suspendCount(IRuntimeThread thread) throws DebugException {
        ThreadNode node = registry.findRunning(thread);
        if (node == null) {
            node = registry.find(other(), thread);
        }
        if (node != null) {
            return node.suspendCount;
        }
        if (thread.isVirtual()) {
            // untracked virtual threads follow the last suspendAll/resumeAll
            int state = runtime.getThreadState(thread);
            return ThreadStates.isNew(state) ? 0 : suspendAllCount;
        }
        return 0;
    }

    private void incrementSuspendCountHelper(ThreadNode node) {
        if (node.isDebugThread) {
            return;
        }
        if (!node.suspendOnStart) {
            // the bulk virtual thread suspend suspended it, undo it on resume
            node.toBeResumed = true;
        }
        node.suspendCount++;
    }

    /**
     * Suspend a list of threads with one batch primitive. Threads already
     * suspended by us only get their count bumped.
     */
    void suspendList(List<IRuntimeThread> threads) throws DebugException {
        List<IRuntimeThread> requests = new ArrayList<>(threads.size());
        for (IRuntimeThread thread : threads) {
            ThreadNode node = registry.find(null, thread);
            if (node == null) {
                node = registry.insert(thread.isVirtual() ? runningVirtual() : other(), thread);
            }
            if (node.isDebugThread) {
                continue;
            }
            if (node.suspendOnStart || node.suspendCount > 0) {
                node.suspendCount++;
                continue;
            }
            requests.add(thread);
        }

        if (requests.isEmpty()) {
            return;
        }

        Log.debug("SuspendThreadList threads=%d", requests.size());
        List<ErrorCode> results = runtime.suspendThreadList(requests);
        if (results == null || results.size() != requests.size()) {
            throw InternalAgentException.exit(ErrorCode.INTERNAL, "suspend list results do not match the request");
        }
        DebugException error = null;
        for (int i = 0; i < requests.size(); i++) {
            ThreadNode node = registry.find(null, requests.get(i));
            if (node == null) {
                throw InternalAgentException.exit(ErrorCode.INVALID_THREAD, "missing entry in suspend list");
            }
            ErrorCode result = results.get(i);
            switch (result) {
                case NONE:
                    node.toBeResumed = true;
                    node.suspendCount++;
                    break;
                case THREAD_SUSPENDED:
                    // suspended by someone else, leave the resume to them
                    Log.debug("thread=%s already suspended", node);
                    node.suspendCount++;
                    break;
                case THREAD_NOT_ALIVE:
                    Log.debug("thread=%s is not alive yet, suspending on start", node);
                    node.suspendOnStart = true;
                    node.suspendCount++;
                    break;
                default:
                    Log.warn("Unexpected result %s suspending thread %s", result, node);
                    if (error == null) {
                        error = new DebugException(String.format("Failed to suspend thread %s", node), result);
                    }
                    break;
            }
        }
        threadLock.notifyAllWaiters();

        if (error != null) {
            throw error;
        }
    }

    /**
     * Resume every running node with one batch primitive. The first pass only
     * counts the nodes that need a physical resume, the second pass does the
     * nested suspend accounting and collects them. Doing the accounting in the
     * first pass would make a node that needs a physical resume look like one
     * that is already running.
     */
    void resumeList() throws DebugException {
        int requestCount = 0;
        for (ThreadNode node : running().snapshot()) {
            if (needsResume(node)) {
                requestCount++;
            }
        }
        for (ThreadNode node : runningVirtual().snapshot()) {
            if (needsResume(node)) {
                requestCount++;
            }
        }

        List<IRuntimeThread> requests = new ArrayList<>(requestCount);
        accountResume(running(), requests);
        accountResume(runningVirtual(), requests);
        if (requests.isEmpty()) {
            return;
        }

        Log.debug("ResumeThreadList threads=%d", requests.size());
        DebugException error = null;
        try {
            runtime.resumeThreadList(requests);
        } catch (DebugException e) {
            error = e;
        }
        for (IRuntimeThread thread : requests) {
            ThreadNode node = registry.findRunning(thread);
            if (node == null) {
                throw InternalAgentException.exit(ErrorCode.INVALID_THREAD, "missing entry in running thread table");
            }
            Log.debug("thread=%s resumed as part of list", node);
            node.suspendCount--;
            node.toBeResumed = false;
            node.nextFrameGeneration();
        }
        threadLock.notifyAllWaiters();

        if (error != null) {
            throw error;
        }
    }

    private static boolean needsResume(ThreadNode node) {
        return !node.isDebugThread && node.suspendCount == 1 && node.toBeResumed;
    }

    private void accountResume(ThreadList list, List<IRuntimeThread> requests) {
        for (ThreadNode node : list.snapshot()) {
            if (node.isDebugThread) {
                continue;
            }
            if (node.suspendCount > 1) {
                // nested, undo one level
                node.suspendCount--;
            } else if (node.suspendCount == 1 && node.suspendOnStart) {
                // the start event will see a zero count and skip the suspend
                node.suspendCount--;
            } else if (node.suspendCount == 1 && node.toBeResumed) {
                requests.add(node.getThread());
            } else if (node.suspendCount == 1) {
                // suspended by someone else, only the count is ours
                node.suspendCount--;
            }
        }
    }

    public void suspendAll() throws DebugException {
        if (settings.vthreadsSupported) {
            if (suspendAllCount == 0) {
                Log.debug("SuspendAllVirtualThreads");
                try {
                    runtime.suspendAllVirtualThreads(Collections.emptyList());
                } catch (DebugException e) {
                    throw InternalAgentException.exit(e, "cannot suspend all virtual threads");
                }
                threadLock.notifyAllWaiters();
            }
            // the tracked ones were suspended by the bulk call above
            for (ThreadNode node : runningVirtual().snapshot()) {
                incrementSuspendCountHelper(node);
            }
        }

        List<IRuntimeThread> threads = runtime.getAllThreads();
        suspendList(threads);

        // threads referenced by the debugger may not be in the runtime's list yet
        registry.enumerate(other(), node -> {
            if (!threads.contains(node.getThread())) {
                suspendThreadByNode(node);
            }
        });

        commonRef.pinAll();
        suspendAllCount++;
    }

    public void resumeAll() throws DebugException {
        if (settings.vthreadsSupported && suspendAllCount == 1) {
            // resumeList takes care of the tracked virtual threads suspended by us
            List<IRuntimeThread> except = new ArrayList<>();
            for (ThreadNode node : runningVirtual().snapshot()) {
                if (node.suspendCount > 0) {
                    except.add(node.getThread());
                }
            }
            Log.debug("ResumeAllVirtualThreads except=%d", except.size());
            try {
                runtime.resumeAllVirtualThreads(except);
            } catch (DebugException e) {
                throw InternalAgentException.exit(e, "cannot resume all virtual threads");
            }
            threadLock.notifyAllWaiters();
        }

        DebugException error = null;
        try {
            resumeList();
            if (!other().isEmpty()) {
                registry.enumerate(other(), this::resumeThreadByNode);
                registry.removeResumed(other());
            }
        } catch (DebugException e) {
            error = e;
        }

        if (suspendAllCount > 0) {
            commonRef.unpinAll();
            suspendAllCount--;
        }
        threadLock.notifyAllWaiters();

        if (error != null) {
            throw error;
        }
    }

    /**
     * Undo every physical suspend and forget all suspend state.
     */
    void reset() {
        if (settings.vthreadsSupported && suspendAllCount > 0) {
            try {
                runtime.resumeAllVirtualThreads(Collections.emptyList());
            } catch (DebugException e) {
                throw InternalAgentException.exit(e, "cannot resume all virtual threads");
            }
        }
        resetNodes(running());
        resetNodes(other());
        resetNodes(runningVirtual());
        registry.removeResumed(other());
        suspendAllCount = 0;
        if (settings.assertOn && !other().isEmpty()) {
            throw InternalAgentException.exit(ErrorCode.INTERNAL, "other thread list not empty after reset");
        }
        threadLock.notifyAllWaiters();
    }

    private void resetNodes(ThreadList list) {
        for (ThreadNode node : list.snapshot()) {
            if (node.toBeResumed) {
                Log.debug("ResumeThread thread=%s", node);
                try {
                    runtime.resumeThread(node.getThread());
                } catch (DebugException e) {
                    Log.debug("reset could not resume thread=%s: %s", node, e.getMessage());
                }
                node.nextFrameGeneration();
            }
            stepControl.clearRequest(node.getThread(), node.currentStep);
            node.toBeResumed = false;
            node.suspendCount = 0;
            node.suspendOnStart = false;
        }
    }

    /**
     * Drop tracked virtual threads nothing refers to any more.
     */
    void evictResumedVirtualThreads() {
        if (!settings.evictResumedVThreads || settings.rememberVThreadsWhenDisconnected || suspendAllCount > 0) {
            return;
        }
        for (ThreadNode node : runningVirtual().snapshot()) {
            if (isEvictable(node)) {
                Log.debug("evicting resumed vthread=%s", node);
                registry.remove(node);
            }
        }
    }

    private static boolean isEvictable(ThreadNode node) {
        return node.suspendCount == 0
                && !node.suspendOnStart
                && !node.isHandlingEvent()
                && !node.popFrameThread
                && !node.isDebugThread
                && !node.currentStep.isPending()
                && !node.currentInvoke.isPending()
                && node.instructionStepMode == EventMode.DISABLE;
    }
}
