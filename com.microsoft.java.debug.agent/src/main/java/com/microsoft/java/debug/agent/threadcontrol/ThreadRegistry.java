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
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

import com.microsoft.java.debug.agent.AgentSettings;
import com.microsoft.java.debug.agent.DebugException;
import com.microsoft.java.debug.agent.InternalAgentException;
import com.microsoft.java.debug.agent.Log;
import com.microsoft.java.debug.agent.collaborator.IEventHelper;
import com.microsoft.java.debug.agent.collaborator.IStepControl;
import com.microsoft.java.debug.agent.runtime.ErrorCode;
import com.microsoft.java.debug.agent.runtime.EventMode;
import com.microsoft.java.debug.agent.runtime.IRuntimeControl;
import com.microsoft.java.debug.agent.runtime.IRuntimeThread;
import com.microsoft.java.debug.agent.runtime.ThreadStates;

/**
 * Owns the thread nodes. Threads that have issued a start event and not yet
 * an end event are on the running list, tracked virtual threads on the
 * running virtual list, and every other thread known to thread control on
 * the other list.
 *
 * <p>Nodes on the running lists are also reachable through a side channel
 * keyed by thread. A miss in the side channel is not a failure, the other
 * list (and, once the runtime callbacks are cleared, the running lists) must
 * still be searched. Except for {@link #lookup(IRuntimeThread)}, every method
 * must be called with the threadLock held.</p>
 */
public class ThreadRegistry {
    private final IRuntimeControl runtime;
    private final DebugThreadList debugThreads;
    private final IEventHelper eventHelper;
    private final IStepControl stepControl;
    private final AgentSettings settings;
    private final IntSupplier suspendAllCount;

    private final ThreadList runningThreads = new ThreadList(ThreadList.Kind.RUNNING);
    private final ThreadList runningVThreads = new ThreadList(ThreadList.Kind.RUNNING_VIRTUAL);
    private final ThreadList otherThreads = new ThreadList(ThreadList.Kind.OTHER);
    private final Map<IRuntimeThread, ThreadNode> sideChannel = new ConcurrentHashMap<>();
    private final AtomicLong frameGenerations = new AtomicLong(0);
    private volatile boolean callbacksCleared = false;

    ThreadRegistry(IRuntimeControl runtime, DebugThreadList debugThreads, IEventHelper eventHelper,
            IStepControl stepControl, AgentSettings settings, IntSupplier suspendAllCount) {
        this.runtime = runtime;
        this.debugThreads = debugThreads;
        this.eventHelper = eventHelper;
        this.stepControl = stepControl;
        this.settings = settings;
        this.suspendAllCount = suspendAllCount;
    }

    public ThreadList get(ThreadList.Kind kind) {
        switch (kind) {
            case RUNNING:
                return runningThreads;
            case RUNNING_VIRTUAL:
                return runningVThreads;
            case OTHER:
                return otherThreads;
            default:
                throw new IllegalArgumentException("Unknown thread list " + kind);
        }
    }

    /**
     * The runtime callbacks have been torn down, so end events may be missed and
     * running threads may have lost their side channel entry.
     */
    void setCallbacksCleared(boolean callbacksCleared) {
        this.callbacksCleared = callbacksCleared;
    }

    boolean isCallbacksCleared() {
        return callbacksCleared;
    }

    /**
     * Find the node of a thread.
     *
     * @param list the list to search, or null for all lists
     * @param thread the thread
     * @return the node, or null if the thread is unknown or is on another list
     */
    public ThreadNode find(ThreadList list, IRuntimeThread thread) {
        if (thread == null) {
            return null;
        }
        ThreadNode node = sideChannel.get(thread);
        if (node == null) {
            // nodes of unstarted threads never get a side channel entry
            if (list == null || list == otherThreads) {
                node = otherThreads.search(thread);
            }
            if (!callbacksCleared) {
                if (settings.assertOn && (runningThreads.search(thread) != null || runningVThreads.search(thread) != null)) {
                    throw InternalAgentException.exit(ErrorCode.INTERNAL,
                            "running thread without side channel entry: " + thread.name());
                }
            } else if (node == null) {
                if (list == null || list == runningThreads) {
                    node = runningThreads.search(thread);
                }
                if (node == null && (list == null || list == runningVThreads)) {
                    node = runningVThreads.search(thread);
                }
            }
        }

        if (node != null && list != null && node.list != list) {
            return null;
        }
        return node;
    }

    /**
     * Find the node of a thread between its start and end events, virtual threads included.
     */
    public ThreadNode findRunning(IRuntimeThread thread) {
        if (thread == null) {
            return null;
        }
        return find(thread.isVirtual() ? runningVThreads : runningThreads, thread);
    }

    /**
     * Side channel lookup without the threadLock. Returns null on a miss,
     * callers that need a definite answer must fall back to {@link #find(ThreadList, IRuntimeThread)}.
     */
    ThreadNode lookup(IRuntimeThread thread) {
        return thread == null ? null : sideChannel.get(thread);
    }

    /**
     * Return the node of the thread, creating it on the given list if the thread is unknown.
     */
    public ThreadNode insert(ThreadList list, IRuntimeThread thread) {
        ThreadNode node = find(null, thread);
        if (node != null) {
            return node;
        }

        boolean isVirtual = list == runningVThreads;
        node = new ThreadNode(thread, isVirtual, frameGenerations);
        int pendingSuspendAll = suspendAllCount.getAsInt();
        if (!isVirtual) {
            if (debugThreads.contains(thread)) {
                node.isDebugThread = true;
            } else if (pendingSuspendAll > 0) {
                // a thread showing up during a suspendAll is treated as if the suspendAll suspended it
                node.suspendCount = pendingSuspendAll;
                node.suspendOnStart = true;
            }
        } else {
            int state;
            try {
                state = runtime.getThreadState(thread);
            } catch (DebugException e) {
                throw InternalAgentException.exit(e, "getting vthread state");
            }
            if (!ThreadStates.isAlive(state)) {
                // not started yet or already terminated, either way it belongs on the other list
                list = otherThreads;
            }
            if (pendingSuspendAll > 0) {
                node.suspendCount = pendingSuspendAll;
                if (ThreadStates.isNew(state)) {
                    node.suspendOnStart = true;
                } else if (ThreadStates.isAlive(state)) {
                    // already suspended by the bulk suspend, resumeAll has to undo it
                    node.toBeResumed = true;
                }
            }
            if (!ThreadStates.isNew(state)) {
                node.isStarted = true;
            }
        }

        node.currentEvent = null;
        node.instructionStepMode = EventMode.DISABLE;
        node.eventBag = eventHelper.createEventBag();
        if (node.eventBag == null) {
            throw InternalAgentException.exit(ErrorCode.OUT_OF_MEMORY, "thread table entry");
        }
        list.add(node);
        if (list != otherThreads) {
            sideChannel.put(thread, node);
        }
        Log.debug("thread=%s added to %s", node, list);
        return node;
    }

    /**
     * Relocate a node, used when a thread known only to the other list starts.
     */
    public void move(ThreadNode node, ThreadList source, ThreadList dest) {
        if (node.list != source) {
            throw InternalAgentException.exit(ErrorCode.INTERNAL,
                    String.format("thread %s is on %s, not %s", node, node.list, source));
        }
        source.remove(node);
        if (settings.assertOn && find(dest, node.getThread()) != null) {
            throw InternalAgentException.exit(ErrorCode.INTERNAL, "thread already on " + dest);
        }
        dest.add(node);
        if (dest != otherThreads) {
            sideChannel.put(node.getThread(), node);
        } else {
            sideChannel.remove(node.getThread(), node);
        }
    }

    /**
     * Detach the node from its list and release everything it holds.
     */
    public void remove(ThreadNode node) {
        if (node == null) {
            throw InternalAgentException.exit(ErrorCode.NULL_POINTER, "removing a missing thread node");
        }
        if (node.list != null) {
            node.list.remove(node);
        }
        node.pendingStop = null;
        stepControl.clearRequest(node.getThread(), node.currentStep);
        if (node.isDebugThread) {
            try {
                debugThreads.remove(node.getThread());
            } catch (DebugException e) {
                Log.debug("debug thread %s was already unregistered", node);
            }
        }
        sideChannel.remove(node.getThread(), node);
        // a node recreated for the thread starts past every generation handed out so far
        frameGenerations.incrementAndGet();
        if (node.eventBag != null) {
            node.eventBag.clear();
            node.eventBag = null;
        }
        Log.debug("thread=%s removed", node);
    }

    /**
     * Remove every node of the list whose suspend count dropped to zero.
     */
    public void removeResumed(ThreadList list) {
        for (ThreadNode node : list.snapshot()) {
            if (node.suspendCount == 0) {
                remove(node);
            }
        }
    }

    public void removeVirtualThreads() {
        for (ThreadNode node : runningVThreads.snapshot()) {
            remove(node);
        }
    }

    /**
     * Visit every node of the list. The first exception thrown by the visitor
     * ends the enumeration and is propagated.
     */
    public void enumerate(ThreadList list, IThreadVisitor visitor) throws DebugException {
        for (ThreadNode node : list.snapshot()) {
            visitor.visit(node);
        }
    }

    /**
     * Forget the side channel entry of a thread, as the runtime does when a
     * thread terminates without its end event being delivered.
     */
    void clearSideChannel(IRuntimeThread thread) {
        sideChannel.remove(thread);
    }

    public List<IRuntimeThread> virtualThreads() {
        List<IRuntimeThread> threads = new ArrayList<>(runningVThreads.size());
        for (ThreadNode node : runningVThreads.snapshot()) {
            threads.add(node.getThread());
        }
        return threads;
    }

    String dump() {
        StringBuilder sb = new StringBuilder();
        dump(sb, runningThreads);
        dump(sb, runningVThreads);
        dump(sb, otherThreads);
        return sb.toString();
    }

    private static void dump(StringBuilder sb, ThreadList list) {
        sb.append("Dumping ").append(list).append(':').append(System.lineSeparator());
        for (ThreadNode node : list.snapshot()) {
            if (!node.isDebugThread) {
                sb.append(String.format("  Thread: %s suspendCount=%d toBeResumed=%b suspendOnStart=%b%n",
                        node, node.suspendCount, node.toBeResumed, node.suspendOnStart));
            }
        }
    }
}
