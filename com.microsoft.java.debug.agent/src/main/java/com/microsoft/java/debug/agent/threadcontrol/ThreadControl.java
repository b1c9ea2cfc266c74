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

import java.util.Arrays;
import java.util.List;

import com.microsoft.java.debug.agent.AgentSettings;
import com.microsoft.java.debug.agent.DebugException;
import com.microsoft.java.debug.agent.InternalAgentException;
import com.microsoft.java.debug.agent.Log;
import com.microsoft.java.debug.agent.collaborator.EventBag;
import com.microsoft.java.debug.agent.collaborator.ICollaboratorContext;
import com.microsoft.java.debug.agent.collaborator.ICommonRef;
import com.microsoft.java.debug.agent.collaborator.IDisposable;
import com.microsoft.java.debug.agent.collaborator.IEventHandler;
import com.microsoft.java.debug.agent.collaborator.IEventHelper;
import com.microsoft.java.debug.agent.collaborator.IInvoker;
import com.microsoft.java.debug.agent.collaborator.ILockable;
import com.microsoft.java.debug.agent.collaborator.IStepControl;
import com.microsoft.java.debug.agent.collaborator.InvokeRequest;
import com.microsoft.java.debug.agent.collaborator.OrderedLocks;
import com.microsoft.java.debug.agent.collaborator.StepRequest;
import com.microsoft.java.debug.agent.runtime.ErrorCode;
import com.microsoft.java.debug.agent.runtime.EventIndex;
import com.microsoft.java.debug.agent.runtime.EventMode;
import com.microsoft.java.debug.agent.runtime.IRuntimeControl;
import com.microsoft.java.debug.agent.runtime.IRuntimeThread;
import com.microsoft.java.debug.agent.runtime.ThreadStatus;

import io.reactivex.Observable;
import io.reactivex.subjects.PublishSubject;
import io.reactivex.subjects.Subject;

/**
 * The thread control state of one debugging session. Every suspend, resume
 * and event hook of the agent goes through here.
 *
 * <p>Suspends take the locks of every subsystem an application thread may
 * hold while it handles an event, in this order: event handler, invoker,
 * event helper, step control, common ref and finally the threadLock. That
 * way no application thread gets suspended inside one of them.</p>
 */
public class ThreadControl implements IDisposable {
    private final IRuntimeControl runtime;
    private final AgentSettings settings;
    private final IEventHandler eventHandler;
    private final IInvoker invoker;
    private final IEventHelper eventHelper;
    private final IStepControl stepControl;
    private final ICommonRef commonRef;

    private final ThreadLock threadLock = new ThreadLock();
    private final DebugThreadList debugThreads;
    private final ThreadRegistry registry;
    private final DeferredEventModes deferredModes;
    private final SuspendCoordinator coordinator;
    private final PopFrameController popFrameController;
    // resumes are published from any command thread, after the locks are released
    private final Subject<ThreadControlEvent> eventSubject = PublishSubject.<ThreadControlEvent>create().toSerialized();

    /**
     * Create the thread control of a session.
     *
     * @param runtime the runtime primitives
     * @param collaborators the context holding the event handler, invoker, event helper, step control and common ref
     * @param settings the agent settings
     */
    public ThreadControl(IRuntimeControl runtime, ICollaboratorContext collaborators, AgentSettings settings) {
        if (runtime == null) {
            throw new IllegalArgumentException("Null runtime is illegal for ThreadControl.");
        }
        if (collaborators == null) {
            throw new IllegalArgumentException("Null collaborator context is illegal for ThreadControl.");
        }
        this.runtime = runtime;
        this.settings = settings == null ? AgentSettings.getCurrent() : settings;
        this.eventHandler = collaborators.getCollaborator(IEventHandler.class);
        this.invoker = collaborators.getCollaborator(IInvoker.class);
        this.eventHelper = collaborators.getCollaborator(IEventHelper.class);
        this.stepControl = collaborators.getCollaborator(IStepControl.class);
        this.commonRef = collaborators.getCollaborator(ICommonRef.class);

        this.debugThreads = new DebugThreadList(threadLock, this.settings.maxDebugThreads);
        this.registry = new ThreadRegistry(runtime, debugThreads, eventHelper, stepControl, this.settings,
                this::getSuspendAllCount);
        this.deferredModes = new DeferredEventModes(runtime);
        this.coordinator = new SuspendCoordinator(runtime, registry, threadLock, this.settings, commonRef, stepControl);
        this.popFrameController = new PopFrameController(this, runtime, registry, threadLock, stepControl, invoker,
                this.settings);
    }

    private IDisposable suspendLocks() {
        return new OrderedLocks(Arrays.<ILockable>asList(eventHandler, invoker, eventHelper, stepControl, commonRef, threadLock));
    }

    private IDisposable resumeLocks() {
        return new OrderedLocks(Arrays.<ILockable>asList(eventHandler, threadLock));
    }

    private static void checkThread(IRuntimeThread thread) {
        if (thread == null) {
            throw new IllegalArgumentException("Null thread is illegal.");
        }
    }

    /**
     * Seed the running list with the threads that exist when the event hook is installed.
     */
    public void onHook() throws DebugException {
        try (IDisposable lock = threadLock.acquire()) {
            List<IRuntimeThread> threads = runtime.getAllThreads();
            ThreadList running = registry.get(ThreadList.Kind.RUNNING);
            for (IRuntimeThread thread : threads) {
                // no start event will come for them
                registry.insert(running, thread).isStarted = true;
            }
            Log.debug("onHook: %d threads", threads.size());
        }
    }

    public void onConnect() {
        // nothing to set up per connection
    }

    public void onDisconnect() {
        // reset() does the cleanup
    }

    /**
     * The runtime event callbacks are gone. From now on end events may be
     * missed, so lookups can no longer rely on the side channel alone.
     */
    public void onCallbacksCleared() {
        try (IDisposable lock = threadLock.acquire()) {
            registry.setCallbacksCleared(true);
        }
    }

    public void suspendThread(IRuntimeThread thread, boolean deferred) throws DebugException {
        checkThread(thread);
        try (IDisposable locks = suspendLocks()) {
            coordinator.suspendThread(thread, deferred);
        }
    }

    /**
     * Resume one thread.
     *
     * @param thread the thread
     * @param unblock whether to tell the command loop a thread was resumed
     */
    public void resumeThread(IRuntimeThread thread, boolean unblock) throws DebugException {
        checkThread(thread);
        try (IDisposable locks = resumeLocks()) {
            try {
                coordinator.resumeThread(thread);
            } finally {
                coordinator.evictResumedVirtualThreads();
            }
        }
        if (unblock) {
            eventSubject.onNext(new ThreadControlEvent(ThreadControlEvent.Kind.RESUMED, thread));
        }
    }

    public int suspendCount(IRuntimeThread thread) throws DebugException {
        checkThread(thread);
        try (IDisposable lock = threadLock.acquire()) {
            return coordinator.suspendCount(thread);
        }
    }

    public void suspendAll() throws DebugException {
        try (IDisposable locks = suspendLocks()) {
            coordinator.suspendAll();
            traceThreads("suspendAll");
        }
    }

    public void resumeAll() throws DebugException {
        try (IDisposable locks = resumeLocks()) {
            try {
                coordinator.resumeAll();
            } finally {
                coordinator.evictResumedVirtualThreads();
            }
            traceThreads("resumeAll");
        } finally {
            eventSubject.onNext(new ThreadControlEvent(ThreadControlEvent.Kind.RESUMED_ALL, null));
        }
    }

    public int getSuspendAllCount() {
        return coordinator == null ? 0 : coordinator.getSuspendAllCount();
    }

    /**
     * Resume everything the session suspended and forget its state. Tracked
     * virtual threads are dropped too unless they are to be remembered
     * between sessions.
     */
    public void reset() {
        try (IDisposable locks = resumeLocks()) {
            coordinator.reset();
            deferredModes.clearAll();
            traceThreads("reset");
        }

        if (!settings.rememberVThreadsWhenDisconnected) {
            // callbacks resumed above may still use the virtual thread nodes
            eventHandler.waitForActiveCallbacks();
            try (IDisposable lock = threadLock.acquire()) {
                registry.removeVirtualThreads();
            }
        }
    }

    /**
     * Called before an event reported on an application thread is dispatched.
     *
     * @param sessionId the debugger session
     * @param info the event
     * @return the event bag to collect the reports in, or null if the event
     *         belongs to a frame pop and must not be dispatched
     */
    public EventBag onEventHandlerEntry(byte sessionId, EventInfo info) {
        IRuntimeThread thread = info.getThread();
        EventIndex event = info.getEvent();
        if (popFrameController.checkForPopFrameEvents(event, thread)) {
            return null;
        }

        EventBag eventBag;
        IRuntimeThread threadToSuspend = null;
        try (IDisposable lock = threadLock.acquire()) {
            ThreadList other = registry.get(ThreadList.Kind.OTHER);
            ThreadNode node = registry.find(other, thread);
            if (node != null) {
                // a well known thread now
                registry.move(node, other, registry.get(node.isVirtual()
                        ? ThreadList.Kind.RUNNING_VIRTUAL : ThreadList.Kind.RUNNING));
            } else {
                // some events may come before the thread start event
                node = registry.insert(registry.get(info.isVirtual()
                        ? ThreadList.Kind.RUNNING_VIRTUAL : ThreadList.Kind.RUNNING), thread);
            }

            if (event == EventIndex.THREAD_START) {
                node.isStarted = true;
                deferredModes.flushOnStart(thread, node);
            } else if (event == EventIndex.THREAD_END) {
                // the node may just have been recreated
                node.isStarted = true;
            }

            node.currentEvent = event;
            eventBag = node.eventBag;
            if (node.suspendOnStart) {
                threadToSuspend = node.getThread();
            }
        }

        if (threadToSuspend != null) {
            // suspended before it started, the helper applies it with no locks held
            eventHelper.suspendThread(sessionId, threadToSuspend);
        }
        return eventBag;
    }

    /**
     * Called after an event reported on an application thread has been dispatched.
     */
    public void onEventHandlerExit(EventIndex event, IRuntimeThread thread, EventBag eventBag) {
        boolean threadEnd = event == EventIndex.THREAD_END;
        List<ILockable> locks = threadEnd
                ? Arrays.<ILockable>asList(eventHandler, threadLock) : Arrays.<ILockable>asList(threadLock);
        try (IDisposable held = new OrderedLocks(locks)) {
            ThreadNode node = registry.findRunning(thread);
            if (node == null) {
                throw InternalAgentException.exit(ErrorCode.NULL_POINTER, "thread list corrupted");
            }
            if (threadEnd) {
                registry.remove(node);
            } else {
                doPendingTasks(node);
                node.eventBag = eventBag;
                node.currentEvent = null;
            }
        }
    }

    private void doPendingTasks(ThreadNode node) {
        if (node.pendingInterrupt) {
            try {
                runtime.interruptThread(node.getThread());
            } catch (DebugException e) {
                Log.warn("Failed to interrupt thread %s: %s", node, e.getMessage());
            }
            node.pendingInterrupt = false;
        }

        if (node.pendingStop != null) {
            try {
                runtime.stopThread(node.getThread(), node.pendingStop);
            } catch (DebugException e) {
                Log.warn("Failed to stop thread %s: %s", node, e.getMessage());
            }
            node.pendingStop = null;
        }
    }

    /**
     * Get the debugger visible status of an application thread.
     */
    public ThreadStatusInfo applicationThreadStatus(IRuntimeThread thread) throws DebugException {
        checkThread(thread);
        try (IDisposable lock = threadLock.acquire()) {
            int state = runtime.getThreadState(thread);
            ThreadStatus status = ThreadStatus.fromState(state);
            ThreadNode node = registry.findRunning(thread);
            if (node != null && node.isHandlingEvent()) {
                // a thread handling an event may wait on an agent monitor, it still counts as running
                status = ThreadStatus.RUNNING;
            }
            return new ThreadStatusInfo(status, ThreadStatus.suspendFlags(state));
        }
    }

    public void interrupt(IRuntimeThread thread) throws DebugException {
        checkThread(thread);
        try (IDisposable lock = threadLock.acquire()) {
            ThreadNode node = registry.find(registry.get(ThreadList.Kind.RUNNING), thread);
            if (node == null || !node.isHandlingEvent()) {
                runtime.interruptThread(thread);
            } else {
                // hold it until the event is handled
                node.pendingInterrupt = true;
            }
        }
    }

    public void setPendingInterrupt(IRuntimeThread thread) {
        checkThread(thread);
        try (IDisposable lock = threadLock.acquire()) {
            ThreadNode node = registry.find(registry.get(ThreadList.Kind.RUNNING), thread);
            if (node != null) {
                node.pendingInterrupt = true;
            }
        }
    }

    public void stop(IRuntimeThread thread, Object throwable) throws DebugException {
        checkThread(thread);
        try (IDisposable lock = threadLock.acquire()) {
            ThreadNode node = registry.find(registry.get(ThreadList.Kind.RUNNING), thread);
            if (node == null || !node.isHandlingEvent()) {
                runtime.stopThread(thread, throwable);
            } else {
                node.pendingStop = throwable;
            }
        }
    }

    public void saveCoLocatedEventInfo(IRuntimeThread thread, EventIndex event, Object clazz, Object method, long location) {
        try (IDisposable lock = threadLock.acquire()) {
            ThreadNode node = registry.findRunning(thread);
            if (node != null) {
                node.cleInfo.save(event, clazz, method, location);
            }
        }
    }

    public boolean compareCoLocatedEventInfo(IRuntimeThread thread, Object clazz, Object method, long location) {
        try (IDisposable lock = threadLock.acquire()) {
            ThreadNode node = registry.findRunning(thread);
            return node != null && node.cleInfo.matches(clazz, method, location);
        }
    }

    public void clearCoLocatedEventInfo(IRuntimeThread thread) {
        try (IDisposable lock = threadLock.acquire()) {
            ThreadNode node = registry.findRunning(thread);
            if (node != null) {
                node.cleInfo.clear();
            }
        }
    }

    /**
     * Detach the invokes of every running thread.
     */
    public void detachInvokes() {
        try (IDisposable locks = new OrderedLocks(Arrays.<ILockable>asList(invoker, threadLock))) {
            registry.enumerate(registry.get(ThreadList.Kind.RUNNING), node -> invoker.detach(node.currentInvoke));
        } catch (DebugException e) {
            // the visitor never fails
            throw InternalAgentException.exit(e, "detaching invokes");
        }
    }

    public StepRequest getStepRequest(IRuntimeThread thread) {
        try (IDisposable lock = threadLock.acquire()) {
            ThreadNode node = registry.findRunning(thread);
            return node == null ? null : node.currentStep;
        }
    }

    public InvokeRequest getInvokeRequest(IRuntimeThread thread) {
        try (IDisposable lock = threadLock.acquire()) {
            ThreadNode node = registry.findRunning(thread);
            return node == null ? null : node.currentInvoke;
        }
    }

    public EventMode getInstructionStepMode(IRuntimeThread thread) {
        try (IDisposable lock = threadLock.acquire()) {
            ThreadNode node = registry.findRunning(thread);
            return node == null ? EventMode.DISABLE : node.instructionStepMode;
        }
    }

    /**
     * Set the notification mode of an event kind.
     *
     * @param mode the mode
     * @param event the event kind
     * @param thread the thread, or null to set it globally
     */
    public void setEventMode(EventMode mode, EventIndex event, IRuntimeThread thread) throws DebugException {
        if (thread == null) {
            runtime.setEventNotificationMode(mode, event, null);
            return;
        }
        try (IDisposable lock = threadLock.acquire()) {
            deferredModes.requestMode(registry.findRunning(thread), thread, event, mode);
        }
    }

    /**
     * The calling thread, if it has reported an event and not yet ended.
     */
    public IRuntimeThread currentThread() {
        IRuntimeThread current = runtime.getCurrentThread();
        if (current == null) {
            return null;
        }
        try (IDisposable lock = threadLock.acquire()) {
            ThreadNode node = registry.findRunning(current);
            return node == null ? null : node.getThread();
        }
    }

    /**
     * @return the frame generation of the thread, or -1 if the thread is unknown
     */
    public long getFrameGeneration(IRuntimeThread thread) {
        try (IDisposable lock = threadLock.acquire()) {
            ThreadNode node = registry.find(null, thread);
            return node == null ? -1 : node.getFrameGeneration();
        }
    }

    public List<IRuntimeThread> allVirtualThreads() {
        try (IDisposable lock = threadLock.acquire()) {
            return registry.virtualThreads();
        }
    }

    /**
     * Block until the debugger no longer holds the thread suspended.
     */
    public void awaitNotSuspended(IRuntimeThread thread) throws InterruptedException {
        try (IDisposable lock = threadLock.acquire()) {
            while (true) {
                ThreadNode node = registry.find(null, thread);
                if (node == null || node.suspendCount == 0) {
                    return;
                }
                threadLock.await();
            }
        }
    }

    /**
     * Register one of the agent's threads. A thread that already has a node
     * is released from any suspend thread control holds on it.
     */
    public void addDebugThread(IRuntimeThread thread) throws DebugException {
        checkThread(thread);
        try (IDisposable lock = threadLock.acquire()) {
            debugThreads.add(thread);
            ThreadNode node = registry.find(null, thread);
            if (node == null) {
                return;
            }
            node.isDebugThread = true;
            boolean toBeResumed = node.toBeResumed;
            node.suspendCount = 0;
            node.suspendOnStart = false;
            node.toBeResumed = false;
            threadLock.notifyAllWaiters();
            if (toBeResumed) {
                Log.debug("resuming debug thread=%s", node);
                runtime.resumeThread(thread);
            }
        }
    }

    public boolean isDebugThread(IRuntimeThread thread) {
        return debugThreads.contains(thread);
    }

    public void popFrames(IRuntimeThread thread, int frameNumber) throws DebugException {
        checkThread(thread);
        popFrameController.popFrames(thread, frameNumber);
    }

    public Observable<ThreadControlEvent> events() {
        return eventSubject;
    }

    public String dumpAllThreads() {
        try (IDisposable lock = threadLock.acquire()) {
            return registry.dump();
        }
    }

    private void traceThreads(String operation) {
        if (settings.trace == AgentSettings.TraceMode.THREADS) {
            Log.info("after %s%n%s", operation, registry.dump());
        }
    }

    ThreadRegistry getRegistry() {
        return registry;
    }

    DeferredEventModes getDeferredModes() {
        return deferredModes;
    }

    ThreadLock getThreadLock() {
        return threadLock;
    }

    @Override
    public void close() {
        eventSubject.onComplete();
    }
}
