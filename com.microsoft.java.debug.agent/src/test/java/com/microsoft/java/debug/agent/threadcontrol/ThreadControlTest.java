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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.Before;
import org.junit.Test;

import com.microsoft.java.debug.agent.AgentSettings;
import com.microsoft.java.debug.agent.DebugException;
import com.microsoft.java.debug.agent.InternalAgentException;
import com.microsoft.java.debug.agent.collaborator.EventBag;
import com.microsoft.java.debug.agent.collaborator.IDisposable;
import com.microsoft.java.debug.agent.collaborator.InvokeRequest;
import com.microsoft.java.debug.agent.collaborator.StepRequest;
import com.microsoft.java.debug.agent.runtime.ErrorCode;
import com.microsoft.java.debug.agent.runtime.EventIndex;
import com.microsoft.java.debug.agent.runtime.EventMode;
import com.microsoft.java.debug.agent.runtime.IRuntimeThread;
import com.microsoft.java.debug.agent.runtime.ThreadStates;
import com.microsoft.java.debug.agent.runtime.ThreadStatus;

import io.reactivex.observers.TestObserver;

public class ThreadControlTest {
    private static final byte SESSION = 1;

    private FakeRuntime runtime;
    private FakeCollaborators collaborators;
    private AgentSettings settings;
    private ThreadControl threadControl;

    @Before
    public void setup() {
        runtime = new FakeRuntime();
        collaborators = new FakeCollaborators();
        settings = new AgentSettings();
        threadControl = new ThreadControl(runtime, collaborators.createContext(), settings);
    }

    private void start(IRuntimeThread thread) {
        EventBag bag = threadControl.onEventHandlerEntry(SESSION, new EventInfo(EventIndex.THREAD_START, thread));
        threadControl.onEventHandlerExit(EventIndex.THREAD_START, thread, bag);
    }

    private ThreadNode node(IRuntimeThread thread) {
        try (IDisposable lock = threadControl.getThreadLock().acquire()) {
            return threadControl.getRegistry().find(null, thread);
        }
    }

    @Test
    public void testSuspendResumeCount() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        threadControl.onHook();

        for (int i = 0; i < 3; i++) {
            threadControl.suspendThread(main, false);
        }
        assertEquals(3, threadControl.suspendCount(main));
        assertEquals("Should suspend physically only once.", 1, runtime.count("suspend", main));
        assertTrue(runtime.isSuspended(main));

        threadControl.resumeThread(main, false);
        threadControl.resumeThread(main, false);
        assertEquals(1, threadControl.suspendCount(main));
        assertEquals(0, runtime.count("resume", main));
        assertTrue(runtime.isSuspended(main));

        threadControl.resumeThread(main, false);
        assertEquals(0, threadControl.suspendCount(main));
        assertEquals(1, runtime.count("resume", main));
        assertFalse(runtime.isSuspended(main));

        threadControl.resumeThread(main, false);
        assertEquals("Should never go negative.", 0, threadControl.suspendCount(main));
        assertEquals(1, runtime.count("resume", main));
    }

    @Test
    public void testResumeUnsuspendedThread() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        FakeThread unknown = runtime.startThread(2, "unknown");
        threadControl.onHook();
        runtime.clearCalls();

        threadControl.resumeThread(main, false);
        threadControl.resumeThread(unknown, false);
        assertTrue("Should not call any primitive.", runtime.getCalls().isEmpty());
        assertEquals(0, threadControl.suspendCount(main));
    }

    @Test
    public void testSuspendAllResumeAllRoundTrip() throws Exception {
        FakeThread t1 = runtime.startThread(1, "t1");
        FakeThread t2 = runtime.startThread(2, "t2");
        FakeThread t3 = runtime.startThread(3, "t3");
        FakeThread vt = runtime.startVirtualThread(4, "vt");
        FakeThread untracked = runtime.startVirtualThread(5, "vt-untracked");
        threadControl.onHook();
        start(vt);

        threadControl.suspendThread(t1, false);
        threadControl.suspendThread(vt, false);

        threadControl.suspendAll();
        assertEquals(1, threadControl.getSuspendAllCount());
        assertEquals(2, threadControl.suspendCount(t1));
        assertEquals(1, threadControl.suspendCount(t2));
        assertEquals(1, threadControl.suspendCount(t3));
        assertEquals(2, threadControl.suspendCount(vt));
        assertEquals("Untracked virtual threads follow suspendAll.", 1, threadControl.suspendCount(untracked));
        assertTrue(runtime.isSuspended(untracked));
        assertEquals(1, collaborators.commonRef.pinned);
        assertEquals("t1 is a nested suspend.", 0, runtime.count("suspendList", t1));

        threadControl.resumeAll();
        assertEquals(0, threadControl.getSuspendAllCount());
        assertEquals(1, threadControl.suspendCount(t1));
        assertEquals(0, threadControl.suspendCount(t2));
        assertEquals(0, threadControl.suspendCount(t3));
        assertEquals(1, threadControl.suspendCount(vt));
        assertEquals(0, threadControl.suspendCount(untracked));
        assertEquals(0, collaborators.commonRef.pinned);

        assertTrue(runtime.isSuspended(t1));
        assertFalse(runtime.isSuspended(t2));
        assertFalse(runtime.isSuspended(t3));
        assertTrue("Still suspended individually.", runtime.isSuspended(vt));
        assertFalse(runtime.isSuspended(untracked));
        assertEquals(2, runtime.count("resumeList"));
    }

    @Test
    public void testSuspendOnStart() throws Exception {
        FakeThread late = runtime.newThread(1, "late");

        threadControl.suspendThread(late, false);
        threadControl.suspendThread(late, false);
        ThreadNode node = node(late);
        assertEquals(2, node.getSuspendCount());
        assertTrue(node.isSuspendOnStart());
        assertFalse(node.isToBeResumed());
        assertEquals(ThreadList.Kind.OTHER, node.getListKind());
        assertFalse(runtime.isSuspended(late));

        runtime.setState(late, FakeRuntime.RUNNING_STATE);
        EventBag bag = threadControl.onEventHandlerEntry(SESSION, new EventInfo(EventIndex.THREAD_START, late));
        assertNotNull(bag);
        assertEquals(ThreadList.Kind.RUNNING, node.getListKind());
        assertEquals("Should ask the helper to suspend it.", 1, collaborators.eventHelper.suspendRequests.size());
        assertSame(late, collaborators.eventHelper.suspendRequests.get(0));

        // what the helper thread does
        threadControl.suspendThread(late, true);
        threadControl.onEventHandlerExit(EventIndex.THREAD_START, late, bag);

        assertTrue(runtime.isSuspended(late));
        assertEquals("The count is unchanged by the deferred suspend.", 2, threadControl.suspendCount(late));
        assertFalse(node.isSuspendOnStart());
        assertTrue(node.isToBeResumed());
        // the first attempt failed because the thread was not alive
        assertEquals(2, runtime.count("suspend", late));

        threadControl.resumeThread(late, false);
        threadControl.resumeThread(late, false);
        assertFalse(runtime.isSuspended(late));
        assertEquals(1, runtime.count("resume", late));
    }

    @Test
    public void testSuspendOnStartUndoneBeforeStart() throws Exception {
        FakeThread late = runtime.newThread(1, "late");
        threadControl.suspendThread(late, false);
        ThreadNode node = node(late);
        threadControl.resumeThread(late, false);
        assertEquals(0, node.getSuspendCount());

        assertNull("Resumed nodes leave the other list.", node(late));

        runtime.setState(late, FakeRuntime.RUNNING_STATE);
        threadControl.suspendThread(late, true);
        assertFalse("Nothing left to suspend.", runtime.isSuspended(late));
        assertEquals(0, threadControl.suspendCount(late));
    }

    @Test
    public void testNestedSuspend() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        threadControl.onHook();

        threadControl.suspendThread(main, false);
        threadControl.suspendThread(main, false);
        threadControl.resumeThread(main, false);
        threadControl.resumeThread(main, false);

        assertEquals(1, runtime.count("suspend", main));
        assertEquals(1, runtime.count("resume", main));
        assertFalse(runtime.isSuspended(main));
    }

    @Test
    public void testDebugThreadsAreNeverSuspended() throws Exception {
        FakeThread agent = runtime.startThread(1, "agent");
        FakeThread main = runtime.startThread(2, "main");
        threadControl.addDebugThread(agent);
        threadControl.onHook();

        threadControl.suspendThread(agent, false);
        threadControl.suspendThread(agent, false);
        threadControl.suspendAll();
        assertEquals(0, threadControl.suspendCount(agent));
        assertEquals(1, threadControl.suspendCount(main));
        threadControl.resumeAll();
        threadControl.resumeThread(agent, false);

        assertTrue(threadControl.isDebugThread(agent));
        assertEquals(0, threadControl.suspendCount(agent));
        assertEquals(0, runtime.count("suspend", agent));
        assertEquals(0, runtime.count("suspendList", agent));
        assertEquals(0, runtime.count("resume", agent));
        assertEquals(0, runtime.count("resumeList", agent));
        assertFalse(runtime.isSuspended(agent));
    }

    @Test
    public void testDebugThreadRegisteredAfterHook() throws Exception {
        FakeThread agent = runtime.startThread(1, "agent");
        FakeThread main = runtime.startThread(2, "main");
        threadControl.onHook();
        threadControl.suspendThread(agent, false);
        assertTrue(runtime.isSuspended(agent));

        threadControl.addDebugThread(agent);
        assertTrue(threadControl.isDebugThread(agent));
        assertEquals(0, threadControl.suspendCount(agent));
        assertFalse("The suspend held on it is undone.", runtime.isSuspended(agent));
        assertEquals(1, runtime.count("resume", agent));

        threadControl.suspendAll();
        assertEquals(0, threadControl.suspendCount(agent));
        assertEquals(1, threadControl.suspendCount(main));
        assertEquals(0, runtime.count("suspendList", agent));
        assertFalse(runtime.isSuspended(agent));
        threadControl.resumeAll();
        assertEquals(1, runtime.count("resume", agent));
    }

    @Test
    public void testDeferredEventMode() throws Exception {
        FakeThread late = runtime.newThread(1, "late");
        FakeThread other = runtime.newThread(2, "other");
        String call = "mode ENABLE SINGLE_STEP";

        threadControl.setEventMode(EventMode.ENABLE, EventIndex.SINGLE_STEP, late);
        threadControl.setEventMode(EventMode.ENABLE, EventIndex.BREAKPOINT, other);
        assertEquals(2, threadControl.getDeferredModes().size());
        assertEquals(0, runtime.count(call, late));

        start(late);
        assertEquals("Should be applied on start.", 1, runtime.count(call, late));
        assertEquals("Entries of other threads stay queued.", 1, threadControl.getDeferredModes().size());
        assertEquals(EventMode.ENABLE, threadControl.getInstructionStepMode(late));

        start(late);
        assertEquals("Should be applied only once.", 1, runtime.count(call, late));

        threadControl.setEventMode(EventMode.DISABLE, EventIndex.SINGLE_STEP, late);
        assertEquals("Started threads get the mode right away.", 1, runtime.count("mode DISABLE SINGLE_STEP", late));
        assertEquals(EventMode.DISABLE, threadControl.getInstructionStepMode(late));

        threadControl.setEventMode(EventMode.ENABLE, EventIndex.CLASS_PREPARE, null);
        assertTrue(runtime.getCalls().contains("mode ENABLE CLASS_PREPARE"));
    }

    @Test
    public void testReset() throws Exception {
        FakeThread t1 = runtime.startThread(1, "t1");
        FakeThread t2 = runtime.startThread(2, "t2");
        FakeThread t3 = runtime.startThread(3, "t3");
        FakeThread vt = runtime.startVirtualThread(4, "vt");
        FakeThread late = runtime.newThread(5, "late");
        threadControl.onHook();
        start(vt);

        threadControl.suspendAll();
        threadControl.suspendThread(t1, false);
        threadControl.setEventMode(EventMode.ENABLE, EventIndex.SINGLE_STEP, late);
        assertEquals(2, threadControl.suspendCount(t1));

        threadControl.reset();

        for (FakeThread thread : new FakeThread[] { t1, t2, t3, vt }) {
            assertFalse(thread + " should be resumed.", runtime.isSuspended(thread));
            assertEquals(0, threadControl.suspendCount(thread));
        }
        assertEquals(0, threadControl.getSuspendAllCount());
        assertTrue(threadControl.getDeferredModes().isEmpty());
        assertEquals(1, runtime.count("resumeAllVirtual"));
        assertEquals(1, collaborators.eventHandler.waitForActiveCallbacksCount);
        assertTrue("Virtual threads are forgotten.", threadControl.allVirtualThreads().isEmpty());
        assertTrue(collaborators.stepControl.cleared.contains(t1));
    }

    @Test
    public void testResetRemembersVirtualThreads() throws Exception {
        settings.rememberVThreadsWhenDisconnected = true;
        FakeThread vt = runtime.startVirtualThread(1, "vt");
        start(vt);

        threadControl.reset();
        assertEquals(1, threadControl.allVirtualThreads().size());
        assertEquals(0, collaborators.eventHandler.waitForActiveCallbacksCount);
    }

    @Test
    public void testThreadSuspendedByOthersIsNotResumed() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        FakeThread parked = runtime.startThread(2, "parked");
        runtime.suspendExternally(parked);
        threadControl.onHook();

        threadControl.suspendAll();
        assertEquals(1, threadControl.suspendCount(parked));
        assertFalse(node(parked).isToBeResumed());

        threadControl.resumeAll();
        assertEquals(0, threadControl.suspendCount(parked));
        assertTrue("Should leave it to whoever suspended it.", runtime.isSuspended(parked));
        assertFalse(runtime.isSuspended(main));
    }

    @Test
    public void testSuspendFailure() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        threadControl.onHook();
        runtime.failSuspend(main, ErrorCode.INVALID_THREAD);

        try {
            threadControl.suspendThread(main, false);
            fail("Should propagate the suspend failure.");
        } catch (DebugException ex) {
            assertEquals(ErrorCode.INVALID_THREAD, ex.getError());
        }
        assertEquals(0, threadControl.suspendCount(main));
    }

    @Test
    public void testSuspendListFailure() throws Exception {
        FakeThread t1 = runtime.startThread(1, "t1");
        FakeThread t2 = runtime.startThread(2, "t2");
        FakeThread t3 = runtime.startThread(3, "t3");
        threadControl.onHook();
        runtime.failSuspend(t2, ErrorCode.INVALID_THREAD);

        try {
            threadControl.suspendAll();
            fail("Should surface the failed thread.");
        } catch (DebugException ex) {
            assertEquals(ErrorCode.INVALID_THREAD, ex.getError());
        }

        assertEquals("A failed suspend is not counted.", 0, threadControl.suspendCount(t2));
        assertFalse(runtime.isSuspended(t2));
        assertEquals("The rest of the batch goes on.", 1, threadControl.suspendCount(t1));
        assertEquals(1, threadControl.suspendCount(t3));
        assertTrue(runtime.isSuspended(t3));
        assertEquals(0, threadControl.getSuspendAllCount());

        threadControl.resumeThread(t1, false);
        threadControl.resumeThread(t3, false);
        assertFalse(runtime.isSuspended(t1));
        assertFalse(runtime.isSuspended(t3));
        assertEquals(0, runtime.count("resume", t2));
    }

    @Test
    public void testResumeFailure() throws Exception {
        FakeThread unseen = runtime.startThread(1, "unseen");
        threadControl.suspendThread(unseen, false);
        runtime.failResume(unseen, ErrorCode.THREAD_NOT_ALIVE);
        threadControl.resumeThread(unseen, false);
        assertEquals(0, threadControl.suspendCount(unseen));
        assertEquals("Resumed nodes leave the other list.", -1, threadControl.getFrameGeneration(unseen));

        FakeThread main = runtime.startThread(2, "main");
        threadControl.onHook();
        threadControl.suspendThread(main, false);
        runtime.failResume(main, ErrorCode.THREAD_NOT_ALIVE);
        try {
            threadControl.resumeThread(main, false);
            fail("A started thread failing to resume is an error.");
        } catch (DebugException ex) {
            assertEquals(ErrorCode.THREAD_NOT_ALIVE, ex.getError());
        }
        assertEquals(0, threadControl.suspendCount(main));
    }

    @Test
    public void testResumeEvents() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        threadControl.onHook();
        TestObserver<ThreadControlEvent> observer = threadControl.events().test();

        threadControl.resumeThread(main, true);
        threadControl.resumeThread(main, false);
        threadControl.resumeAll();

        observer.assertValueCount(2);
        assertEquals(ThreadControlEvent.Kind.RESUMED, observer.values().get(0).getKind());
        assertSame(main, observer.values().get(0).getThread());
        assertEquals(ThreadControlEvent.Kind.RESUMED_ALL, observer.values().get(1).getKind());
        assertNull(observer.values().get(1).getThread());

        threadControl.close();
        observer.assertComplete();
    }

    @Test
    public void testConcurrentResumeEvents() throws Exception {
        FakeThread unseen = new FakeThread(1, "unseen");
        TestObserver<ThreadControlEvent> observer = threadControl.events().test();
        List<Thread> commandThreads = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Thread commandThread = new Thread(() -> {
                for (int j = 0; j < 100; j++) {
                    try {
                        threadControl.resumeThread(unseen, true);
                        threadControl.resumeAll();
                    } catch (DebugException e) {
                        throw new IllegalStateException(e);
                    }
                }
            });
            commandThreads.add(commandThread);
            commandThread.start();
        }
        for (Thread commandThread : commandThreads) {
            commandThread.join();
        }

        observer.assertNoErrors();
        observer.assertValueCount(800);
    }

    @Test
    public void testPendingInterruptAndStop() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        threadControl.onHook();
        Object throwable = new Object();

        EventBag bag = threadControl.onEventHandlerEntry(SESSION, new EventInfo(EventIndex.BREAKPOINT, main));
        threadControl.interrupt(main);
        threadControl.stop(main, throwable);
        assertEquals("Held while the event is handled.", 0, runtime.count("interrupt", main));
        assertEquals(0, runtime.count("stop", main));
        assertTrue(node(main).isPendingInterrupt());
        assertSame(throwable, node(main).getPendingStop());

        threadControl.onEventHandlerExit(EventIndex.BREAKPOINT, main, bag);
        assertEquals(1, runtime.count("interrupt", main));
        assertEquals(1, runtime.count("stop", main));
        assertFalse(node(main).isPendingInterrupt());
        assertNull(node(main).getPendingStop());
        assertFalse(node(main).isHandlingEvent());

        threadControl.interrupt(main);
        assertEquals(2, runtime.count("interrupt", main));
    }

    @Test
    public void testApplicationThreadStatus() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        FakeThread late = runtime.newThread(2, "late");
        threadControl.onHook();

        ThreadStatusInfo status = threadControl.applicationThreadStatus(main);
        assertEquals(ThreadStatus.RUNNING, status.getStatus());
        assertFalse(status.isSuspended());

        threadControl.suspendThread(main, false);
        assertTrue(threadControl.applicationThreadStatus(main).isSuspended());
        assertEquals(ThreadStatus.SUSPEND_STATUS_SUSPENDED, threadControl.applicationThreadStatus(main).getSuspendFlags());

        runtime.setState(main, ThreadStates.ALIVE | ThreadStates.SLEEPING | ThreadStates.WAITING);
        assertEquals(ThreadStatus.SLEEPING, threadControl.applicationThreadStatus(main).getStatus());

        EventBag bag = threadControl.onEventHandlerEntry(SESSION, new EventInfo(EventIndex.BREAKPOINT, main));
        assertEquals("Handling an event counts as running.", ThreadStatus.RUNNING,
                threadControl.applicationThreadStatus(main).getStatus());
        threadControl.onEventHandlerExit(EventIndex.BREAKPOINT, main, bag);

        assertEquals(ThreadStatus.ZOMBIE, threadControl.applicationThreadStatus(late).getStatus());
    }

    @Test
    public void testFrameGeneration() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        assertEquals(-1, threadControl.getFrameGeneration(main));

        threadControl.onHook();
        assertEquals(0, threadControl.getFrameGeneration(main));

        threadControl.suspendThread(main, false);
        threadControl.resumeThread(main, false);
        assertEquals(1, threadControl.getFrameGeneration(main));

        threadControl.suspendAll();
        threadControl.resumeAll();
        assertEquals(2, threadControl.getFrameGeneration(main));
    }

    @Test
    public void testAwaitNotSuspended() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        threadControl.onHook();
        threadControl.suspendThread(main, false);

        AtomicBoolean done = new AtomicBoolean(false);
        Thread waiter = new Thread(() -> {
            try {
                threadControl.awaitNotSuspended(main);
                done.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        Thread.sleep(100);
        assertFalse("Should wait while suspended.", done.get());

        threadControl.resumeThread(main, false);
        waiter.join(5000);
        assertTrue(done.get());
    }

    @Test
    public void testThreadEnd() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        threadControl.onHook();

        EventBag bag = threadControl.onEventHandlerEntry(SESSION, new EventInfo(EventIndex.THREAD_END, main));
        threadControl.onEventHandlerExit(EventIndex.THREAD_END, main, bag);
        assertEquals(-1, threadControl.getFrameGeneration(main));
        assertTrue(collaborators.stepControl.cleared.contains(main));
        assertFalse(collaborators.eventHandler.isLocked());
    }

    @Test
    public void testExitOfUnknownThread() {
        FakeThread unknown = runtime.startThread(1, "unknown");
        try {
            threadControl.onEventHandlerExit(EventIndex.BREAKPOINT, unknown, null);
            fail("Should detect the corrupted thread list.");
        } catch (InternalAgentException ex) {
            assertEquals(ErrorCode.NULL_POINTER, ex.getError());
        }
    }

    @Test
    public void testEventBeforeStart() throws Exception {
        FakeThread late = runtime.newThread(1, "late");
        assertNull(threadControl.getStepRequest(late));
        threadControl.suspendThread(late, false);
        assertNull("Not running yet.", threadControl.getInvokeRequest(late));

        runtime.setState(late, FakeRuntime.RUNNING_STATE);
        EventBag bag = threadControl.onEventHandlerEntry(SESSION, new EventInfo(EventIndex.METHOD_ENTRY, late));
        assertEquals(ThreadList.Kind.RUNNING, node(late).getListKind());
        assertNotNull(threadControl.getStepRequest(late));
        assertNotNull(threadControl.getInvokeRequest(late));
        bag.add("method entry");
        threadControl.onEventHandlerExit(EventIndex.METHOD_ENTRY, late, bag);

        EventBag next = threadControl.onEventHandlerEntry(SESSION, new EventInfo(EventIndex.BREAKPOINT, late));
        assertSame("The bag handed back on exit is reused.", bag, next);
        assertEquals(1, next.getEvents().size());
        threadControl.onEventHandlerExit(EventIndex.BREAKPOINT, late, next);
    }

    @Test
    public void testResumedVirtualThreadIsEvicted() throws Exception {
        FakeThread vt = runtime.startVirtualThread(1, "vt");
        start(vt);
        assertEquals(1, threadControl.allVirtualThreads().size());

        threadControl.suspendThread(vt, false);
        threadControl.resumeThread(vt, false);
        assertTrue(threadControl.allVirtualThreads().isEmpty());
        assertEquals(0, threadControl.suspendCount(vt));
    }

    @Test
    public void testVirtualThreadWithPendingRequestsIsKept() throws Exception {
        FakeThread vt = runtime.startVirtualThread(1, "vt");
        start(vt);

        StepRequest step = threadControl.getStepRequest(vt);
        step.setPending(true);
        step.setGranularity(1);
        step.setDepth(2);
        InvokeRequest invoke = threadControl.getInvokeRequest(vt);
        invoke.setPending(true);
        invoke.setStarted(true);

        threadControl.suspendThread(vt, false);
        threadControl.resumeThread(vt, false);
        assertEquals("A pending step keeps the record.", 1, threadControl.allVirtualThreads().size());
        assertSame(step, threadControl.getStepRequest(vt));
        assertEquals(1, step.getGranularity());
        assertEquals(2, step.getDepth());

        step.setPending(false);
        threadControl.suspendThread(vt, false);
        threadControl.resumeThread(vt, false);
        assertEquals("A pending invoke keeps the record.", 1, threadControl.allVirtualThreads().size());
        assertTrue(threadControl.getInvokeRequest(vt).isStarted());

        invoke.setPending(false);
        threadControl.suspendThread(vt, false);
        threadControl.resumeThread(vt, false);
        assertTrue(threadControl.allVirtualThreads().isEmpty());
    }

    @Test
    public void testFrameGenerationAfterEviction() throws Exception {
        FakeThread vt = runtime.startVirtualThread(1, "vt");
        start(vt);

        threadControl.suspendThread(vt, false);
        long issued = threadControl.getFrameGeneration(vt);
        threadControl.resumeThread(vt, false);
        assertTrue(threadControl.allVirtualThreads().isEmpty());

        threadControl.suspendThread(vt, false);
        assertEquals(1, threadControl.allVirtualThreads().size());
        assertTrue("Frame ids issued before the resume stay stale.", threadControl.getFrameGeneration(vt) > issued);
        threadControl.resumeThread(vt, false);
    }

    @Test
    public void testRememberedVirtualThreadIsKept() throws Exception {
        settings.rememberVThreadsWhenDisconnected = true;
        FakeThread vt = runtime.startVirtualThread(1, "vt");
        start(vt);

        threadControl.suspendThread(vt, false);
        threadControl.resumeThread(vt, false);
        assertEquals(1, threadControl.allVirtualThreads().size());
    }

    @Test
    public void testDetachInvokes() throws Exception {
        runtime.startThread(1, "t1");
        runtime.startThread(2, "t2");
        threadControl.onHook();

        threadControl.detachInvokes();
        assertEquals(2, collaborators.invoker.detached.size());
        assertTrue(collaborators.invoker.detached.get(0).isDetached());
    }

    @Test
    public void testCoLocatedEventInfo() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        threadControl.onHook();
        Object clazz = new Object();
        Object method = new Object();

        assertFalse(threadControl.compareCoLocatedEventInfo(main, clazz, method, 5));
        threadControl.saveCoLocatedEventInfo(main, EventIndex.BREAKPOINT, clazz, method, 5);
        assertTrue(threadControl.compareCoLocatedEventInfo(main, clazz, method, 5));
        assertFalse(threadControl.compareCoLocatedEventInfo(main, clazz, method, 6));
        assertFalse(threadControl.compareCoLocatedEventInfo(main, new Object(), method, 5));

        threadControl.clearCoLocatedEventInfo(main);
        assertFalse(threadControl.compareCoLocatedEventInfo(main, clazz, method, 5));
    }

    @Test
    public void testCurrentThread() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        assertNull(threadControl.currentThread());

        runtime.setCurrentThread(main);
        assertNull("Not known until it reports an event.", threadControl.currentThread());

        threadControl.onHook();
        assertSame(main, threadControl.currentThread());
    }

    @Test
    public void testDumpAllThreads() throws Exception {
        FakeThread main = runtime.startThread(1, "main");
        FakeThread listener = runtime.startThread(2, "listener");
        threadControl.addDebugThread(listener);
        threadControl.onHook();
        threadControl.suspendThread(main, false);

        String dump = threadControl.dumpAllThreads();
        assertTrue(dump.contains("main#1 suspendCount=1"));
        assertFalse("Debug threads are left out.", dump.contains("listener"));
    }
}
