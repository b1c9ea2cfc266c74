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

import java.util.concurrent.atomic.AtomicLong;

import com.microsoft.java.debug.agent.collaborator.EventBag;
import com.microsoft.java.debug.agent.collaborator.InvokeRequest;
import com.microsoft.java.debug.agent.collaborator.StepRequest;
import com.microsoft.java.debug.agent.runtime.EventIndex;
import com.microsoft.java.debug.agent.runtime.EventMode;
import com.microsoft.java.debug.agent.runtime.IRuntimeThread;

/**
 * Per-thread state kept by thread control. A node is created on the first
 * event or request that references its thread and destroyed after the
 * thread's end event has been handled. Besides the suspend counts it holds
 * the state other subsystems attach to a thread (current step, current
 * invoke, pending events).
 *
 * <p>All fields except the pop frame flags and the frame generation are
 * guarded by the threadLock.</p>
 */
public final class ThreadNode {
    private final IRuntimeThread thread;
    private final boolean virtual;

    /** A suspend issued by thread control succeeded and must be undone. */
    boolean toBeResumed = false;
    /** The thread was interrupted while handling an event. */
    boolean pendingInterrupt = false;
    boolean isDebugThread = false;
    /** The suspend must be applied for real once the thread starts. */
    boolean suspendOnStart = false;
    boolean isStarted = false;

    volatile boolean popFrameEvent = false;
    volatile boolean popFrameProceed = false;
    volatile boolean popFrameThread = false;

    /** Non-null while an event is being handled on this thread. */
    EventIndex currentEvent;
    /** Throwable to stop the thread with once its current event is handled. */
    Object pendingStop;
    int suspendCount = 0;
    EventMode instructionStepMode = EventMode.DISABLE;
    final StepRequest currentStep = new StepRequest();
    final InvokeRequest currentInvoke = new InvokeRequest();
    EventBag eventBag;
    final CoLocatedEventInfo cleInfo = new CoLocatedEventInfo();
    /** Invalidates frame ids handed out before a resume or a frame pop. */
    private final AtomicLong frameGeneration;
    /** Shared by all nodes of a registry, so a recreated node never reuses a generation. */
    private final AtomicLong generations;
    ThreadList list;

    ThreadNode(IRuntimeThread thread, boolean virtual, AtomicLong generations) {
        this.thread = thread;
        this.virtual = virtual;
        this.generations = generations;
        this.frameGeneration = new AtomicLong(generations.get());
    }

    public IRuntimeThread getThread() {
        return thread;
    }

    public boolean isVirtual() {
        return virtual;
    }

    public int getSuspendCount() {
        return suspendCount;
    }

    public boolean isToBeResumed() {
        return toBeResumed;
    }

    public boolean isSuspendOnStart() {
        return suspendOnStart;
    }

    public boolean isStarted() {
        return isStarted;
    }

    public boolean isDebugThread() {
        return isDebugThread;
    }

    public boolean isPendingInterrupt() {
        return pendingInterrupt;
    }

    public Object getPendingStop() {
        return pendingStop;
    }

    public boolean isHandlingEvent() {
        return currentEvent != null;
    }

    public EventIndex getCurrentEvent() {
        return currentEvent;
    }

    public EventMode getInstructionStepMode() {
        return instructionStepMode;
    }

    public StepRequest getCurrentStep() {
        return currentStep;
    }

    public InvokeRequest getCurrentInvoke() {
        return currentInvoke;
    }

    public EventBag getEventBag() {
        return eventBag;
    }

    public CoLocatedEventInfo getCoLocatedEventInfo() {
        return cleInfo;
    }

    public long getFrameGeneration() {
        return frameGeneration.get();
    }

    long nextFrameGeneration() {
        return frameGeneration.accumulateAndGet(generations.incrementAndGet(), Math::max);
    }

    public ThreadList.Kind getListKind() {
        return list == null ? null : list.getKind();
    }

    @Override
    public String toString() {
        return String.format("%s#%d", thread.name(), thread.uniqueID());
    }
}
