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

import com.microsoft.java.debug.agent.AgentSettings;
import com.microsoft.java.debug.agent.DebugException;
import com.microsoft.java.debug.agent.InternalAgentException;
import com.microsoft.java.debug.agent.Log;
import com.microsoft.java.debug.agent.collaborator.IDisposable;
import com.microsoft.java.debug.agent.collaborator.IInvoker;
import com.microsoft.java.debug.agent.collaborator.IStepControl;
import com.microsoft.java.debug.agent.runtime.ErrorCode;
import com.microsoft.java.debug.agent.runtime.EventIndex;
import com.microsoft.java.debug.agent.runtime.EventMode;
import com.microsoft.java.debug.agent.runtime.IRuntimeControl;
import com.microsoft.java.debug.agent.runtime.IRuntimeThread;

/**
 * Pops frames of a suspended thread one at a time. After each pop the thread
 * is resumed until it reports the single step event the pop produces, then
 * it is suspended again before the event handler lets it go on.
 *
 * <p>The handshake uses two monitors of its own. The event handler side must
 * be able to complete it without taking the threadLock, which the popping
 * side may need while the application thread is parked in the handshake.</p>
 */
public class PopFrameController {
    private final Object popFrameEventLock = new Object();
    private final Object popFrameProceedLock = new Object();

    private final IRuntimeControl runtime;
    private final ThreadRegistry registry;
    private final ThreadLock threadLock;
    private final IStepControl stepControl;
    private final IInvoker invoker;
    private final AgentSettings settings;
    private final ThreadControl threadControl;

    PopFrameController(ThreadControl threadControl, IRuntimeControl runtime, ThreadRegistry registry, ThreadLock threadLock,
            IStepControl stepControl, IInvoker invoker, AgentSettings settings) {
        this.threadControl = threadControl;
        this.runtime = runtime;
        this.registry = registry;
        this.threadLock = threadLock;
        this.stepControl = stepControl;
        this.invoker = invoker;
        this.settings = settings;
    }

    /**
     * Pop frames off the stack of the thread until the given frame has been popped.
     *
     * @param thread the suspended thread
     * @param frameNumber the number of the last frame to pop, 0 being the top frame
     * @throws DebugException if a frame cannot be popped
     */
    public void popFrames(IRuntimeThread thread, int frameNumber) throws DebugException {
        int popCount = frameNumber + 1;
        if (popCount < 1) {
            throw new DebugException("No more frames to pop", ErrorCode.NO_MORE_FRAMES);
        }

        EventMode prevStepMode = threadControl.getInstructionStepMode(thread);
        // popping disables invokes, restore them afterwards
        boolean prevInvokeEnabled = invoker.isEnabled(thread);

        threadControl.setEventMode(EventMode.ENABLE, EventIndex.SINGLE_STEP, thread);

        DebugException error = null;
        synchronized (popFrameEventLock) {
            setPopFrameThread(thread, true);
            try {
                for (int popped = 0; popped < popCount; popped++) {
                    popOneFrame(thread);
                }
            } catch (DebugException e) {
                error = e;
            } finally {
                setPopFrameThread(thread, false);
            }
        }

        // the step has to start over from the new top frame
        if (prevStepMode == EventMode.ENABLE) {
            stepControl.resetRequest(thread);
        }
        if (prevInvokeEnabled) {
            invoker.enableInvokeRequests(thread);
        }

        try {
            threadControl.setEventMode(prevStepMode, EventIndex.SINGLE_STEP, thread);
        } catch (DebugException e) {
            Log.warn("Failed to restore the single step mode of thread %s: %s", thread.name(), e.getMessage());
        }

        if (error != null) {
            throw error;
        }
    }

    /**
     * Pop one frame. Must be called with popFrameEventLock held.
     */
    private void popOneFrame(IRuntimeThread thread) throws DebugException {
        runtime.popFrame(thread);

        // let the pop happen so that the thread reports the event after it
        Log.debug("thread=%s resumed in popOneFrame", thread.name());
        runtime.resumeThread(thread);

        setPopFrameEvent(thread, false);
        boolean interrupted = false;
        while (!getPopFrameEvent(thread)) {
            try {
                popFrameEventLock.wait();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }

        // the popped thread is parked on popFrameProceedLock once we get it
        try {
            synchronized (popFrameProceedLock) {
                Log.debug("thread=%s suspended in popOneFrame", thread.name());
                try {
                    runtime.suspendThread(thread);
                } finally {
                    setPopFrameProceed(thread, true);
                    popFrameProceedLock.notifyAll();
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Called on the popped thread: tell the popping side the event arrived and
     * wait until it has suspended this thread again.
     */
    private void popFrameCompleteEvent(IRuntimeThread thread) {
        boolean interrupted = false;
        synchronized (popFrameProceedLock) {
            synchronized (popFrameEventLock) {
                setPopFrameEvent(thread, true);
                popFrameEventLock.notifyAll();
            }

            setPopFrameProceed(thread, false);
            while (!getPopFrameProceed(thread)) {
                try {
                    popFrameProceedLock.wait();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Check whether an event reported on the thread belongs to a pop in progress.
     *
     * @return true if the event was consumed and must not be dispatched
     */
    boolean checkForPopFrameEvents(EventIndex event, IRuntimeThread thread) {
        if (!getPopFrameThread(thread)) {
            return false;
        }
        switch (event) {
            case THREAD_START:
                throw InternalAgentException.exit(ErrorCode.INTERNAL, "thread start during pop frame");
            case THREAD_END:
                // the thread wants to end, let it
                setPopFrameThread(thread, false);
                popFrameCompleteEvent(thread);
                return false;
            case VIRTUAL_THREAD_START:
            case VIRTUAL_THREAD_END:
                if (settings.assertOn) {
                    throw InternalAgentException.exit(ErrorCode.INTERNAL, event + " during pop frame");
                }
                return false;
            case SINGLE_STEP:
                // the event we asked for to mark the end of the pop
                popFrameCompleteEvent(thread);
                return true;
            case BREAKPOINT:
            case EXCEPTION:
            case FIELD_ACCESS:
            case FIELD_MODIFICATION:
            case METHOD_ENTRY:
            case METHOD_EXIT:
                return true;
            default:
                return false;
        }
    }

    boolean getPopFrameThread(IRuntimeThread thread) {
        ThreadNode node = findNode(thread);
        return node != null && node.popFrameThread;
    }

    private void setPopFrameThread(IRuntimeThread thread, boolean value) {
        ThreadNode node = findNode(thread);
        if (node == null) {
            // the node of an ended thread may be gone already when clearing
            if (value) {
                throw InternalAgentException.exit(ErrorCode.NULL_POINTER, "entry in thread table");
            }
            return;
        }
        node.popFrameThread = value;
    }

    private boolean getPopFrameEvent(IRuntimeThread thread) {
        return requireNode(thread).popFrameEvent;
    }

    private void setPopFrameEvent(IRuntimeThread thread, boolean value) {
        ThreadNode node = requireNode(thread);
        node.popFrameEvent = value;
        if (value) {
            // one frame less, frame ids handed out before are stale
            node.nextFrameGeneration();
        }
    }

    private boolean getPopFrameProceed(IRuntimeThread thread) {
        return requireNode(thread).popFrameProceed;
    }

    private void setPopFrameProceed(IRuntimeThread thread, boolean value) {
        requireNode(thread).popFrameProceed = value;
    }

    private ThreadNode requireNode(IRuntimeThread thread) {
        ThreadNode node = findNode(thread);
        if (node == null) {
            throw InternalAgentException.exit(ErrorCode.NULL_POINTER, "entry in thread table");
        }
        return node;
    }

    private ThreadNode findNode(IRuntimeThread thread) {
        ThreadNode node = registry.lookup(thread);
        if (node != null) {
            return node;
        }
        try (IDisposable lock = threadLock.acquire()) {
            return registry.find(null, thread);
        }
    }
}
