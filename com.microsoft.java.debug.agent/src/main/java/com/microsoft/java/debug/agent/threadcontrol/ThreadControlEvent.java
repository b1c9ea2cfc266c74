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

import com.microsoft.java.debug.agent.runtime.IRuntimeThread;

/**
 * Published after a resume that may let the command loop make progress.
 */
public class ThreadControlEvent {
    public enum Kind {
        RESUMED,
        RESUMED_ALL
    }

    private final Kind kind;
    private final IRuntimeThread thread;

    public ThreadControlEvent(Kind kind, IRuntimeThread thread) {
        this.kind = kind;
        this.thread = thread;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The resumed thread, null for {@link Kind#RESUMED_ALL}.
     */
    public IRuntimeThread getThread() {
        return thread;
    }

    @Override
    public String toString() {
        return thread == null ? kind.toString() : String.format("%s %s", kind, thread.name());
    }
}
