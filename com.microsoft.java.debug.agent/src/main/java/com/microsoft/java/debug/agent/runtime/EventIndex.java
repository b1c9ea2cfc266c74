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

package com.microsoft.java.debug.agent.runtime;

/**
 * The kinds of events the runtime reports to the agent.
 */
public enum EventIndex {
    SINGLE_STEP,
    BREAKPOINT,
    FRAME_POP,
    EXCEPTION,
    THREAD_START,
    THREAD_END,
    CLASS_PREPARE,
    GC_FINISH,
    CLASS_LOAD,
    FIELD_ACCESS,
    FIELD_MODIFICATION,
    EXCEPTION_CATCH,
    METHOD_ENTRY,
    METHOD_EXIT,
    MONITOR_CONTENDED_ENTER,
    MONITOR_CONTENDED_ENTERED,
    MONITOR_WAIT,
    MONITOR_WAITED,
    VM_INIT,
    VM_DEATH,
    VIRTUAL_THREAD_START,
    VIRTUAL_THREAD_END
}
