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

import com.microsoft.java.debug.agent.runtime.IRuntimeThread;

public interface IEventHelper extends ICollaborator, ILockable {
    /**
     * Ask the helper thread to apply a deferred suspend to the thread. The
     * helper is expected to call back into thread control with deferred=true.
     *
     * @param sessionId the debugger session the request belongs to
     * @param thread the thread to suspend
     */
    void suspendThread(byte sessionId, IRuntimeThread thread);

    default EventBag createEventBag() {
        return new EventBag();
    }
}
