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

public interface IStepControl extends ICollaborator, ILockable {
    /**
     * Discard the pending step of the thread.
     */
    void clearRequest(IRuntimeThread thread, StepRequest request);

    /**
     * Recompute the step starting point after the thread's frames changed.
     */
    void resetRequest(IRuntimeThread thread);
}
