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

public interface IInvoker extends ICollaborator, ILockable {
    void detach(InvokeRequest request);

    boolean isEnabled(IRuntimeThread thread);

    void enableInvokeRequests(IRuntimeThread thread);
}
