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

public interface ICollaboratorContext {
    <T extends ICollaborator> T getCollaborator(Class<T> clazz);

    void registerCollaborator(Class<? extends ICollaborator> clazz, ICollaborator collaborator);

    boolean isRegistered(Class<? extends ICollaborator> clazz);
}
