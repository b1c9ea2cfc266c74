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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class CollaboratorContext implements ICollaboratorContext {

    private Map<Class<? extends ICollaborator>, ICollaborator> collaboratorMap;

    public CollaboratorContext() {
        collaboratorMap = new ConcurrentHashMap<>();
    }

    /**
     * Get the registered collaborator with the interface type,
     * <code>IllegalArgumentException</code> will raise if the collaborator is absent.
     * The returned object is type-safe to be assigned to T since registerCollaborator
     * will check the compatibility, so suppress unchecked rule.
     */
    @SuppressWarnings("unchecked")
    @Override
    public <T extends ICollaborator> T getCollaborator(Class<T> clazz) {
        if (!collaboratorMap.containsKey(clazz)) {
            throw new IllegalArgumentException(String.format("%s has not been registered.", clazz.getName()));
        }
        return (T) collaboratorMap.get(clazz);
    }

    @Override
    public void registerCollaborator(Class<? extends ICollaborator> clazz, ICollaborator collaborator) {
        if (clazz == null) {
            throw new IllegalArgumentException("Null collaborator class is illegal.");
        }

        if (collaborator == null) {
            throw new IllegalArgumentException("Null collaborator is illegal.");
        }

        if (!clazz.isInterface()) {
            throw new IllegalArgumentException("The collaborator class should be an interface");
        }

        if (!clazz.isInstance(collaborator)) {
            throw new IllegalArgumentException(String.format("The collaborator doesn't implement interface %s.", clazz.getName()));
        }

        if (collaboratorMap.putIfAbsent(clazz, collaborator) != null) {
            throw new IllegalArgumentException(String.format("%s has already been registered.", clazz.getName()));
        }
    }

    @Override
    public boolean isRegistered(Class<? extends ICollaborator> clazz) {
        return clazz != null && collaboratorMap.containsKey(clazz);
    }
}
