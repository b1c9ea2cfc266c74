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

/**
 * A subsystem whose lock may be taken by an application thread while it
 * handles an event. Thread control grabs these locks, in a fixed order,
 * before suspending application threads.
 */
public interface ILockable {
    void lock();

    void unlock();
}
