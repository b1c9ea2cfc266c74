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

import com.microsoft.java.debug.agent.DebugException;

/**
 * Callback for {@link ThreadRegistry#enumerate(ThreadList, IThreadVisitor)}. Throwing
 * stops the enumeration and the exception is propagated to the caller.
 */
@FunctionalInterface
public interface IThreadVisitor {
    void visit(ThreadNode node) throws DebugException;
}
