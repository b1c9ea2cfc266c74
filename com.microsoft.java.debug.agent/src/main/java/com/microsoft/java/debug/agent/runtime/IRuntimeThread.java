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
 * Opaque reference to a thread of the debuggee runtime. Implementations must
 * implement equals/hashCode so that two references to the same runtime thread
 * compare equal.
 */
public interface IRuntimeThread {
    /**
     * Returns a unique identifier for this thread.
     */
    long uniqueID();

    String name();

    /**
     * Whether this is a lightweight (virtual) thread.
     */
    boolean isVirtual();
}
