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

package com.microsoft.java.debug.agent;

public final class Configuration {
    public static final String LOGGER_NAME = "java-debug-agent";
    public static final String SETTINGS_RESOURCE = "thread-control.json";

    private Configuration() {

    }
}
