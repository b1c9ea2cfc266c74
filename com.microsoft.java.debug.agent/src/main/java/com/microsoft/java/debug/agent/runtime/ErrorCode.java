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

import java.util.Arrays;

/**
 * Result codes of the runtime control primitives. The ids follow the JVMTI
 * numbering so that a native bridge can map them one to one.
 */
public enum ErrorCode {
    NONE(0),
    INVALID_THREAD(10),
    THREAD_NOT_SUSPENDED(13),
    THREAD_SUSPENDED(14),
    THREAD_NOT_ALIVE(15),
    NO_MORE_FRAMES(31),
    OPAQUE_FRAME(32),
    NULL_POINTER(100),
    INVALID_EVENT_TYPE(102),
    ILLEGAL_ARGUMENT(103),
    OUT_OF_MEMORY(110),
    INTERNAL(113),
    UNKNOWN_FAILURE(1000);

    private int id;

    ErrorCode(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    /**
     * Get the corresponding ErrorCode type by the error code id.
     * If the error code is not defined in the enum type, return ErrorCode.UNKNOWN_FAILURE.
     * @param id
     *             the error code id.
     * @return the ErrorCode type.
     */
    public static ErrorCode parse(int id) {
        ErrorCode[] found = Arrays.stream(ErrorCode.values()).filter(code -> {
            return code.getId() == id;
        }).toArray(ErrorCode[]::new);

        if (found.length > 0) {
            return found[0];
        }
        return ErrorCode.UNKNOWN_FAILURE;
    }
}
