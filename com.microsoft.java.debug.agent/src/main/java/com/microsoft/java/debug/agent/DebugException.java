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

import com.microsoft.java.debug.agent.runtime.ErrorCode;

public class DebugException extends Exception {
    private static final long serialVersionUID = 1L;
    private int errorCode = ErrorCode.UNKNOWN_FAILURE.getId();

    public DebugException() {
        super();
    }

    public DebugException(String message) {
        super(message);
    }

    public DebugException(String message, Throwable cause) {
        super(message, cause);
    }

    public DebugException(String message, int errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public DebugException(String message, ErrorCode error) {
        this(message, error.getId());
    }

    public DebugException(String message, Throwable cause, ErrorCode error) {
        super(message, cause);
        this.errorCode = error.getId();
    }

    public int getErrorCode() {
        return this.errorCode;
    }

    public ErrorCode getError() {
        return ErrorCode.parse(this.errorCode);
    }

    /**
     * Check whether this exception carries the given error.
     *
     * @param error the error to compare with
     * @return true if the error codes are the same
     */
    public boolean is(ErrorCode error) {
        return error != null && error.getId() == this.errorCode;
    }
}
