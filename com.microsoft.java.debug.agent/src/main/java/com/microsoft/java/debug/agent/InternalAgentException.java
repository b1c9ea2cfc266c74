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

/**
 * Raised when the agent reaches a state it cannot continue from: allocation
 * failure, a broken bookkeeping invariant, or a bulk runtime primitive failing
 * where no recovery exists. The surrounding agent is expected to terminate.
 */
public class InternalAgentException extends RuntimeException {
    private static final long serialVersionUID = -3172406148522094417L;
    private final ErrorCode error;

    public InternalAgentException(ErrorCode error, String message) {
        super(String.format("%s (%s)", message, error));
        this.error = error;
    }

    public InternalAgentException(ErrorCode error, String message, Throwable cause) {
        super(String.format("%s (%s)", message, error), cause);
        this.error = error;
    }

    public ErrorCode getError() {
        return error;
    }

    /**
     * Log the fatal condition and create the exception to throw.
     *
     * @param error the error that caused the exit
     * @param message the diagnostic message
     * @return the exception, to be thrown by the caller
     */
    public static InternalAgentException exit(ErrorCode error, String message) {
        InternalAgentException ex = new InternalAgentException(error, message);
        Log.error(ex, "JDWP exit error %s: %s", error, message);
        return ex;
    }

    /**
     * Log the fatal condition caused by a failed runtime call and create the exception to throw.
     */
    public static InternalAgentException exit(DebugException cause, String message) {
        InternalAgentException ex = new InternalAgentException(cause.getError(), message, cause);
        Log.error(ex, "JDWP exit error %s: %s", cause.getError(), message);
        return ex;
    }
}
