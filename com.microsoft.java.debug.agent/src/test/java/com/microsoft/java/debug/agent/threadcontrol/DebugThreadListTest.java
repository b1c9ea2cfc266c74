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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import com.microsoft.java.debug.agent.DebugException;
import com.microsoft.java.debug.agent.runtime.ErrorCode;

public class DebugThreadListTest {
    private DebugThreadList debugThreads;

    @Before
    public void setup() {
        debugThreads = new DebugThreadList(new ThreadLock(), 2);
    }

    @Test
    public void testCtor() {
        try {
            new DebugThreadList(new ThreadLock(), 0);
            fail("Should reject an empty capacity.");
        } catch (IllegalArgumentException ex) {
            // expected
        }
    }

    @Test
    public void testAddAndRemove() throws Exception {
        FakeThread listener = new FakeThread(1, "listener");
        FakeThread helper = new FakeThread(2, "helper");
        debugThreads.add(listener);
        debugThreads.add(helper);
        assertEquals(2, debugThreads.size());
        assertEquals(2, debugThreads.getCapacity());
        assertTrue(debugThreads.contains(listener));

        try {
            debugThreads.add(new FakeThread(3, "one too many"));
            fail("Should not grow past its capacity.");
        } catch (DebugException ex) {
            assertEquals(ErrorCode.OUT_OF_MEMORY, ex.getError());
        }

        debugThreads.remove(listener);
        assertFalse(debugThreads.contains(listener));
        try {
            debugThreads.remove(listener);
            fail("Should not remove an unregistered thread.");
        } catch (DebugException ex) {
            assertEquals(ErrorCode.INVALID_THREAD, ex.getError());
        }

        try {
            debugThreads.add(null);
            fail("Should reject a null thread.");
        } catch (IllegalArgumentException ex) {
            // expected
        }
    }
}
