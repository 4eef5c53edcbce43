/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.pluscode;

import com.pluscode.util.exceptions.FullCodeExpectedException;
import com.pluscode.util.exceptions.InvalidCodeException;
import com.pluscode.util.exceptions.PlusCodeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CodeResponseTest {

    @Test
    public void testValue() {
        CodeResponse<String> rsp = CodeResponse.of("8FVC9G8F+6X");
        assertFalse(rsp.hasErrors());
        assertTrue(rsp.getErrors().isEmpty());
        assertNull(rsp.getReason());
        assertEquals("8FVC9G8F+6X", rsp.get());
        assertEquals("8FVC9G8F+6X", rsp.orElse("x"));
        assertEquals("8FVC9G8F+6X", rsp.toString());
    }

    @Test
    public void testErrors() {
        CodeResponse<String> rsp = CodeResponse.failed(new IllegalStateException("other"));
        assertTrue(rsp.hasErrors());
        assertNull(rsp.getReason());

        rsp.addError(new FullCodeExpectedException("9G8F+6X")).addError(new InvalidCodeException("abc"));
        assertEquals(3, rsp.getErrors().size());
        // the first codec error counts
        assertEquals(PlusCodeException.Reason.FULL_CODE_EXPECTED, rsp.getReason());
        assertEquals("x", rsp.orElse("x"));

        IllegalStateException ex = assertThrows(IllegalStateException.class, rsp::get);
        assertEquals("other", ex.getCause().getMessage());
        assertThrows(UnsupportedOperationException.class, () -> rsp.getErrors().clear());
    }
}
