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
package com.pluscode.olc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CodeValidatorTest {

    @Test
    public void testValid() {
        assertTrue(CodeValidator.isValid("8FVC9G8F+6X"));
        assertTrue(CodeValidator.isValid("8FVC9G8F+6XQ"));
        assertTrue(CodeValidator.isValid("8fvc9g8f+6x"));
        assertTrue(CodeValidator.isValid("8FVC9G8F+"));
        assertTrue(CodeValidator.isValid("8FVC0000+"));
        assertTrue(CodeValidator.isValid("8F000000+"));
        assertTrue(CodeValidator.isValid("9G8F+6X"));
        assertTrue(CodeValidator.isValid("8F+6X"));
        assertTrue(CodeValidator.isValid("+6X"));
    }

    @Test
    public void testInvalid() {
        assertFalse(CodeValidator.isValid(null));
        assertFalse(CodeValidator.isValid(""));
        assertFalse(CodeValidator.isValid("+"));
        assertFalse(CodeValidator.isValid("invalid"));
        // missing separator
        assertFalse(CodeValidator.isValid("8FVC9G8F6X"));
        assertFalse(CodeValidator.isValid("849VGJQF"));
        // two separators
        assertFalse(CodeValidator.isValid("8FVC9G8F+6X+"));
        // separator too late or at an odd position
        assertFalse(CodeValidator.isValid("8FVC9G8F6+X"));
        assertFalse(CodeValidator.isValid("8FV+C9G8F6X"));
        // single digit after the separator
        assertFalse(CodeValidator.isValid("8FVC9G8F+6"));
        // characters outside of the alphabet
        assertFalse(CodeValidator.isValid("8FVC9G8F+6A"));
        assertFalse(CodeValidator.isValid("8FVC9G8F+6 "));
    }

    @Test
    public void testPadding() {
        // short codes cannot be padded
        assertFalse(CodeValidator.isValid("8FVC00+"));
        assertFalse(CodeValidator.isValid("0FVC9G8F+"));
        // odd padding run
        assertFalse(CodeValidator.isValid("8FV00000+"));
        // padding interrupted by a digit or not directly in front of the separator
        assertFalse(CodeValidator.isValid("8F0C0000+"));
        assertFalse(CodeValidator.isValid("8FVC000F+"));
        // nothing may follow a padded code
        assertFalse(CodeValidator.isValid("8FVC0000+6X"));
        assertFalse(CodeValidator.isValid("8FVC9G8F+60"));
    }

    @Test
    public void testShort() {
        assertTrue(CodeValidator.isShort("9G8F+6X"));
        assertTrue(CodeValidator.isShort("8F+6X"));
        assertTrue(CodeValidator.isShort("9g8f+6x"));
        assertFalse(CodeValidator.isShort("8FVC9G8F+6X"));
        assertFalse(CodeValidator.isShort("8FVC0000+"));
        assertFalse(CodeValidator.isShort("invalid"));
    }

    @Test
    public void testFull() {
        assertTrue(CodeValidator.isFull("8FVC9G8F+6X"));
        assertTrue(CodeValidator.isFull("8fvc9g8f+6xq"));
        assertTrue(CodeValidator.isFull("8FVC0000+"));
        assertTrue(CodeValidator.isFull("C2X2X2X2+X2"));
        assertTrue(CodeValidator.isFull("CV000000+"));
        assertFalse(CodeValidator.isFull("9G8F+6X"));
        assertFalse(CodeValidator.isFull("invalid"));
        assertFalse(CodeValidator.isFull("8FVC9G8F6X"));

        // first latitude digit beyond 90 degrees
        assertFalse(CodeValidator.isFull("F2222222+22"));
        assertFalse(CodeValidator.isFull("WFVC9G8F+6X"));
        // first longitude digit beyond 180 degrees
        assertFalse(CodeValidator.isFull("CW000000+"));
        assertFalse(CodeValidator.isFull("CX000000+"));
    }

    @Test
    public void testExactlyOneClassification() {
        String[] codes = {"8FVC9G8F+6X", "9G8F+6X", "8FVC0000+", "WFVC9G8F+6X", "invalid", "+6X", "8FVC9G8F6X"};
        for (String code : codes) {
            boolean isShort = CodeValidator.isShort(code);
            boolean isFull = CodeValidator.isFull(code);
            assertFalse(isShort && isFull, code);
            if (isShort || isFull)
                assertTrue(CodeValidator.isValid(code), code);
        }
    }
}
