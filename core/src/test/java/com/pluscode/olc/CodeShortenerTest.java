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

import com.pluscode.CodeArea;
import com.pluscode.util.exceptions.CannotShortenPaddedCodeException;
import com.pluscode.util.exceptions.FullCodeExpectedException;
import com.pluscode.util.exceptions.InvalidCodeException;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class CodeShortenerTest {

    @Test
    public void testShorten() {
        assertEquals("9G8F+6X", CodeShortener.shorten("8FVC9G8F+6X", 47.5, 8.5));
        assertEquals("9G8F+6X", CodeShortener.shorten("8fvc9g8f+6x", 47.5, 8.5));
        assertEquals("9G8F+6XQ", CodeShortener.shorten("8FVC9G8F+6XQ", 47.5, 8.5));
        assertEquals("8F+6X", CodeShortener.shorten("8FVC9G8F+6X", 47.37, 8.52));
        assertEquals("VC9G8F+6X", CodeShortener.shorten("8FVC9G8F+6X", 49, 8.5));
        // at the center even the finest trimming is safe
        assertEquals("+6X", CodeShortener.shorten("8FVC9G8F+6X", 47.3655625, 8.5249375));
    }

    @Test
    public void testShortenFarAway() {
        assertEquals("8FVC9G8F+6X", CodeShortener.shorten("8FVC9G8F+6X", 0, 0));
        assertEquals("8FVC9G8F+6X", CodeShortener.shorten("8fvc9g8f+6x", -47.5, -171.5));
    }

    @Test
    public void testShortenErrors() {
        assertThrows(FullCodeExpectedException.class, () -> CodeShortener.shorten("9G8F+6X", 47.5, 8.5));
        assertThrows(FullCodeExpectedException.class, () -> CodeShortener.shorten("CJ+2VX", 1.2, 2.3));
        assertThrows(FullCodeExpectedException.class, () -> CodeShortener.shorten("invalid", 1.2, 2.3));
        CannotShortenPaddedCodeException ex = assertThrows(CannotShortenPaddedCodeException.class,
                () -> CodeShortener.shorten("8FVC0000+", 47.5, 8.5));
        assertEquals("8FVC0000+", ex.getCode());
    }

    @Test
    public void testRecoverNearest() {
        assertEquals("8FVC9G8F+6X", CodeShortener.recoverNearest("9G8F+6X", 47.4, 8.6));
        assertEquals("8FVC9G8F+6X", CodeShortener.recoverNearest("9g8f+6x", 47.4, 8.6));
        assertEquals("8FVCCJ8F+6X", CodeShortener.recoverNearest("8F+6X", 47.4, 8.6));
        assertEquals("8FVC9G8F+6XQ", CodeShortener.recoverNearest("9G8F+6XQ", 47.4, 8.6));
        // full codes are only capitalized
        assertEquals("8FVC9G8F+6X", CodeShortener.recoverNearest("8fvc9g8f+6x", 0, 0));
    }

    @Test
    public void testRecoverNearestMovesToNeighbourCell() {
        // the reference code starts with 8FVC, but the closest matching area is one degree further north
        assertEquals("8FWC9G8F+6X", CodeShortener.recoverNearest("9G8F+6X", 47.9, 8.6));
        assertEquals("8FWC9G8F+6X", CodeShortener.recoverNearest("9G8F+6X", 48.4, 8.6));
    }

    @Test
    public void testRecoverNearestErrors() {
        assertThrows(InvalidCodeException.class, () -> CodeShortener.recoverNearest("invalid", 0, 0));
        assertThrows(InvalidCodeException.class, () -> CodeShortener.recoverNearest("8FVC9G8F6X", 0, 0));
        assertThrows(InvalidCodeException.class, () -> CodeShortener.recoverNearest(null, 0, 0));
    }

    @Test
    public void testShortenAndRecover() {
        double[] distances = {0.00001, 0.0002, 0.004, 0.1, 2, 10};
        Random rand = new Random(4711);
        for (int i = 0; i < 1000; i++) {
            String code = CodeEncoder.encode(rand.nextDouble() * 160 - 80, rand.nextDouble() * 340 - 170,
                    i % 2 == 0 ? 10 : 11);
            CodeArea area = CodeDecoder.decode(code);
            double distance = distances[i % distances.length];
            double refLat = area.getLatitudeCenter() + (rand.nextDouble() * 2 - 1) * distance;
            double refLng = area.getLongitudeCenter() + (rand.nextDouble() * 2 - 1) * distance;

            String shortCode = CodeShortener.shorten(code, refLat, refLng);
            assertEquals(code, CodeShortener.recoverNearest(shortCode, refLat, refLng),
                    code + " -> " + shortCode + " with " + refLat + "," + refLng);
        }
    }
}
