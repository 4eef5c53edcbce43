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

import com.pluscode.util.exceptions.InvalidCodeLengthException;
import com.pluscode.util.shapes.GeoPoint;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class OpenLocationCodeAlgoTest {

    @Test
    public void testEncode() {
        CodeAlgo algo = new OpenLocationCodeAlgo(11);
        assertEquals("8FVC9G8F+6XQ", algo.encode(47.365590, 8.524997));
        assertEquals("8FVC9G8F+6XQ", algo.encode(new GeoPoint(47.365590, 8.524997)));
        assertEquals("8FVC0000+", new OpenLocationCodeAlgo(4).encode(47.365590, 8.524997));
    }

    @Test
    public void testDecode() {
        CodeAlgo algo = new OpenLocationCodeAlgo(10);
        GeoPoint center = algo.decode("8FVC9G8F+6X").getCenter();
        assertEquals(47.3655625, center.lat, 1e-10);
        assertEquals(8.5249375, center.lon, 1e-10);
    }

    @Test
    public void testCodeLength() {
        assertEquals(15, new OpenLocationCodeAlgo(20).getCodeLength());
        assertThrows(InvalidCodeLengthException.class, () -> new OpenLocationCodeAlgo(3));
        assertThrows(InvalidCodeLengthException.class, () -> new OpenLocationCodeAlgo(0));
    }
}
