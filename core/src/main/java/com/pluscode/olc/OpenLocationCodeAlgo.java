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
import com.pluscode.util.shapes.GeoPoint;

/**
 * Encodes every location with the same code length, e.g. 10 digits for an area of roughly 13x13
 * meters or 11 digits for roughly 2.8x3.5 meters at the equator.
 */
public class OpenLocationCodeAlgo implements CodeAlgo {
    private final int codeLength;

    /**
     * @throws com.pluscode.util.exceptions.InvalidCodeLengthException for an unsupported code length
     */
    public OpenLocationCodeAlgo(int codeLength) {
        CodeEncoder.checkCodeLength(codeLength);
        this.codeLength = Math.min(codeLength, OLC.MAX_DIGIT_COUNT);
    }

    public int getCodeLength() {
        return codeLength;
    }

    @Override
    public String encode(GeoPoint coord) {
        return encode(coord.lat, coord.lon);
    }

    @Override
    public final String encode(double lat, double lon) {
        return CodeEncoder.encode(lat, lon, codeLength);
    }

    @Override
    public final CodeArea decode(String code) {
        return CodeDecoder.decode(code);
    }

    @Override
    public String toString() {
        return "olc|" + codeLength;
    }
}
