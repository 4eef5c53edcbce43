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
import com.pluscode.util.Helper;
import com.pluscode.util.exceptions.FullCodeExpectedException;
import com.pluscode.util.exceptions.InvalidCodeException;

import static com.pluscode.olc.OLC.*;

/**
 * Decodes full Open Location Codes into the area they represent.
 */
public final class CodeDecoder {
    // decoded coordinates are rounded to this many decimal places to remove floating point noise
    private static final int DECIMAL_PLACES = 14;

    private CodeDecoder() {
    }

    /**
     * Decodes a full code into the coordinates of its bounding box: the lower left, the center and
     * the upper right corner.
     *
     * @throws InvalidCodeException      if the code is not valid
     * @throws FullCodeExpectedException if the code is valid but not a full code
     */
    public static CodeArea decode(String code) {
        if (!CodeValidator.isValid(code))
            throw new InvalidCodeException(code);
        if (!CodeValidator.isFull(code))
            throw new FullCodeExpectedException(code);

        String cleanCode = clean(code);
        int codeLength = cleanCode.length();

        long normalLat = -LATITUDE_MAX * PAIR_PRECISION;
        long normalLng = -LONGITUDE_MAX * PAIR_PRECISION;
        int digits = Math.min(codeLength, PAIR_CODE_LENGTH);
        long pv = PAIR_FIRST_PLACE_VALUE;
        for (int i = 0; i < digits; i += 2) {
            normalLat += digitValue(cleanCode.charAt(i)) * pv;
            normalLng += digitValue(cleanCode.charAt(i + 1)) * pv;
            if (i < digits - 2)
                pv /= ENCODING_BASE;
        }

        // the place value of the last pair is the size of the area
        double latPrecision = (double) pv / PAIR_PRECISION;
        double lngPrecision = (double) pv / PAIR_PRECISION;

        long gridLat = 0;
        long gridLng = 0;
        if (codeLength > PAIR_CODE_LENGTH) {
            long rowpv = GRID_LAT_FIRST_PLACE_VALUE;
            long colpv = GRID_LNG_FIRST_PLACE_VALUE;
            for (int i = PAIR_CODE_LENGTH; i < codeLength; i++) {
                int digitVal = digitValue(cleanCode.charAt(i));
                gridLat += (long) (digitVal / GRID_COLUMNS) * rowpv;
                gridLng += (long) (digitVal % GRID_COLUMNS) * colpv;
                if (i < codeLength - 1) {
                    rowpv /= GRID_ROWS;
                    colpv /= GRID_COLUMNS;
                }
            }
            latPrecision = (double) rowpv / FINAL_LAT_PRECISION;
            lngPrecision = (double) colpv / FINAL_LNG_PRECISION;
        }

        double lat = (double) normalLat / PAIR_PRECISION + (double) gridLat / FINAL_LAT_PRECISION;
        double lng = (double) normalLng / PAIR_PRECISION + (double) gridLng / FINAL_LNG_PRECISION;
        return new CodeArea(
                Helper.round(lat, DECIMAL_PLACES),
                Helper.round(lng, DECIMAL_PLACES),
                Helper.round(lat + latPrecision, DECIMAL_PLACES),
                Helper.round(lng + lngPrecision, DECIMAL_PLACES),
                codeLength);
    }

    /**
     * Strips separator and padding characters, converts to upper case and cuts the digits beyond the
     * maximum precision.
     */
    static String clean(String code) {
        StringBuilder sb = new StringBuilder(code.length());
        for (int i = 0; i < code.length() && sb.length() < MAX_DIGIT_COUNT; i++) {
            char c = code.charAt(i);
            if (c != SEPARATOR && c != PADDING_CHARACTER)
                sb.append(Character.toUpperCase(c));
        }
        return sb.toString();
    }
}
