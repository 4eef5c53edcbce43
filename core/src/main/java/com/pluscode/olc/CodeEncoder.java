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

import static com.pluscode.olc.OLC.*;

/**
 * Encodes locations into Open Location Codes. Coordinates are converted into integers first, so
 * that every digit can be extracted exactly without floating point drift.
 */
public final class CodeEncoder {
    private static final long LAT_INTEGER_RANGE = 2 * LATITUDE_MAX * FINAL_LAT_PRECISION;
    private static final long LNG_INTEGER_RANGE = 2 * LONGITUDE_MAX * FINAL_LNG_PRECISION;
    private static final long GRID_LAT_DIVISOR = pow(GRID_ROWS, GRID_CODE_LENGTH);
    private static final long GRID_LNG_DIVISOR = pow(GRID_COLUMNS, GRID_CODE_LENGTH);

    private CodeEncoder() {
    }

    /**
     * Encode a location into a code of the specified length. Latitudes are clipped and longitudes are
     * wrapped into their legal range.
     *
     * @param codeLength the number of digits, 2, 4, 6, 8 or anything from 10 to 15. Longer values are
     *                   clipped to 15.
     * @throws InvalidCodeLengthException for an unsupported code length
     */
    public static String encode(double latitude, double longitude, int codeLength) {
        long[] ints = locationToIntegers(latitude, longitude);
        return encodeIntegers(ints[0], ints[1], codeLength);
    }

    /**
     * Convert a location in degrees into integer representations in units of the finest code
     * precision. The latitude is shifted into [0, 180 * FINAL_LAT_PRECISION) and clipped to it, the
     * longitude is shifted into [0, 360 * FINAL_LNG_PRECISION) and wrapped.
     *
     * @return an array with the latitude integer at index 0 and the longitude integer at index 1
     */
    public static long[] locationToIntegers(double latitude, double longitude) {
        // shifted as double, huge latitudes would overflow a long
        double lat = Math.floor(latitude * FINAL_LAT_PRECISION) + LATITUDE_MAX * FINAL_LAT_PRECISION;
        long latVal;
        if (lat < 0) {
            latVal = 0;
        } else if (lat >= LAT_INTEGER_RANGE) {
            latVal = LAT_INTEGER_RANGE - 1;
        } else {
            latVal = (long) lat;
        }

        // wrapped in degrees before scaling, the scaled value of a huge longitude does not fit a long
        double lng = Math.floor(Coordinates.normalizeLongitude(longitude) * FINAL_LNG_PRECISION)
                + LONGITUDE_MAX * FINAL_LNG_PRECISION;
        long lngVal = Math.floorMod((long) lng, LNG_INTEGER_RANGE);
        return new long[]{latVal, lngVal};
    }

    /**
     * Encode a location given as integers, see {@link #locationToIntegers(double, double)}, into a code.
     * Integers out of range are clipped (latitude) or wrapped (longitude) in the same way.
     *
     * @throws InvalidCodeLengthException for an unsupported code length
     */
    public static String encodeIntegers(long latVal, long lngVal, int codeLength) {
        checkCodeLength(codeLength);
        codeLength = Math.min(codeLength, MAX_DIGIT_COUNT);
        latVal = Math.max(0, Math.min(latVal, LAT_INTEGER_RANGE - 1));
        lngVal = Math.floorMod(lngVal, LNG_INTEGER_RANGE);

        char[] digits = new char[MAX_DIGIT_COUNT];
        if (codeLength > PAIR_CODE_LENGTH) {
            // the grid digits are extracted from the least significant end
            for (int i = MAX_DIGIT_COUNT - 1; i >= PAIR_CODE_LENGTH; i--) {
                long latDigit = latVal % GRID_ROWS;
                long lngDigit = lngVal % GRID_COLUMNS;
                digits[i] = digit((int) (latDigit * GRID_COLUMNS + lngDigit));
                latVal /= GRID_ROWS;
                lngVal /= GRID_COLUMNS;
            }
        } else {
            latVal /= GRID_LAT_DIVISOR;
            lngVal /= GRID_LNG_DIVISOR;
        }

        for (int i = PAIR_CODE_LENGTH - 2; i >= 0; i -= 2) {
            digits[i] = digit((int) (latVal % ENCODING_BASE));
            digits[i + 1] = digit((int) (lngVal % ENCODING_BASE));
            latVal /= ENCODING_BASE;
            lngVal /= ENCODING_BASE;
        }

        StringBuilder code = new StringBuilder(SEPARATOR_POSITION + 1 + MAX_DIGIT_COUNT - SEPARATOR_POSITION);
        if (codeLength >= SEPARATOR_POSITION) {
            code.append(digits, 0, SEPARATOR_POSITION).append(SEPARATOR);
            code.append(digits, SEPARATOR_POSITION, codeLength - SEPARATOR_POSITION);
        } else {
            code.append(digits, 0, codeLength);
            for (int i = codeLength; i < SEPARATOR_POSITION; i++) {
                code.append(PADDING_CHARACTER);
            }
            code.append(SEPARATOR);
        }
        return code.toString();
    }

    /**
     * @throws InvalidCodeLengthException if the code length is below 2 or odd and below 10
     */
    public static void checkCodeLength(int codeLength) {
        if (codeLength < MIN_DIGIT_COUNT || (codeLength < PAIR_CODE_LENGTH && codeLength % 2 == 1))
            throw new InvalidCodeLengthException(codeLength);
    }
}
