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

import java.util.Arrays;

/**
 * Constants of the Open Location Code format. None of them is configurable.
 */
public final class OLC {
    /**
     * The character set used to encode the values. It avoids vowels and glyphs which are easily confused.
     */
    public static final String CODE_ALPHABET = "23456789CFGHJMPQRVWX";
    public static final int ENCODING_BASE = CODE_ALPHABET.length();

    // A separator used to break the code into two parts to aid memorability.
    public static final char SEPARATOR = '+';
    // The number of characters to place before the separator.
    public static final int SEPARATOR_POSITION = 8;
    public static final char PADDING_CHARACTER = '0';

    public static final int LATITUDE_MAX = 90;
    public static final int LONGITUDE_MAX = 180;

    public static final int MIN_DIGIT_COUNT = 2;
    public static final int MAX_DIGIT_COUNT = 15;

    /**
     * Maximum code length using lat/lng pair encoding. The area of such a code is approximately 13x13 meters
     * (at the equator).
     */
    public static final int PAIR_CODE_LENGTH = 10;
    // first place value of the pairs (if the last pair value is 1)
    public static final long PAIR_FIRST_PLACE_VALUE = pow(ENCODING_BASE, PAIR_CODE_LENGTH / 2 - 1);
    // inverse of the precision of the pair section of the code
    public static final long PAIR_PRECISION = pow(ENCODING_BASE, 3);
    /**
     * The resolution values in degrees for each position in the lat/lng pair encoding. These give the place value
     * of each position, and therefore the dimensions of the resulting area.
     */
    static final double[] PAIR_RESOLUTIONS = {20.0, 1.0, .05, .0025, .000125};

    public static final int GRID_CODE_LENGTH = MAX_DIGIT_COUNT - PAIR_CODE_LENGTH;
    public static final int GRID_COLUMNS = 4;
    public static final int GRID_ROWS = 5;
    public static final long GRID_LAT_FIRST_PLACE_VALUE = pow(GRID_ROWS, GRID_CODE_LENGTH - 1);
    public static final long GRID_LNG_FIRST_PLACE_VALUE = pow(GRID_COLUMNS, GRID_CODE_LENGTH - 1);

    // multiply latitude by this much to make it a multiple of the finest precision
    public static final long FINAL_LAT_PRECISION = PAIR_PRECISION * pow(GRID_ROWS, GRID_CODE_LENGTH);
    public static final long FINAL_LNG_PRECISION = PAIR_PRECISION * pow(GRID_COLUMNS, GRID_CODE_LENGTH);

    public static final int MIN_TRIMMABLE_CODE_LEN = 6;

    private static final int[] DIGIT_VALUES = new int[128];

    static {
        Arrays.fill(DIGIT_VALUES, -1);
        for (int i = 0; i < CODE_ALPHABET.length(); i++) {
            char c = CODE_ALPHABET.charAt(i);
            DIGIT_VALUES[c] = i;
            DIGIT_VALUES[Character.toLowerCase(c)] = i;
        }
    }

    private OLC() {
    }

    /**
     * @return the value of the specified digit, case is ignored, or -1 if it is not part of the alphabet
     */
    public static int digitValue(char c) {
        return c < DIGIT_VALUES.length ? DIGIT_VALUES[c] : -1;
    }

    public static char digit(int value) {
        return CODE_ALPHABET.charAt(value);
    }

    static long pow(long base, int exponent) {
        long result = 1;
        for (int i = 0; i < exponent; i++) {
            result *= base;
        }
        return result;
    }
}
