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

import static com.pluscode.olc.OLC.*;

/**
 * Classifies strings as valid, short or full Open Location Codes.
 * <p>
 * To be valid, all characters must be from the Open Location Code character set with exactly one
 * separator. The separator can be in any even-numbered position up to the eighth digit. Padding
 * is only allowed in codes with the separator at the eighth position, as one run of an even
 * number of padding characters directly in front of the separator.
 */
public final class CodeValidator {

    private CodeValidator() {
    }

    public static boolean isValid(String code) {
        if (code == null || code.isEmpty())
            return false;

        int sepPos = code.indexOf(SEPARATOR);
        // the separator is required, exactly once
        if (sepPos < 0 || sepPos != code.lastIndexOf(SEPARATOR))
            return false;

        // the separator alone is no code
        if (code.length() == 1)
            return false;

        if (sepPos > SEPARATOR_POSITION || sepPos % 2 == 1)
            return false;

        int padStart = code.indexOf(PADDING_CHARACTER);
        if (padStart >= 0) {
            // short codes cannot have padding
            if (sepPos < SEPARATOR_POSITION)
                return false;

            if (padStart == 0)
                return false;

            int padEnd = code.lastIndexOf(PADDING_CHARACTER);
            if (padEnd != sepPos - 1 || (padEnd - padStart + 1) % 2 == 1)
                return false;

            for (int i = padStart; i <= padEnd; i++) {
                if (code.charAt(i) != PADDING_CHARACTER)
                    return false;
            }

            // nothing may follow the separator of a padded code
            if (code.length() - 1 != sepPos)
                return false;

        } else if (code.length() - sepPos - 1 == 1) {
            // a single digit after the separator is not allowed
            return false;
        }

        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c != SEPARATOR && c != PADDING_CHARACTER && digitValue(c) < 0)
                return false;
        }
        return true;
    }

    /**
     * A short code is a valid code with less than eight digits in front of the separator. The
     * missing leading digits have to be recovered from a reference location.
     */
    public static boolean isShort(String code) {
        return isValid(code) && code.indexOf(SEPARATOR) < SEPARATOR_POSITION;
    }

    /**
     * Not all combinations of valid characters decode to legal latitude and longitude values. This
     * checks that a code is valid, not short and that its first latitude and longitude digits are in
     * range.
     */
    public static boolean isFull(String code) {
        if (!isValid(code) || isShort(code))
            return false;

        int firstLatValue = digitValue(code.charAt(0)) * ENCODING_BASE;
        if (firstLatValue >= LATITUDE_MAX * 2)
            return false;

        if (code.length() > 1) {
            int firstLngValue = digitValue(code.charAt(1)) * ENCODING_BASE;
            return firstLngValue < LONGITUDE_MAX * 2;
        }
        return true;
    }
}
