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
import com.pluscode.util.exceptions.CannotShortenPaddedCodeException;
import com.pluscode.util.exceptions.CodeLengthTooSmallException;
import com.pluscode.util.exceptions.FullCodeExpectedException;
import com.pluscode.util.exceptions.InvalidCodeException;

import static com.pluscode.olc.OLC.*;

/**
 * Removes leading digits from full codes relative to a reference location, and recovers full codes
 * from such short codes.
 * <p>
 * The closer the reference location is to the center of the code, the more digits can be removed.
 * To recover the full code the same location is not required, as long as a nearby location is
 * provided.
 */
public final class CodeShortener {
    // the reference location must be closer than this fraction of a resolution to the code center
    private static final double SAFETY_FACTOR = 0.3;

    private CodeShortener() {
    }

    /**
     * Remove characters from the start of a full code.
     *
     * @return the shortest code from which {@link #recoverNearest} restores the specified code with the
     * specified reference location, or the code itself in upper case if no digits can be removed
     * @throws FullCodeExpectedException        if the code is not a full code
     * @throws CannotShortenPaddedCodeException if the code contains padding
     * @throws CodeLengthTooSmallException      if the code has less than 6 digits
     */
    public static String shorten(String code, double latitude, double longitude) {
        if (!CodeValidator.isFull(code))
            throw new FullCodeExpectedException(code);
        if (code.indexOf(PADDING_CHARACTER) >= 0)
            throw new CannotShortenPaddedCodeException(code);

        String cleanCode = Helper.toUpperCase(code);
        CodeArea codeArea = CodeDecoder.decode(cleanCode);
        if (codeArea.getCodeLength() < MIN_TRIMMABLE_CODE_LEN)
            throw new CodeLengthTooSmallException(code, codeArea.getCodeLength(), MIN_TRIMMABLE_CODE_LEN);

        latitude = Coordinates.clipLatitude(latitude);
        longitude = Coordinates.normalizeLongitude(longitude);

        double codeRange = Math.max(
                Math.abs(codeArea.getLatitudeCenter() - latitude),
                Math.abs(codeArea.getLongitudeCenter() - longitude));

        // from the finest resolution to the coarsest, i.e. from the most to the least removed digits
        for (int i = PAIR_RESOLUTIONS.length - 2; i >= 0; i--) {
            if (codeRange < PAIR_RESOLUTIONS[i] * SAFETY_FACTOR)
                return cleanCode.substring((i + 1) * 2);
        }
        return cleanCode;
    }

    /**
     * Recover the nearest matching full code to the specified location. The leading digits of the
     * short code are taken from the reference location and the resulting area is moved by one
     * resolution step if that brings its center closer to the reference location.
     *
     * @return the full code in upper case. Full codes are returned without further processing.
     * @throws InvalidCodeException if the code is neither a full nor a short code
     */
    public static String recoverNearest(String code, double referenceLatitude, double referenceLongitude) {
        if (CodeValidator.isFull(code))
            return Helper.toUpperCase(code);
        if (!CodeValidator.isShort(code))
            throw new InvalidCodeException(code);

        referenceLatitude = Coordinates.clipLatitude(referenceLatitude);
        referenceLongitude = Coordinates.normalizeLongitude(referenceLongitude);

        String cleanCode = Helper.toUpperCase(code);
        int paddingLength = SEPARATOR_POSITION - cleanCode.indexOf(SEPARATOR);
        // the resolution of the padded area in degrees
        double resolution = Math.pow(ENCODING_BASE, 2 - paddingLength / 2.0);
        double halfResolution = resolution / 2.0;

        String referenceCode = CodeEncoder.encode(referenceLatitude, referenceLongitude, PAIR_CODE_LENGTH);
        CodeArea codeArea = CodeDecoder.decode(referenceCode.substring(0, paddingLength) + cleanCode);

        double latitudeCenter = codeArea.getLatitudeCenter();
        if (referenceLatitude + halfResolution < latitudeCenter && latitudeCenter - resolution >= -LATITUDE_MAX) {
            // too far north
            latitudeCenter -= resolution;
        } else if (referenceLatitude - halfResolution > latitudeCenter && latitudeCenter + resolution <= LATITUDE_MAX) {
            // too far south
            latitudeCenter += resolution;
        }

        double longitudeCenter = codeArea.getLongitudeCenter();
        if (referenceLongitude + halfResolution < longitudeCenter) {
            longitudeCenter -= resolution;
        } else if (referenceLongitude - halfResolution > longitudeCenter) {
            longitudeCenter += resolution;
        }

        return CodeEncoder.encode(latitudeCenter, longitudeCenter, codeArea.getCodeLength());
    }
}
