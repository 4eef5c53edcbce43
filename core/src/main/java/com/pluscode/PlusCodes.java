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

import com.pluscode.olc.*;
import com.pluscode.util.PMap;
import com.pluscode.util.Parameters;
import com.pluscode.util.exceptions.PlusCodeException;
import com.pluscode.util.shapes.GeoPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Easy to use entry point to convert locations to and from Open Location Codes (Plus Codes).
 * <p>
 * Codes represent rectangular areas rather than points, and the longer the code, the smaller the
 * area. Codes can be shortened relative to a nearby location, in many cases only four to seven
 * characters are then needed.
 * <p>
 * None of the methods throws a codec error, they are reported via {@link CodeResponse#getErrors()}.
 * Instances are immutable and can be shared between threads.
 */
public class PlusCodes {
    private static final Logger logger = LoggerFactory.getLogger(PlusCodes.class);
    private final OpenLocationCodeAlgo codeAlgo;

    public PlusCodes() {
        this(new PMap());
    }

    /**
     * @throws com.pluscode.util.exceptions.InvalidCodeLengthException if the configured code length is
     *                                                                   not supported
     */
    public PlusCodes(PMap config) {
        codeAlgo = new OpenLocationCodeAlgo(config.getInt(Parameters.OLC.CODE_LENGTH, OLC.PAIR_CODE_LENGTH));
        logger.info("initialized with default code length " + codeAlgo.getCodeLength());
    }

    /**
     * @return the algorithm which encodes with the configured default code length
     */
    public CodeAlgo getCodeAlgo() {
        return codeAlgo;
    }

    /**
     * Encode a location with the configured default code length (10 if not configured).
     */
    public CodeResponse<String> encode(double latitude, double longitude) {
        return call("encode", () -> codeAlgo.encode(latitude, longitude));
    }

    public CodeResponse<String> encode(GeoPoint point) {
        return encode(point.lat, point.lon);
    }

    public CodeResponse<String> encode(double latitude, double longitude, int codeLength) {
        return call("encode", () -> CodeEncoder.encode(latitude, longitude, codeLength));
    }

    public CodeResponse<String> encodeIntegers(long latVal, long lngVal, int codeLength) {
        return call("encodeIntegers", () -> CodeEncoder.encodeIntegers(latVal, lngVal, codeLength));
    }

    public CodeResponse<CodeArea> decode(String code) {
        return call("decode", () -> CodeDecoder.decode(code));
    }

    public CodeResponse<String> shorten(String code, double latitude, double longitude) {
        return call("shorten", () -> CodeShortener.shorten(code, latitude, longitude));
    }

    public CodeResponse<String> recoverNearest(String code, double referenceLatitude, double referenceLongitude) {
        return call("recoverNearest", () -> CodeShortener.recoverNearest(code, referenceLatitude, referenceLongitude));
    }

    public CodeResponse<String> recoverNearest(String code, GeoPoint reference) {
        return recoverNearest(code, reference.lat, reference.lon);
    }

    public static boolean isValid(String code) {
        return CodeValidator.isValid(code);
    }

    public static boolean isShort(String code) {
        return CodeValidator.isShort(code);
    }

    public static boolean isFull(String code) {
        return CodeValidator.isFull(code);
    }

    public static double clipLatitude(double latitude) {
        return Coordinates.clipLatitude(latitude);
    }

    public static double normalizeLongitude(double longitude) {
        return Coordinates.normalizeLongitude(longitude);
    }

    /**
     * @return the latitude integer at index 0 and the longitude integer at index 1
     */
    public static long[] locationToIntegers(double latitude, double longitude) {
        return CodeEncoder.locationToIntegers(latitude, longitude);
    }

    private static <T> CodeResponse<T> call(String operation, Supplier<T> supplier) {
        try {
            return CodeResponse.of(supplier.get());
        } catch (PlusCodeException ex) {
            if (logger.isDebugEnabled())
                logger.debug(operation + " failed with " + ex.getReason() + ": " + ex.getDetails());
            return CodeResponse.failed(ex);
        }
    }

    @Override
    public String toString() {
        return "PlusCodes|" + codeAlgo;
    }
}
