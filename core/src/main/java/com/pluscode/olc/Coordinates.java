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

import static com.pluscode.olc.OLC.LATITUDE_MAX;
import static com.pluscode.olc.OLC.LONGITUDE_MAX;

/**
 * Brings raw coordinates into the ranges the codec works with.
 */
public final class Coordinates {

    private Coordinates() {
    }

    /**
     * Clip a latitude into the range -90 to 90.
     */
    public static double clipLatitude(double latitude) {
        return Math.min(LATITUDE_MAX, Math.max(-LATITUDE_MAX, latitude));
    }

    /**
     * Normalize a longitude into the range -180 to 180, not including 180.
     */
    public static double normalizeLongitude(double longitude) {
        if (longitude >= -LONGITUDE_MAX && longitude < LONGITUDE_MAX)
            return longitude;

        double circle = 2 * LONGITUDE_MAX;
        double normalized = ((longitude + LONGITUDE_MAX) % circle + circle) % circle - LONGITUDE_MAX;
        // the second modulo can round up to exactly the circle for tiny negative remainders
        return normalized >= LONGITUDE_MAX ? normalized - circle : normalized;
    }
}
