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
package com.pluscode.util.shapes;

import com.pluscode.util.Helper;

/**
 * A latitude, longitude pair in degrees.
 *
 * @author Peter Karich
 */
public class GeoPoint {
    public double lat = Double.NaN;
    public double lon = Double.NaN;

    public GeoPoint() {
    }

    public GeoPoint(double lat, double lon) {
        this.lat = lat;
        this.lon = lon;
    }

    /**
     * Attention: geoJson is LON,LAT
     */
    public static GeoPoint fromGeoJson(double[] xy) {
        if (xy.length != 2)
            throw new IllegalArgumentException("GeoJson point needs exactly 2 coordinates but was " + xy.length);

        return new GeoPoint(xy[1], xy[0]);
    }

    public double getLon() {
        return lon;
    }

    public double getLat() {
        return lat;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 83 * hash + (int) (Double.doubleToLongBits(this.lat) ^ (Double.doubleToLongBits(this.lat) >>> 32));
        hash = 83 * hash + (int) (Double.doubleToLongBits(this.lon) ^ (Double.doubleToLongBits(this.lon) >>> 32));
        return hash;
    }

    /**
     * Compares the coordinates within 1e-6 degrees while {@link #hashCode()} uses the exact values, so
     * do not use instances which are only approximately equal as keys of a hash based collection.
     */
    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof GeoPoint))
            return false;

        final GeoPoint other = (GeoPoint) obj;
        return Helper.equalsEps(lat, other.lat) && Helper.equalsEps(lon, other.lon);
    }

    @Override
    public String toString() {
        return lat + "," + lon;
    }

    /**
     * Attention: geoJson is LON,LAT
     */
    public Double[] toGeoJson() {
        return new Double[]{lon, lat};
    }
}
