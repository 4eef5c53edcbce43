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

import java.util.ArrayList;
import java.util.List;

/**
 * A simple bounding box defined as follows: minLon, maxLon followed by minLat which is south(!) and
 * maxLat. Equally to EX_GeographicBoundingBox in the ISO 19115 standard.
 * <p>
 *
 * @author Peter Karich
 */
public class BBox {

    // longitude (theta) = x, latitude (phi) = y
    public final double minLon;
    public final double maxLon;
    public final double minLat;
    public final double maxLat;

    public BBox(double minLon, double maxLon, double minLat, double maxLat) {
        this.minLon = minLon;
        this.maxLon = maxLon;
        this.minLat = minLat;
        this.maxLat = maxLat;
    }

    /**
     * Attention: geoJson order is minLon, minLat, maxLon, maxLat
     */
    public static BBox fromGeoJson(double[] coords) {
        if (coords.length != 4)
            throw new IllegalArgumentException("BBox should have 4 parts but was " + coords.length);

        return new BBox(coords[0], coords[2], coords[1], coords[3]);
    }

    /**
     * Bounds are inclusive on both sides as the boxes of a code touch the coordinate range limits.
     */
    public boolean contains(double lat, double lon) {
        return lat <= maxLat && lat >= minLat && lon <= maxLon && lon >= minLon;
    }

    public double getHeight() {
        return maxLat - minLat;
    }

    public double getWidth() {
        return maxLon - minLon;
    }

    @Override
    public String toString() {
        return minLon + "," + maxLon + "," + minLat + "," + maxLat;
    }

    /**
     * Compares the coordinates within 1e-6 degrees while {@link #hashCode()} uses the exact values, so
     * do not use instances which are only approximately equal as keys of a hash based collection.
     */
    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof BBox))
            return false;

        BBox b = (BBox) obj;
        // equals within a very small range
        return Helper.equalsEps(minLat, b.minLat) && Helper.equalsEps(maxLat, b.maxLat)
                && Helper.equalsEps(minLon, b.minLon) && Helper.equalsEps(maxLon, b.maxLon);
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 17 * hash + (int) (Double.doubleToLongBits(this.minLon) ^ (Double.doubleToLongBits(this.minLon) >>> 32));
        hash = 17 * hash + (int) (Double.doubleToLongBits(this.maxLon) ^ (Double.doubleToLongBits(this.maxLon) >>> 32));
        hash = 17 * hash + (int) (Double.doubleToLongBits(this.minLat) ^ (Double.doubleToLongBits(this.minLat) >>> 32));
        hash = 17 * hash + (int) (Double.doubleToLongBits(this.maxLat) ^ (Double.doubleToLongBits(this.maxLat) >>> 32));
        return hash;
    }

    /**
     * @return array containing this bounding box. Attention: GeoJson is lon,lat!
     */
    public List<Double> toGeoJson() {
        List<Double> list = new ArrayList<>(4);
        list.add(minLon);
        list.add(minLat);
        list.add(maxLon);
        list.add(maxLat);
        return list;
    }
}
