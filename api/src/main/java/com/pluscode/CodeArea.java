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

import com.pluscode.util.shapes.BBox;
import com.pluscode.util.shapes.GeoPoint;

/**
 * Coordinates of a decoded Open Location Code.
 * <p>
 * The coordinates include the latitude and longitude of the lower left and upper right corners
 * and the center of the bounding box for the area the code represents.
 */
public class CodeArea {
    private final double latitudeLo;
    private final double longitudeLo;
    private final double latitudeHi;
    private final double longitudeHi;
    private final double latitudeCenter;
    private final double longitudeCenter;
    private final int codeLength;

    public CodeArea(double latitudeLo, double longitudeLo, double latitudeHi, double longitudeHi, int codeLength) {
        this.latitudeLo = latitudeLo;
        this.longitudeLo = longitudeLo;
        this.latitudeHi = latitudeHi;
        this.longitudeHi = longitudeHi;
        this.codeLength = codeLength;
        // the area of a code can touch the poles or the antimeridian, the center must not exceed them
        this.latitudeCenter = Math.min(latitudeLo + (latitudeHi - latitudeLo) / 2, 90);
        this.longitudeCenter = Math.min(longitudeLo + (longitudeHi - longitudeLo) / 2, 180);
    }

    public double getLatitudeLo() {
        return latitudeLo;
    }

    public double getLongitudeLo() {
        return longitudeLo;
    }

    public double getLatitudeHi() {
        return latitudeHi;
    }

    public double getLongitudeHi() {
        return longitudeHi;
    }

    public double getLatitudeCenter() {
        return latitudeCenter;
    }

    public double getLongitudeCenter() {
        return longitudeCenter;
    }

    /**
     * @return the number of significant digits of the code this area was decoded from
     */
    public int getCodeLength() {
        return codeLength;
    }

    public GeoPoint getCenter() {
        return new GeoPoint(latitudeCenter, longitudeCenter);
    }

    public BBox getBounds() {
        return new BBox(longitudeLo, longitudeHi, latitudeLo, latitudeHi);
    }

    public boolean contains(double lat, double lng) {
        return getBounds().contains(lat, lng);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof CodeArea))
            return false;

        // exact, decoding the same code always yields the same bounds
        CodeArea other = (CodeArea) obj;
        return codeLength == other.codeLength
                && Double.compare(latitudeLo, other.latitudeLo) == 0
                && Double.compare(longitudeLo, other.longitudeLo) == 0
                && Double.compare(latitudeHi, other.latitudeHi) == 0
                && Double.compare(longitudeHi, other.longitudeHi) == 0;
    }

    @Override
    public int hashCode() {
        int hash = codeLength;
        hash = 31 * hash + Double.hashCode(latitudeLo);
        hash = 31 * hash + Double.hashCode(longitudeLo);
        hash = 31 * hash + Double.hashCode(latitudeHi);
        hash = 31 * hash + Double.hashCode(longitudeHi);
        return hash;
    }

    @Override
    public String toString() {
        return "CodeArea{lo=" + latitudeLo + "," + longitudeLo
                + ", hi=" + latitudeHi + "," + longitudeHi
                + ", center=" + latitudeCenter + "," + longitudeCenter
                + ", codeLength=" + codeLength + "}";
    }
}
