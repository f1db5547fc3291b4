/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2023-2025 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.matrices.pds4.geo;

import java.util.Objects;

/**
 * Geographic coordinate system: datum with its ellipsoid and the prime meridian.
 *
 * @param name              name of the system, for example <code>GCS_Mars</code>.
 * @param datumName         name of the datum, for example <code>D_Mars</code>.
 * @param spheroidName      name of the ellipsoid.
 * @param semiMajor         equatorial radius in meters.
 * @param inverseFlattening <code>a/(a-b)</code>, or 0 for a sphere.
 * @param primeMeridianName name of the prime meridian.
 * @param primeMeridian     longitude of the prime meridian in degrees.
 */
public record GeographicCS(
        String name,
        String datumName,
        String spheroidName,
        double semiMajor,
        double inverseFlattening,
        String primeMeridianName,
        double primeMeridian) {
    public static final String REFERENCE_MERIDIAN = "Reference_Meridian";
    public static final GeographicCS WGS84 = new GeographicCS("WGS 84", "WGS_1984", "WGS 84",
            6378137.0, 298.257223563, "Greenwich", 0.0);

    public GeographicCS {
        Objects.requireNonNull(name, "Null name");
        Objects.requireNonNull(datumName, "Null datumName");
        Objects.requireNonNull(spheroidName, "Null spheroidName");
        Objects.requireNonNull(primeMeridianName, "Null primeMeridianName");
        if (inverseFlattening < 0.0) {
            throw new IllegalArgumentException("Negative inverse flattening " + inverseFlattening);
        }
    }

    public static GeographicCS sphere(String name, String datumName, String spheroidName, double radius) {
        return new GeographicCS(name, datumName, spheroidName, radius, 0.0, REFERENCE_MERIDIAN, 0.0);
    }

    public boolean isSphere() {
        return inverseFlattening == 0.0;
    }

    public double semiMinor() {
        return isSphere() ? semiMajor : semiMajor * (1.0 - 1.0 / inverseFlattening);
    }
}
