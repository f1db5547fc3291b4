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

/**
 * Names of canonical projection parameters, as they appear in WKT <code>PARAMETER</code> nodes.
 * All angles are in degrees, false easting/northing in linear units of the projected system.
 */
public final class ProjectionParameter {
    public static final String LATITUDE_OF_ORIGIN = "latitude_of_origin";
    public static final String CENTRAL_MERIDIAN = "central_meridian";
    public static final String STANDARD_PARALLEL_1 = "standard_parallel_1";
    public static final String STANDARD_PARALLEL_2 = "standard_parallel_2";
    public static final String SCALE_FACTOR = "scale_factor";
    public static final String LATITUDE_OF_CENTER = "latitude_of_center";
    public static final String LONGITUDE_OF_CENTER = "longitude_of_center";
    public static final String AZIMUTH = "azimuth";
    public static final String LATITUDE_OF_POINT_1 = "latitude_of_point_1";
    public static final String LONGITUDE_OF_POINT_1 = "longitude_of_point_1";
    public static final String LATITUDE_OF_POINT_2 = "latitude_of_point_2";
    public static final String LONGITUDE_OF_POINT_2 = "longitude_of_point_2";
    public static final String FALSE_EASTING = "false_easting";
    public static final String FALSE_NORTHING = "false_northing";

    private ProjectionParameter() {
    }
}
