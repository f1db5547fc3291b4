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
 * Affine transformation from pixel/line coordinates to projected coordinates:
 * <pre>
 *     x = originX + pixel * pixelWidth + line * rowRotation
 *     y = originY + pixel * columnRotation + line * pixelHeight
 * </pre>
 * Pixel (0, 0) is the corner of the upper-left pixel, not its center.
 * PDS4 labels support only north-up transforms: see {@link #isNorthUp()}.
 */
public record GeoTransform(
        double originX,
        double pixelWidth,
        double rowRotation,
        double originY,
        double columnRotation,
        double pixelHeight) {

    public static GeoTransform of(double[] coefficients) {
        Objects.requireNonNull(coefficients, "Null coefficients");
        if (coefficients.length != 6) {
            throw new IllegalArgumentException("Geo transform must contain 6 coefficients, but it contains "
                    + coefficients.length);
        }
        return new GeoTransform(coefficients[0], coefficients[1], coefficients[2],
                coefficients[3], coefficients[4], coefficients[5]);
    }

    public static GeoTransform northUp(double originX, double originY, double pixelWidth, double pixelHeight) {
        return new GeoTransform(originX, pixelWidth, 0.0, originY, 0.0, -pixelHeight);
    }

    /**
     * Returns <code>true</code> if this transform has positive pixel width, zero rotations and
     * negative pixel height.
     *
     * @return whether this transform is north-up.
     */
    public boolean isNorthUp() {
        return pixelWidth > 0.0 && rowRotation == 0.0 && columnRotation == 0.0 && pixelHeight < 0.0;
    }

    public GeoTransform requireNorthUp() {
        if (!isNorthUp()) {
            throw new IllegalArgumentException("Only north-up geotransform supported: " + this);
        }
        return this;
    }

    public double x(double pixel, double line) {
        return originX + pixel * pixelWidth + line * rowRotation;
    }

    public double y(double pixel, double line) {
        return originY + pixel * columnRotation + line * pixelHeight;
    }

    public double[] toArray() {
        return new double[]{originX, pixelWidth, rowRotation, originY, columnRotation, pixelHeight};
    }
}
