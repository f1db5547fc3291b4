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
import java.util.Optional;

/**
 * Georeferencing of a PDS4 product: spatial reference system and/or affine transform.
 * Both parts are optional: many products have no cartography.
 *
 * @param spatialReference spatial reference system.
 * @param geoTransform     transform from pixel/line to projected coordinates.
 */
public record Pds4Georeferencing(Optional<SpatialReference> spatialReference, Optional<GeoTransform> geoTransform) {
    private static final Pds4Georeferencing EMPTY = new Pds4Georeferencing(Optional.empty(), Optional.empty());

    public Pds4Georeferencing {
        Objects.requireNonNull(spatialReference, "Null spatialReference");
        Objects.requireNonNull(geoTransform, "Null geoTransform");
    }

    public static Pds4Georeferencing empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return spatialReference.isEmpty() && geoTransform.isEmpty();
    }
}
