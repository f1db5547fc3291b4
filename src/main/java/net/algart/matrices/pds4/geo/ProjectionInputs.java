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

import net.algart.matrices.pds4.label.LabelTree;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Common parameters of a PDS4 map projection, read from its parameter element
 * (for example, <code>Map_Projection/Transverse_Mercator</code>).
 *
 * @param parameterNode     the parameter element or {@link LabelTree#NONE} if it is absent.
 * @param centerLongitude   <code>longitude_of_central_meridian</code> or
 *                          <code>straight_vertical_longitude_from_pole</code>, in degrees (0 if absent).
 * @param centerLatitude    <code>latitude_of_projection_origin</code> in degrees (0 if absent).
 * @param standardParallel1 <code>standard_parallel_1</code> in degrees.
 * @param standardParallel2 <code>standard_parallel_2</code> in degrees.
 * @param scale             scale factor (at central meridian for Transverse Mercator,
 *                          at projection origin for other projections).
 */
public record ProjectionInputs(
        int parameterNode,
        double centerLongitude,
        double centerLatitude,
        OptionalDouble standardParallel1,
        OptionalDouble standardParallel2,
        OptionalDouble scale) {

    public ProjectionInputs {
        Objects.requireNonNull(standardParallel1, "Null standardParallel1");
        Objects.requireNonNull(standardParallel2, "Null standardParallel2");
        Objects.requireNonNull(scale, "Null scale");
    }

    public static ProjectionInputs read(
            LabelQuantities quantities,
            LabelTree tree,
            int parameterNode,
            String scaleElementName) {
        Objects.requireNonNull(quantities, "Null quantities");
        Objects.requireNonNull(tree, "Null tree");
        Objects.requireNonNull(scaleElementName, "Null scaleElementName");
        if (parameterNode == LabelTree.NONE) {
            return new ProjectionInputs(LabelTree.NONE, 0.0, 0.0,
                    OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty());
        }
        OptionalDouble centerLongitude = quantities.angular(parameterNode, "longitude_of_central_meridian");
        if (centerLongitude.isEmpty()) {
            centerLongitude = quantities.angular(parameterNode, "straight_vertical_longitude_from_pole");
        }
        final String scale = tree.value(parameterNode, scaleElementName, null);
        return new ProjectionInputs(
                parameterNode,
                centerLongitude.orElse(0.0),
                quantities.angular(parameterNode, "latitude_of_projection_origin").orElse(0.0),
                quantities.angular(parameterNode, "standard_parallel_1"),
                quantities.angular(parameterNode, "standard_parallel_2"),
                scale == null ? OptionalDouble.empty() : OptionalDouble.of(quantities.parse(scale, scaleElementName)));
    }

    public double scaleOrDefault() {
        return scale.orElse(1.0);
    }

    public double standardParallel1OrZero() {
        return standardParallel1.orElse(0.0);
    }

    public double standardParallel2OrZero() {
        return standardParallel2.orElse(0.0);
    }
}
