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

package net.algart.matrices.pds4.layout;

import java.util.Objects;

/**
 * One <code>Axis_Array</code> of a PDS4 array.
 *
 * @param role             role of the axis.
 * @param elementCount     number of elements along this axis, positive.
 * @param sequencePosition 1-based <code>sequence_number</code>; the axis with the maximal
 *                         sequence number varies fastest.
 */
public record AxisSpec(AxisRole role, int elementCount, int sequencePosition) {
    public AxisSpec {
        Objects.requireNonNull(role, "Null role");
        if (elementCount <= 0) {
            throw new IllegalArgumentException("Zero or negative number of elements " + elementCount
                    + " along " + role.axisName() + " axis");
        }
        if (sequencePosition <= 0) {
            throw new IllegalArgumentException("Zero or negative sequence number " + sequencePosition
                    + " of " + role.axisName() + " axis");
        }
    }

    @Override
    public String toString() {
        return role.axisName() + " axis #" + sequencePosition + " (" + elementCount + " elements)";
    }
}
