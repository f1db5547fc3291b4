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

import net.algart.matrices.pds4.Pds4Exception;
import net.algart.matrices.pds4.Pds4Tools;
import net.algart.matrices.pds4.TooLargePds4ArrayException;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Calculates the physical {@link LayoutPlan} of an array from its axes.
 *
 * <p>Only "Last Index Fastest" axis order is supported: the axis with the maximal sequence number
 * varies fastest. The stride of every axis is the element size, multiplied by the counts of all axes
 * with greater sequence numbers. Pixel and line strides must fit into 32-bit signed integers;
 * otherwise, {@link TooLargePds4ArrayException} is thrown.
 *
 * <p>This class performs no I/O and has no state.
 */
public class AxisLayoutResolver {
    private AxisLayoutResolver() {
    }

    public static LayoutPlan resolve(List<AxisSpec> axes, int elementSize, long baseOffset, boolean bottomToTop)
            throws Pds4Exception {
        Objects.requireNonNull(axes, "Null axes");
        if (elementSize <= 0) {
            throw new IllegalArgumentException("Zero or negative element size " + elementSize);
        }
        if (baseOffset < 0) {
            throw new IllegalArgumentException("Negative base offset " + baseOffset);
        }
        final int dim = axes.size();
        if (dim < 1 || dim > 3) {
            throw new Pds4Exception("Illegal number of axes " + dim + ": must be 1..3");
        }
        final boolean[] positionUsed = new boolean[dim + 1];
        final Map<AxisRole, AxisSpec> byRole = new EnumMap<>(AxisRole.class);
        for (AxisSpec axis : axes) {
            Objects.requireNonNull(axis, "Null axis");
            final int position = axis.sequencePosition();
            if (position > dim) {
                throw new Pds4Exception("Invalid sequence number " + position + " of " + axis.role().axisName()
                        + " axis: must be 1.." + dim);
            }
            if (positionUsed[position]) {
                throw new Pds4Exception("Duplicate sequence number " + position);
            }
            positionUsed[position] = true;
            if (byRole.put(axis.role(), axis) != null) {
                throw new Pds4Exception("Duplicate " + axis.role().axisName() + " axis");
            }
        }
        if (byRole.containsKey(AxisRole.BAND) && dim != 3) {
            throw new Pds4Exception("Band axis is allowed only in 3-dimensional arrays");
        }
        final AxisSpec[] ordered = axes.stream()
                .sorted(Comparator.comparingInt(AxisSpec::sequencePosition))
                .toArray(AxisSpec[]::new);
        final int samples = count(byRole, AxisRole.SAMPLE);
        final int lines = count(byRole, AxisRole.LINE);
        final int bands = count(byRole, AxisRole.BAND);

        long pixelStride = elementSize;
        long lineStride = elementSize;
        long bandStride = elementSize;
        long spacing = elementSize;
        for (int i = dim - 1; i >= 0; i--) {
            final AxisSpec axis = ordered[i];
            final int countPrevious = i + 1 < dim ? ordered[i + 1].elementCount() : 1;
            switch (axis.role()) {
                case SAMPLE -> pixelStride = spacing = stride(spacing, countPrevious, axis, Integer.MAX_VALUE);
                case LINE -> lineStride = spacing = stride(spacing, countPrevious, axis, Integer.MAX_VALUE);
                case BAND -> bandStride = spacing = stride(spacing, countPrevious, axis, Long.MAX_VALUE);
            }
        }
        final long total = stride(spacing, ordered[0].elementCount(), ordered[0], Long.MAX_VALUE);
        // - distance after the last element of the whole array
        if (!byRole.containsKey(AxisRole.LINE)) {
            lineStride = total;
        }
        if (!byRole.containsKey(AxisRole.BAND)) {
            bandStride = total;
        }
        if (bottomToTop) {
            baseOffset += (lines - 1) * lineStride;
            lineStride = -lineStride;
        }
        return new LayoutPlan(elementSize, pixelStride, lineStride, bandStride, baseOffset, samples, lines, bands);
    }

    private static int count(Map<AxisRole, AxisSpec> byRole, AxisRole role) {
        final AxisSpec axis = byRole.get(role);
        return axis == null ? 1 : axis.elementCount();
    }

    private static long stride(long spacing, int count, AxisSpec axis, long maxValue) throws Pds4Exception {
        return Pds4Tools.checkedMul(new long[]{spacing, count}, new String[]{"spacing", "count of inner axis"},
                () -> "Cannot calculate stride of " + axis.role().axisName() + " axis: ", () -> "", maxValue);
    }
}
