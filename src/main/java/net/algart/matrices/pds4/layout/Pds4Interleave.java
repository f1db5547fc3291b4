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

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Physical ordering of samples in the image file, used while creating new arrays.
 */
public enum Pds4Interleave {
    /**
     * Band sequential: all lines of band 0, then all lines of band 1, etc.
     */
    BSQ("BAND", "BLS"),
    /**
     * Band interleaved by pixel: all bands of every pixel are stored together.
     */
    BIP("PIXEL", "LSB"),
    /**
     * Band interleaved by line: every line contains all bands one after another.
     */
    BIL("LINE", "LBS");

    private final String metadataName;
    private final String axisOrder;

    Pds4Interleave(String metadataName, String axisOrder) {
        this.metadataName = metadataName;
        this.axisOrder = axisOrder;
    }

    /**
     * Returns the traditional name of this interleave: <code>BAND</code>, <code>PIXEL</code> or <code>LINE</code>.
     *
     * @return interleave name.
     */
    public String metadataName() {
        return metadataName;
    }

    /**
     * Returns axis roles in the order of sequence numbers, as letters <code>B</code>, <code>L</code>,
     * <code>S</code>.
     *
     * @return axis order.
     */
    public String axisOrder() {
        return axisOrder;
    }

    /**
     * Returns axes of a new array with this interleave, in the order of sequence numbers.
     * For 2-dimensional arrays there is no Band axis and the result is always (Line, Sample).
     *
     * @param samples          number of samples in every line.
     * @param lines            number of lines.
     * @param bands            number of bands.
     * @param twoDimensional   whether the array is 2-dimensional.
     * @return list of axes.
     */
    public List<AxisSpec> axes(int samples, int lines, int bands, boolean twoDimensional) {
        if (twoDimensional) {
            if (bands != 1) {
                throw new IllegalArgumentException("2-dimensional array cannot contain " + bands + " bands");
            }
            return List.of(
                    new AxisSpec(AxisRole.LINE, lines, 1),
                    new AxisSpec(AxisRole.SAMPLE, samples, 2));
        }
        return switch (this) {
            case BSQ -> List.of(
                    new AxisSpec(AxisRole.BAND, bands, 1),
                    new AxisSpec(AxisRole.LINE, lines, 2),
                    new AxisSpec(AxisRole.SAMPLE, samples, 3));
            case BIP -> List.of(
                    new AxisSpec(AxisRole.LINE, lines, 1),
                    new AxisSpec(AxisRole.SAMPLE, samples, 2),
                    new AxisSpec(AxisRole.BAND, bands, 3));
            case BIL -> List.of(
                    new AxisSpec(AxisRole.LINE, lines, 1),
                    new AxisSpec(AxisRole.BAND, bands, 2),
                    new AxisSpec(AxisRole.SAMPLE, samples, 3));
        };
    }

    /**
     * Returns the interleave, corresponding to the given axis order (see {@link #axisOrder()}).
     * 2-dimensional orders <code>LS</code> and <code>SL</code> are not considered as any interleave.
     *
     * @param axisOrder letters of axis roles in the order of sequence numbers.
     * @return the corresponding interleave.
     */
    public static Optional<Pds4Interleave> fromAxisOrder(String axisOrder) {
        Objects.requireNonNull(axisOrder, "Null axisOrder");
        for (Pds4Interleave interleave : values()) {
            if (interleave.axisOrder.equals(axisOrder)) {
                return Optional.of(interleave);
            }
        }
        return Optional.empty();
    }

    public static Pds4Interleave fromName(String name) {
        Objects.requireNonNull(name, "Null interleave name");
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid interleave \"" + name + "\": must be BSQ, BIP or BIL", e);
        }
    }
}
