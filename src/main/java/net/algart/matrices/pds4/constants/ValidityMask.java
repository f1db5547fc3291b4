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

package net.algart.matrices.pds4.constants;

import net.algart.matrices.pds4.Pds4SampleType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Per-pixel validity predicate: a sample is invalid (0) if it is equal to one of the special constants,
 * and valid (255) in other case.
 *
 * <p>The constants are converted to the precision of the sample type before comparison:
 * for example, for <code>FLOAT</code> samples the constants are compared as <code>float</code> values,
 * and for integer samples they are rounded and saturated to the range of the type.
 */
public final class ValidityMask {
    public static final byte VALID = (byte) 255;
    public static final byte INVALID = 0;

    private final Pds4SampleType sampleType;
    private final double[] constants;

    public ValidityMask(Pds4SampleType sampleType, List<Double> constants) {
        this.sampleType = Objects.requireNonNull(sampleType, "Null sampleType");
        Objects.requireNonNull(constants, "Null constants");
        if (sampleType.isComplex()) {
            throw new IllegalArgumentException("Validity mask is not supported for complex samples");
        }
        this.constants = constants.stream().mapToDouble(v -> sampleType.castToSampleWidth(v)).distinct().toArray();
    }

    public Pds4SampleType sampleType() {
        return sampleType;
    }

    public boolean isValid(double sample) {
        for (double c : constants) {
            if (sample == c) {
                return false;
            }
        }
        return true;
    }

    public byte[] evaluate(byte[] samples, ByteOrder byteOrder, int sizeX, int sizeY) {
        final byte[] result = new byte[Math.multiplyExact(sizeX, sizeY)];
        evaluate(samples, byteOrder, sizeX, sizeY, sizeX, result);
        return result;
    }

    /**
     * Fills the mask for a block of samples. Both the samples and the mask are stored by rows
     * of <code>rowLength</code> elements, but only the first <code>sizeX</code> elements of
     * the first <code>sizeY</code> rows are processed: other elements of the mask are not modified.
     * It allows to process partial blocks at the image boundary.
     *
     * @param samples   samples of the block.
     * @param byteOrder byte order of the samples.
     * @param sizeX     number of processed elements in every row.
     * @param sizeY     number of processed rows.
     * @param rowLength number of elements in every row of the block, <code>&ge;sizeX</code>.
     * @param mask      resulting mask.
     */
    public void evaluate(byte[] samples, ByteOrder byteOrder, int sizeX, int sizeY, int rowLength, byte[] mask) {
        Objects.requireNonNull(samples, "Null samples");
        Objects.requireNonNull(byteOrder, "Null byteOrder");
        Objects.requireNonNull(mask, "Null mask");
        if (sizeX < 0 || sizeY < 0 || rowLength < sizeX) {
            throw new IllegalArgumentException("Illegal block sizes " + sizeX + "x" + sizeY
                    + " (row length " + rowLength + ")");
        }
        if (sizeX == 0 || sizeY == 0) {
            return;
        }
        final long lastIndex = (long) (sizeY - 1) * (long) rowLength + sizeX;
        final int bytesPerSample = sampleType.bytesPerSample();
        if (lastIndex > mask.length || lastIndex * bytesPerSample > samples.length) {
            throw new IndexOutOfBoundsException("Block " + sizeX + "x" + sizeY + " (row length " + rowLength
                    + ") is out of mask[" + mask.length + "] or samples[" + samples.length + "]");
        }
        final ByteBuffer bb = ByteBuffer.wrap(samples).order(byteOrder);
        for (int y = 0; y < sizeY; y++) {
            final int rowStart = y * rowLength;
            for (int x = 0; x < sizeX; x++) {
                final int index = rowStart + x;
                final double v = sampleType.readSample(bb, index * bytesPerSample);
                mask[index] = isValid(v) ? VALID : INVALID;
            }
        }
    }

    @Override
    public String toString() {
        return "validity mask for " + sampleType + " samples, excluding " + Arrays.toString(constants);
    }
}
