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

/**
 * Physical layout of samples of one array in the image file: offsets and strides in bytes.
 *
 * <p>The sample <code>(band, line, sample)</code> is located at
 * <code>baseOffset + band * bandStride + line * lineStride + sample * pixelStride</code>.
 * <code>lineStride</code> is negative when lines are stored from bottom to top;
 * in this case <code>baseOffset</code> points to the last physical line, so that logical line 0
 * is the top line of the image.
 *
 * @param elementSize number of bytes per sample.
 * @param pixelStride distance between neighbouring samples of a line.
 * @param lineStride  distance between neighbouring lines (negative for bottom-to-top storage).
 * @param bandStride  distance between neighbouring bands.
 * @param baseOffset  position of the first sample of the first logical line of band 0.
 * @param samples     number of samples in each line.
 * @param lines       number of lines.
 * @param bands       number of bands.
 */
public record LayoutPlan(
        int elementSize,
        long pixelStride,
        long lineStride,
        long bandStride,
        long baseOffset,
        int samples,
        int lines,
        int bands) {
    public LayoutPlan {
        if (elementSize <= 0) {
            throw new IllegalArgumentException("Zero or negative element size " + elementSize);
        }
        if (pixelStride <= 0 || lineStride == 0 || bandStride <= 0) {
            throw new IllegalArgumentException("Illegal strides: pixel " + pixelStride + ", line " + lineStride
                    + ", band " + bandStride);
        }
        if (samples <= 0 || lines <= 0 || bands <= 0) {
            throw new IllegalArgumentException("Zero or negative dimensions " + samples + "x" + lines + "x" + bands);
        }
        if (baseOffset < 0) {
            throw new IllegalArgumentException("Negative base offset " + baseOffset);
        }
    }

    public boolean isBottomToTop() {
        return lineStride < 0;
    }

    public long offset(int band, int line, int sample) {
        return baseOffset + band * bandStride + line * lineStride + sample * pixelStride;
    }

    public long bandOffset(int band) {
        return baseOffset + band * bandStride;
    }

    /**
     * Returns the minimal byte position, occupied by samples of this array.
     *
     * @return start of the array data.
     */
    public long minOffset() {
        return lineStride < 0 ? baseOffset + (lines - 1) * lineStride : baseOffset;
    }

    /**
     * Returns the number of bytes between the first and the last occupied byte, inclusive.
     * For a densely packed array it is <code>elementSize * samples * lines * bands</code>.
     *
     * @return size of the array data.
     */
    public long addressedSpan() {
        return (samples - 1) * pixelStride + (lines - 1) * Math.abs(lineStride)
                + (bands - 1) * bandStride + elementSize;
    }

    public boolean isContiguousLine() {
        return pixelStride == elementSize;
    }

    @Override
    public String toString() {
        return "layout " + samples + "x" + lines + "x" + bands + " of " + elementSize + "-byte samples: "
                + "pixel stride " + pixelStride + ", line stride " + lineStride
                + ", band stride " + bandStride + ", base offset " + baseOffset;
    }
}
