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
import net.algart.matrices.pds4.TooLargePds4ArrayException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AxisLayoutResolverTest {
    @Test
    void bandSequentialStrides() throws Pds4Exception {
        final LayoutPlan plan = AxisLayoutResolver.resolve(
                Pds4Interleave.BSQ.axes(10, 5, 3, false), 2, 100, false);
        assertEquals(2, plan.pixelStride());
        assertEquals(20, plan.lineStride());
        assertEquals(100, plan.bandStride());
        assertEquals(100, plan.baseOffset());
        assertEquals(2 * 10 * 5 * 3, plan.addressedSpan());
        assertTrue(plan.isContiguousLine());
        assertEquals(100 + 2 * 100 + 4 * 20 + 9 * 2, plan.offset(2, 4, 9));
    }

    @Test
    void pixelInterleavedStrides() throws Pds4Exception {
        final LayoutPlan plan = AxisLayoutResolver.resolve(
                Pds4Interleave.BIP.axes(10, 5, 3, false), 4, 0, false);
        assertEquals(12, plan.pixelStride());
        assertEquals(120, plan.lineStride());
        assertEquals(4, plan.bandStride());
        assertFalse(plan.isContiguousLine());
        assertEquals(plan.pixelStride() * plan.samples(), plan.lineStride());
        assertEquals(4 * 10 * 5 * 3, plan.addressedSpan());
    }

    @Test
    void lineInterleavedStrides() throws Pds4Exception {
        final LayoutPlan plan = AxisLayoutResolver.resolve(
                Pds4Interleave.BIL.axes(10, 5, 3, false), 1, 0, false);
        assertEquals(1, plan.pixelStride());
        assertEquals(30, plan.lineStride());
        assertEquals(10, plan.bandStride());
        assertEquals(150, plan.addressedSpan());
    }

    @Test
    void everyAxisPermutationIsDenselyPacked() throws Pds4Exception {
        final int[][] permutations = {
                {1, 2, 3}, {1, 3, 2}, {2, 1, 3}, {2, 3, 1}, {3, 1, 2}, {3, 2, 1}};
        for (int[] p : permutations) {
            final List<AxisSpec> axes = List.of(
                    new AxisSpec(AxisRole.BAND, 3, p[0]),
                    new AxisSpec(AxisRole.LINE, 7, p[1]),
                    new AxisSpec(AxisRole.SAMPLE, 11, p[2]));
            final LayoutPlan plan = AxisLayoutResolver.resolve(axes, 8, 0, false);
            assertEquals(8L * 3 * 7 * 11, plan.addressedSpan(), "permutation " + p[0] + p[1] + p[2]);
            final long[] strides = {plan.bandStride(), plan.lineStride(), plan.pixelStride()};
            final int[] counts = {3, 7, 11};
            for (int i = 0; i < 3; i++) {
                long expected = 8;
                for (int j = 0; j < 3; j++) {
                    if (p[j] > p[i]) {
                        expected *= counts[j];
                    }
                }
                assertEquals(expected, strides[i], "axis " + i + " of permutation " + p[0] + p[1] + p[2]);
            }
        }
    }

    @Test
    void twoDimensionalArrayHasOneBand() throws Pds4Exception {
        final LayoutPlan plan = AxisLayoutResolver.resolve(
                Pds4Interleave.BSQ.axes(6, 4, 1, true), 2, 0, false);
        assertEquals(1, plan.bands());
        assertEquals(2, plan.pixelStride());
        assertEquals(12, plan.lineStride());
        assertEquals(48, plan.addressedSpan());
    }

    @Test
    void bottomToTopStartsFromLastPhysicalLine() throws Pds4Exception {
        final LayoutPlan plan = AxisLayoutResolver.resolve(List.of(
                new AxisSpec(AxisRole.LINE, 4, 1),
                new AxisSpec(AxisRole.SAMPLE, 5, 2)), 1, 16, true);
        assertTrue(plan.isBottomToTop());
        assertEquals(-5, plan.lineStride());
        assertEquals(16 + 3 * 5, plan.baseOffset());
        assertEquals(16, plan.minOffset());
        assertEquals(20, plan.addressedSpan());
        assertEquals(16, plan.offset(0, 3, 0));
    }

    @Test
    void duplicateSequenceNumberIsRejected() {
        final List<AxisSpec> axes = List.of(
                new AxisSpec(AxisRole.LINE, 4, 1),
                new AxisSpec(AxisRole.SAMPLE, 5, 1));
        assertThrows(Pds4Exception.class, () -> AxisLayoutResolver.resolve(axes, 1, 0, false));
    }

    @Test
    void duplicateRoleIsRejected() {
        final List<AxisSpec> axes = List.of(
                new AxisSpec(AxisRole.LINE, 4, 1),
                new AxisSpec(AxisRole.LINE, 5, 2));
        assertThrows(Pds4Exception.class, () -> AxisLayoutResolver.resolve(axes, 1, 0, false));
    }

    @Test
    void sequenceNumberOutOfRangeIsRejected() {
        final List<AxisSpec> axes = List.of(
                new AxisSpec(AxisRole.LINE, 4, 1),
                new AxisSpec(AxisRole.SAMPLE, 5, 3));
        assertThrows(Pds4Exception.class, () -> AxisLayoutResolver.resolve(axes, 1, 0, false));
    }

    @Test
    void bandAxisRequiresThreeDimensions() {
        final List<AxisSpec> axes = List.of(
                new AxisSpec(AxisRole.BAND, 4, 1),
                new AxisSpec(AxisRole.SAMPLE, 5, 2));
        assertThrows(Pds4Exception.class, () -> AxisLayoutResolver.resolve(axes, 1, 0, false));
    }

    @Test
    void lineStrideOverflowIsTooLarge() {
        final List<AxisSpec> axes = List.of(
                new AxisSpec(AxisRole.LINE, 2, 1),
                new AxisSpec(AxisRole.SAMPLE, Integer.MAX_VALUE / 2 + 1, 2));
        final TooLargePds4ArrayException e = assertThrows(TooLargePds4ArrayException.class,
                () -> AxisLayoutResolver.resolve(axes, 2, 0, false));
        assertTrue(e.getMessage().contains("Line"), e.getMessage());
    }

    @Test
    void bandStrideMayExceed32Bits() throws Pds4Exception {
        final LayoutPlan plan = AxisLayoutResolver.resolve(
                Pds4Interleave.BSQ.axes(65536, 32768, 2, false), 2, 0, false);
        assertEquals(2L * 65536 * 32768, plan.bandStride());
        assertTrue(plan.bandStride() > Integer.MAX_VALUE);
    }

    @Test
    void interleaveNamesAndOrders() {
        assertEquals("BAND", Pds4Interleave.BSQ.metadataName());
        assertEquals("PIXEL", Pds4Interleave.BIP.metadataName());
        assertEquals("LINE", Pds4Interleave.BIL.metadataName());
        assertEquals(Pds4Interleave.BIL, Pds4Interleave.fromAxisOrder("LBS").orElseThrow());
        assertTrue(Pds4Interleave.fromAxisOrder("LS").isEmpty());
        assertEquals(Pds4Interleave.BIP, Pds4Interleave.fromName("bip"));
        assertThrows(IllegalArgumentException.class, () -> Pds4Interleave.fromName("XYZ"));
    }
}
