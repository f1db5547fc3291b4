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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class GeoTransformTest {
    @Test
    void northUpTransform() {
        final GeoTransform transform = GeoTransform.northUp(1000.0, 2000.0, 10.0, 20.0);
        assertTrue(transform.isNorthUp());
        assertEquals(-20.0, transform.pixelHeight());
        assertEquals(1050.0, transform.x(5, 3));
        assertEquals(1940.0, transform.y(5, 3));
        assertSame(transform, transform.requireNorthUp());
    }

    @Test
    void rotatedTransformIsRejected() {
        final GeoTransform rotated = GeoTransform.of(new double[]{0, 1, 0.5, 0, 0, -1});
        assertFalse(rotated.isNorthUp());
        final IllegalArgumentException e = assertThrows(IllegalArgumentException.class, rotated::requireNorthUp);
        assertTrue(e.getMessage().startsWith("Only north-up geotransform supported"));
        assertFalse(GeoTransform.of(new double[]{0, 1, 0, 0, 0, 1}).isNorthUp());
    }

    @Test
    void coefficientsRoundTrip() {
        final double[] coefficients = {1, 2, 3, 4, 5, 6};
        assertArrayEquals(coefficients, GeoTransform.of(coefficients).toArray());
        assertThrows(IllegalArgumentException.class, () -> GeoTransform.of(new double[5]));
    }
}
