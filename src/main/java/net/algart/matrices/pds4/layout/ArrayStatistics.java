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
import java.util.OptionalDouble;

/**
 * Values of <code>Object_Statistics</code> element of an array.
 */
public record ArrayStatistics(
        OptionalDouble minimum,
        OptionalDouble maximum,
        OptionalDouble mean,
        OptionalDouble standardDeviation) {
    public ArrayStatistics {
        Objects.requireNonNull(minimum, "Null minimum");
        Objects.requireNonNull(maximum, "Null maximum");
        Objects.requireNonNull(mean, "Null mean");
        Objects.requireNonNull(standardDeviation, "Null standardDeviation");
    }

    public boolean isEmpty() {
        return minimum.isEmpty() && maximum.isEmpty() && mean.isEmpty() && standardDeviation.isEmpty();
    }
}
