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

package net.algart.matrices.pds4;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

public class Pds4Tools {
    /**
     * Maximal number of bands in a raster array, supported by this library.
     */
    public static final int MAX_NUMBER_OF_BANDS = 65535;

    private static final int MAX_SIGNIFICANT_DIGITS = 17;

    private Pds4Tools() {
    }

    public static long checkedMul(
            long[] values,
            String[] names,
            Supplier<String> prefix,
            Supplier<String> postfix,
            long maxValue) throws Pds4Exception {
        Objects.requireNonNull(values);
        Objects.requireNonNull(prefix);
        Objects.requireNonNull(postfix);
        Objects.requireNonNull(names);
        if (values.length == 0) {
            return 1;
        }
        long result = 1L;
        double product = 1.0;
        boolean overflow = false;
        for (int i = 0; i < values.length; i++) {
            long m = values[i];
            if (m < 0) {
                throw new Pds4Exception(prefix.get() + "negative " + names[i] + " = " + m + postfix.get());
            }
            if (m > maxValue) {
                throw new TooLargePds4ArrayException(prefix.get() + "too large " + names[i] + " = " + m
                        + postfix.get() + " > " + maxValue);
            }
            result *= m;
            product *= m;
            if (result > maxValue || product > (double) maxValue) {
                overflow = true;
                // - we just indicate this, but still calculate the floating-point product
            }
        }
        if (overflow) {
            throw new TooLargePds4ArrayException(prefix.get() + "integer overflow: " + String.join(" * ", names) +
                    " = " + Arrays.stream(values).mapToObj(String::valueOf).collect(
                    Collectors.joining(" * ")) +
                    " = " + product + " > " + maxValue + postfix.get());
        }
        return result;
    }

    /**
     * Returns the shortest decimal representation of the given value, which is parsed back
     * by {@link Double#parseDouble(String)} to exactly the same <code>double</code>.
     * Trailing zeros are removed. Exponential notation is used only for very large or very small
     * magnitudes (&ge;1e16 or &lt;1e-6).
     *
     * @param value some value.
     * @return its decimal representation for writing into a label.
     */
    public static String formatDouble(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        if (value == 0.0) {
            return "0";
            // - also for -0.0
        }
        final BigDecimal exact = new BigDecimal(value);
        BigDecimal result = exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN));
        // - 17 digits are always enough
        for (int digits = 1; digits < MAX_SIGNIFICANT_DIGITS; digits++) {
            final BigDecimal rounded = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
            if (rounded.doubleValue() == value) {
                result = rounded;
                break;
            }
        }
        result = result.stripTrailingZeros();
        final double magnitude = Math.abs(value);
        return magnitude >= 1e-6 && magnitude < 1e16 ? result.toPlainString() : result.toString();
    }

    public static String removePrefix(String name) {
        Objects.requireNonNull(name, "Null name");
        final int p = name.indexOf(':');
        return p >= 0 ? name.substring(p + 1) : name;
    }

    public static String prefixOf(String name) {
        Objects.requireNonNull(name, "Null name");
        final int p = name.indexOf(':');
        return p >= 0 ? name.substring(0, p + 1) : "";
    }

    static boolean getBooleanProperty(String propertyName) {
        try {
            return Boolean.getBoolean(propertyName);
        } catch (Exception e) {
            return false;
        }
    }
}
