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

import net.algart.matrices.pds4.Pds4Warnings;
import net.algart.matrices.pds4.label.LabelTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Sentinel sample values of one array. The "missing" constant, if present, is the no-data value;
 * all constants are candidates for exclusion in the validity mask.
 *
 * <p>Objects of this class are immutable.
 */
public final class SpecialConstants {
    private static final SpecialConstants EMPTY = new SpecialConstants(new EnumMap<>(SpecialConstantKind.class));

    private final Map<SpecialConstantKind, Double> values;

    private SpecialConstants(Map<SpecialConstantKind, Double> values) {
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public static SpecialConstants empty() {
        return EMPTY;
    }

    public static SpecialConstants of(Map<SpecialConstantKind, Double> values) {
        Objects.requireNonNull(values, "Null values");
        if (values.isEmpty()) {
            return EMPTY;
        }
        final EnumMap<SpecialConstantKind, Double> map = new EnumMap<>(SpecialConstantKind.class);
        values.forEach((kind, value) -> map.put(
                Objects.requireNonNull(kind, "Null kind"),
                Objects.requireNonNull(value, "Null value of " + kind)));
        return new SpecialConstants(map);
    }

    /**
     * Reads the constants from <code>Special_Constants</code> element.
     * Values, which cannot be parsed as numbers, are skipped with a warning.
     *
     * @param tree     label tree.
     * @param node     <code>Special_Constants</code> element or {@link LabelTree#NONE}.
     * @param context  description of the array for warning messages.
     * @param warnings collector of warnings.
     * @return parsed constants.
     */
    public static SpecialConstants read(LabelTree tree, int node, String context, Pds4Warnings warnings) {
        Objects.requireNonNull(tree, "Null tree");
        Objects.requireNonNull(warnings, "Null warnings");
        if (node == LabelTree.NONE) {
            return EMPTY;
        }
        final EnumMap<SpecialConstantKind, Double> map = new EnumMap<>(SpecialConstantKind.class);
        for (SpecialConstantKind kind : SpecialConstantKind.values()) {
            final String s = tree.value(node, kind.elementName(), null);
            if (s != null) {
                try {
                    map.put(kind, Double.parseDouble(s.trim()));
                } catch (NumberFormatException e) {
                    warnings.warn("Invalid %s = '%s' in %s: ignored", kind.elementName(), s, context);
                }
            }
        }
        return of(map);
    }

    public Map<SpecialConstantKind, Double> values() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public OptionalDouble get(SpecialConstantKind kind) {
        final Double v = values.get(Objects.requireNonNull(kind, "Null kind"));
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public OptionalDouble noDataValue() {
        return get(SpecialConstantKind.MISSING);
    }

    /**
     * Returns all constants in the order of {@link SpecialConstantKind} declaration.
     *
     * @return candidate values, excluded by the validity mask.
     */
    public List<Double> maskValues() {
        return new ArrayList<>(values.values());
    }

    /**
     * Returns <code>true</code> if a validity mask should be built for an array with these constants.
     * No mask is necessary for complex data, or when the only constant is the no-data value
     * (no-data value is enough in this case), or when there are no constants,
     * unless the mask is forced.
     *
     * @param complex whether the samples are complex.
     * @param forced  whether the mask is explicitly requested.
     * @return whether the mask is necessary.
     */
    public boolean requiresMask(boolean complex, boolean forced) {
        if (complex) {
            return false;
        }
        return forced || values.size() >= 2 || (values.size() == 1 && noDataValue().isEmpty());
    }

    /**
     * Returns new constants with the given no-data ("missing") value.
     *
     * @param noDataValue new missing constant.
     * @return modified copy of this object.
     */
    public SpecialConstants withNoDataValue(double noDataValue) {
        final EnumMap<SpecialConstantKind, Double> map = new EnumMap<>(SpecialConstantKind.class);
        map.putAll(values);
        map.put(SpecialConstantKind.MISSING, noDataValue);
        return new SpecialConstants(map);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof SpecialConstants that && values.equals(that.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "special constants " + values;
    }
}
