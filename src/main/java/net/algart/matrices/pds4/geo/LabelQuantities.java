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

import net.algart.matrices.pds4.Pds4Warnings;
import net.algart.matrices.pds4.label.LabelTree;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.function.ToDoubleBiFunction;

/**
 * Reading numeric label values with a <code>unit</code> attribute and their conversion to canonical units.
 * A missing element is considered to be 0. An unknown unit leads to a warning; the value is returned
 * without conversion in this case.
 */
public final class LabelQuantities {
    private final LabelTree tree;
    private final Pds4Warnings warnings;

    public LabelQuantities(LabelTree tree, Pds4Warnings warnings) {
        this.tree = Objects.requireNonNull(tree, "Null tree");
        this.warnings = Objects.requireNonNull(warnings, "Null warnings");
    }

    public double linear(int parent, String elementName) {
        return read(parent, elementName, LinearUnit.METER.unitName(), LinearUnit::fromName,
                LinearUnit::toMeters).orElse(0.0);
    }

    public double resolution(int parent, String elementName) {
        return read(parent, elementName, ResolutionUnit.METER_PER_PIXEL.unitName(), ResolutionUnit::fromName,
                ResolutionUnit::toMetersPerPixel).orElse(0.0);
    }

    /**
     * Reads an angle in degrees.
     *
     * @param parent      parent element.
     * @param elementName name of the child element, containing the value.
     * @return the value in degrees or empty result if there is no such element.
     */
    public OptionalDouble angular(int parent, String elementName) {
        return read(parent, elementName, AngularUnit.DEGREE.unitName(), AngularUnit::fromName,
                AngularUnit::toDegrees);
    }

    /**
     * Parses a number, returning 0 (with a warning) for non-numeric strings.
     *
     * @param s           string value.
     * @param elementName name of the element for the warning message.
     * @return parsed value.
     */
    public double parse(String s, String elementName) {
        Objects.requireNonNull(s, "Null string value");
        if (s.isBlank()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            warnings.warn("Invalid numeric value '%s' of '%s': 0 is used", s, elementName);
            return 0.0;
        }
    }

    public double number(int parent, String elementName, double defaultValue) {
        final String s = tree.value(parent, elementName, null);
        return s == null ? defaultValue : parse(s, elementName);
    }

    private <U> OptionalDouble read(
            int parent,
            String elementName,
            String canonicalUnit,
            Function<String, Optional<U>> unitLookup,
            ToDoubleBiFunction<U, Double> conversion) {
        final int node = tree.find(parent, elementName);
        if (node == LabelTree.NONE) {
            return OptionalDouble.empty();
        }
        final double value = parse(tree.value(node, ""), elementName);
        final String unitName = tree.value(node, "unit", null);
        if (unitName == null || unitName.equalsIgnoreCase(canonicalUnit)) {
            return OptionalDouble.of(value);
        }
        final Optional<U> unit = unitLookup.apply(unitName);
        if (unit.isEmpty()) {
            warnings.warn("Unknown unit '%s' for '%s'", unitName, elementName);
            return OptionalDouble.of(value);
        }
        return OptionalDouble.of(conversion.applyAsDouble(unit.get(), value));
    }
}
