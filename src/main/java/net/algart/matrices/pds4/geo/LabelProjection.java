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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Content of <code>Map_Projection</code> element: PDS4 projection name and the parameters,
 * which are written into the child element named by the projection (spaces replaced with underscores).
 *
 * @param name       value of <code>map_projection_name</code>; empty for unsupported projections.
 * @param parameters parameters in the order of writing.
 */
public record LabelProjection(String name, List<Parameter> parameters) {
    public static final String DEGREE = "deg";

    public LabelProjection {
        Objects.requireNonNull(name, "Null name");
        parameters = List.copyOf(Objects.requireNonNull(parameters, "Null parameters"));
    }

    public String parametersElementName() {
        return name.replace(' ', '_');
    }

    public boolean isEmpty() {
        return name.isEmpty();
    }

    public static LabelProjection empty() {
        return new LabelProjection("", List.of());
    }

    public static Builder newBuilder(String name) {
        return new Builder(name);
    }

    /**
     * Numeric parameter or a group of parameters.
     *
     * @param name     element name.
     * @param value    value of a numeric parameter, <code>NaN</code> for a group.
     * @param unit     unit attribute or <code>null</code>.
     * @param children members of a group; empty for a numeric parameter.
     */
    public record Parameter(String name, double value, String unit, List<Parameter> children) {
        public Parameter {
            Objects.requireNonNull(name, "Null name");
            children = List.copyOf(Objects.requireNonNull(children, "Null children"));
        }

        public boolean isGroup() {
            return !children.isEmpty();
        }

        public static Parameter angle(String name, double value) {
            return new Parameter(name, value, DEGREE, List.of());
        }

        public static Parameter scale(String name, double value) {
            return new Parameter(name, value, null, List.of());
        }

        public static Parameter group(String name, Parameter... children) {
            return new Parameter(name, Double.NaN, null, List.of(children));
        }
    }

    public static final class Builder {
        private final String name;
        private final List<Parameter> parameters = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Null name");
        }

        public Builder angle(String name, double value) {
            parameters.add(Parameter.angle(name, value));
            return this;
        }

        public Builder scale(String name, double value) {
            parameters.add(Parameter.scale(name, value));
            return this;
        }

        public Builder group(String name, Parameter... children) {
            parameters.add(Parameter.group(name, children));
            return this;
        }

        public LabelProjection build() {
            return new LabelProjection(name, parameters);
        }
    }
}
