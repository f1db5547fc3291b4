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

import java.util.Optional;

/**
 * Kinds of sentinel values in <code>Special_Constants</code> element, in the order of their declaration
 * in PDS4 schema. This order is also the order of the candidate mask values.
 */
public enum SpecialConstantKind {
    SATURATED("saturated_constant"),
    MISSING("missing_constant"),
    ERROR("error_constant"),
    INVALID("invalid_constant"),
    UNKNOWN("unknown_constant"),
    NOT_APPLICABLE("not_applicable_constant"),
    HIGH_INSTRUMENT_SATURATION("high_instrument_saturation"),
    HIGH_REPRESENTATION_SATURATION("high_representation_saturation"),
    LOW_INSTRUMENT_SATURATION("low_instrument_saturation"),
    LOW_REPRESENTATION_SATURATION("low_representation_saturation");

    private final String elementName;

    SpecialConstantKind(String elementName) {
        this.elementName = elementName;
    }

    public String elementName() {
        return elementName;
    }

    public static Optional<SpecialConstantKind> fromElementName(String elementName) {
        for (SpecialConstantKind kind : values()) {
            if (kind.elementName.equals(elementName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
