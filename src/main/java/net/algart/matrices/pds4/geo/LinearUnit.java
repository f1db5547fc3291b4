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

import java.util.Optional;

/**
 * Units of length, allowed in PDS4 labels. The canonical unit is meter.
 */
public enum LinearUnit {
    METER("m", 1.0),
    ASTRONOMICAL_UNIT("AU", 149597870700.0),
    ANGSTROM("Angstrom", 1e-10),
    CENTIMETER("cm", 1e-2),
    KILOMETER("km", 1e3),
    MICROMETER("micrometer", 1e-6),
    MILLIMETER("mm", 1e-3),
    NANOMETER("nm", 1e-9);

    private final String unitName;
    private final double toMeters;

    LinearUnit(String unitName, double toMeters) {
        this.unitName = unitName;
        this.toMeters = toMeters;
    }

    public String unitName() {
        return unitName;
    }

    public double toMeters(double value) {
        return value * toMeters;
    }

    public static Optional<LinearUnit> fromName(String unitName) {
        for (LinearUnit unit : values()) {
            if (unit.unitName.equalsIgnoreCase(unitName)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }
}
