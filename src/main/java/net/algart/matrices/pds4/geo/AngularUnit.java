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
 * Units of angles, allowed in PDS4 labels. The canonical unit is degree.
 */
public enum AngularUnit {
    DEGREE("deg", 1.0),
    ARC_MINUTE("arcmin", 1.0 / 60.0),
    ARC_SECOND("arcsec", 1.0 / 3600.0),
    HOUR("hr", 15.0),
    MILLIRADIAN("mrad", 180.0 / Math.PI / 1000.0),
    RADIAN("rad", 180.0 / Math.PI);

    private final String unitName;
    private final double toDegrees;

    AngularUnit(String unitName, double toDegrees) {
        this.unitName = unitName;
        this.toDegrees = toDegrees;
    }

    public String unitName() {
        return unitName;
    }

    public double toDegrees(double value) {
        return value * toDegrees;
    }

    public static Optional<AngularUnit> fromName(String unitName) {
        for (AngularUnit unit : values()) {
            if (unit.unitName.equalsIgnoreCase(unitName)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }
}
