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

import net.algart.matrices.pds4.Pds4Exception;
import net.algart.matrices.pds4.Pds4Warnings;
import net.algart.matrices.pds4.label.LabelTree;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class UnitsTest {
    @Test
    void canonicalUnitsAreIdentity() {
        assertEquals(12.5, LinearUnit.METER.toMeters(12.5));
        assertEquals(12.5, AngularUnit.DEGREE.toDegrees(12.5));
        assertEquals(12.5, ResolutionUnit.METER_PER_PIXEL.toMetersPerPixel(12.5));
    }

    @Test
    void unitLookupIgnoresCase() {
        assertEquals(LinearUnit.KILOMETER, LinearUnit.fromName("KM").orElseThrow());
        assertEquals(AngularUnit.RADIAN, AngularUnit.fromName("rad").orElseThrow());
        assertEquals(ResolutionUnit.KILOMETER_PER_PIXEL, ResolutionUnit.fromName("km/pixel").orElseThrow());
        assertTrue(LinearUnit.fromName("furlong").isEmpty());
    }

    @Test
    void conversions() {
        assertEquals(3396190.0, LinearUnit.KILOMETER.toMeters(3396.19), 1e-6);
        assertEquals(180.0, AngularUnit.RADIAN.toDegrees(Math.PI), 1e-12);
        assertEquals(0.5, AngularUnit.ARC_MINUTE.toDegrees(30.0), 1e-15);
        assertEquals(250.0, ResolutionUnit.KILOMETER_PER_PIXEL.toMetersPerPixel(0.25), 1e-12);
    }

    @Test
    void labelQuantitiesConvertAndWarn() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse("""
                <a>
                  <radius unit="km">2</radius>
                  <plain>7</plain>
                  <angle unit="rad">0</angle>
                  <strange unit="furlong">3</strange>
                  <bad>x</bad>
                  <resolution unit="mm/pixel">500</resolution>
                </a>""");
        final Pds4Warnings warnings = new Pds4Warnings();
        final LabelQuantities quantities = new LabelQuantities(tree, warnings);
        final int a = tree.rootElement();
        assertEquals(2000.0, quantities.linear(a, "radius"));
        assertEquals(7.0, quantities.linear(a, "plain"));
        assertEquals(0.0, quantities.linear(a, "absent"));
        assertEquals(0.0, quantities.angular(a, "angle").orElseThrow());
        assertTrue(quantities.angular(a, "absent").isEmpty());
        assertEquals(0.5, quantities.resolution(a, "resolution"), 1e-12);
        assertTrue(warnings.isEmpty());

        assertEquals(3.0, quantities.linear(a, "strange"));
        assertTrue(warnings.contains("Unknown unit 'furlong'"), warnings.toString());
        assertEquals(0.0, quantities.linear(a, "bad"));
        assertTrue(warnings.contains("Invalid numeric value 'x'"), warnings.toString());
        assertEquals(-1.0, quantities.number(a, "absent", -1.0));
    }
}
