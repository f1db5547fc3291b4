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

import net.algart.matrices.pds4.Pds4Exception;
import net.algart.matrices.pds4.Pds4Warnings;
import net.algart.matrices.pds4.label.LabelTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SpecialConstantsTest {
    @Test
    void readsConstantsInDeclarationOrder() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse("""
                <Special_Constants>
                  <invalid_constant>-3</invalid_constant>
                  <missing_constant>-1</missing_constant>
                  <saturated_constant>255</saturated_constant>
                </Special_Constants>""");
        final Pds4Warnings warnings = new Pds4Warnings();
        final SpecialConstants constants = SpecialConstants.read(tree, tree.rootElement(), "array", warnings);
        assertTrue(warnings.isEmpty());
        assertEquals(3, constants.size());
        assertEquals(-1.0, constants.noDataValue().orElseThrow());
        assertEquals(List.of(255.0, -1.0, -3.0), constants.maskValues());
    }

    @Test
    void invalidNumberIsSkippedWithWarning() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse("""
                <Special_Constants>
                  <missing_constant>none</missing_constant>
                  <error_constant>7</error_constant>
                </Special_Constants>""");
        final Pds4Warnings warnings = new Pds4Warnings();
        final SpecialConstants constants = SpecialConstants.read(tree, tree.rootElement(), "array", warnings);
        assertTrue(warnings.contains("missing_constant"), warnings.toString());
        assertTrue(constants.noDataValue().isEmpty());
        assertEquals(7.0, constants.get(SpecialConstantKind.ERROR).orElseThrow());
    }

    @Test
    void absentElementGivesEmptyConstants() {
        final SpecialConstants constants = SpecialConstants.read(
                LabelTree.newDocument(), LabelTree.NONE, "array", new Pds4Warnings());
        assertTrue(constants.isEmpty());
        assertFalse(constants.requiresMask(false, false));
    }

    @Test
    void maskPolicy() {
        final SpecialConstants onlyMissing = SpecialConstants.of(Map.of(SpecialConstantKind.MISSING, 0.0));
        final SpecialConstants onlySaturated = SpecialConstants.of(Map.of(SpecialConstantKind.SATURATED, 255.0));
        final SpecialConstants two = onlySaturated.withNoDataValue(0.0);

        assertFalse(onlyMissing.requiresMask(false, false));
        assertTrue(onlyMissing.requiresMask(false, true));
        assertTrue(onlySaturated.requiresMask(false, false));
        assertTrue(two.requiresMask(false, false));
        assertFalse(two.requiresMask(true, false));
        assertFalse(two.requiresMask(true, true));
        assertTrue(SpecialConstants.empty().requiresMask(false, true));
    }

    @Test
    void withNoDataValueReplacesMissing() {
        final SpecialConstants constants = SpecialConstants.of(Map.of(SpecialConstantKind.MISSING, 1.0))
                .withNoDataValue(-9999.0);
        assertEquals(1, constants.size());
        assertEquals(-9999.0, constants.noDataValue().orElseThrow());
    }
}
