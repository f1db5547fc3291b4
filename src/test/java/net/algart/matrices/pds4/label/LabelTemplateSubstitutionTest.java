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

package net.algart.matrices.pds4.label;

import net.algart.matrices.pds4.Pds4Exception;
import net.algart.matrices.pds4.Pds4Warnings;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class LabelTemplateSubstitutionTest {
    @Test
    void replacesBothSpellings() {
        final Pds4Warnings warnings = new Pds4Warnings();
        final LabelTemplateSubstitution substitution = new LabelTemplateSubstitution(
                Map.of("VAR_TARGET", "Mars", "VAR_TITLE", "Test"), "default", warnings);
        assertEquals("Mars Orbiter", substitution.substitute("${TARGET} Orbiter"));
        assertEquals("urn:mars", substitution.substitute("urn:${target}"));
        assertEquals("Test", substitution.substitute("${TITLE}"));
        assertTrue(warnings.isEmpty(), warnings.toString());
    }

    @Test
    void onlyVariablesAreUsed() {
        final Map<String, String> options = new LinkedHashMap<>();
        options.put("INTERLEAVE", "BSQ");
        options.put("var_X", "1");
        options.put("VAR_", "empty");
        final LabelTemplateSubstitution substitution = new LabelTemplateSubstitution(
                options, "default", new Pds4Warnings());
        assertEquals(Map.of("X", "1"), substitution.variables());
    }

    @Test
    void missingTitleUsesDefault() {
        final Pds4Warnings warnings = new Pds4Warnings();
        final LabelTemplateSubstitution substitution = new LabelTemplateSubstitution(Map.of(), "image", warnings);
        assertEquals("Title: image", substitution.substitute("Title: ${TITLE}"));
        assertTrue(warnings.contains("VAR_TITLE not defined. Using image by default"), warnings.toString());
    }

    @Test
    void titleVariableIsCaseInsensitive() {
        final Pds4Warnings warnings = new Pds4Warnings();
        final LabelTemplateSubstitution substitution = new LabelTemplateSubstitution(
                Map.of("VAR_title", "Crater"), "image", warnings);
        assertEquals("Title: Crater", substitution.substitute("Title: ${TITLE}"));
        assertEquals("Crater", substitution.substitute("${title}"));
        assertTrue(warnings.isEmpty(), warnings.toString());
    }

    @Test
    void unresolvedPlaceholderIsKeptWithWarning() {
        final Pds4Warnings warnings = new Pds4Warnings();
        final LabelTemplateSubstitution substitution = new LabelTemplateSubstitution(
                Map.of("VAR_TARGET", "Mars"), "image", warnings);
        assertEquals("Mars ${MISSION}", substitution.substitute("${TARGET} ${MISSION}"));
        assertTrue(warnings.contains("could not be substituted"), warnings.toString());
    }

    @Test
    void substitutesTextsAndAttributesOfSubtree() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse(
                "<a ref=\"${TARGET}\"><b>${TARGET} Orbiter</b><c>${target}</c><d>plain</d></a>");
        final Pds4Warnings warnings = new Pds4Warnings();
        new LabelTemplateSubstitution(Map.of("VAR_TARGET", "Mars", "VAR_TITLE", "t"), "x", warnings)
                .substitute(tree, tree.document());
        final int a = tree.rootElement();
        assertEquals("Mars", tree.value(a, "ref", null));
        assertEquals("Mars Orbiter", tree.value(a, "b", null));
        assertEquals("mars", tree.value(a, "c", null));
        assertEquals("plain", tree.value(a, "d", null));
        assertTrue(warnings.isEmpty());
    }
}
