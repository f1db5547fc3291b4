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

import net.algart.matrices.pds4.layout.Pds4Interleave;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class Pds4CreationOptionsTest {
    @Test
    void defaults() {
        final Pds4CreationOptions options = new Pds4CreationOptions();
        assertEquals(Pds4Interleave.BSQ, options.getInterleave());
        assertEquals("img", options.getImageExtension());
        assertTrue(options.getImageFileName().isEmpty());
        assertTrue(options.isUseSourceLabel());
        assertEquals("Array_3D_Image", options.getArrayType());
        assertFalse(options.isArray2D());
        assertTrue(options.getRadii().isEmpty());
    }

    @Test
    void parsesMapWithCaseInsensitiveKeys() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("interleave", "bil");
        map.put("IMAGE_FILENAME", "data.dat");
        map.put("Use_Src_Label", "NO");
        map.put("RADII", "3396190, 3376200");
        map.put("BOUNDING_DEGREES", "-10,-5,10,5");
        map.put("ARRAY_TYPE", "Array_2D_Image");
        map.put("TEMPLATE", "template.xml");
        map.put("var_target", "Mars");
        map.put("SOMETHING_ELSE", "ignored");
        final Pds4CreationOptions options = Pds4CreationOptions.fromMap(map);
        assertEquals(Pds4Interleave.BIL, options.getInterleave());
        assertEquals("data.dat", options.getImageFileName().orElseThrow());
        assertFalse(options.isUseSourceLabel());
        assertArrayEquals(new double[]{3396190, 3376200}, options.getRadii().orElseThrow());
        assertArrayEquals(new double[]{-10, -5, 10, 5}, options.getBoundingDegrees().orElseThrow());
        assertTrue(options.isArray2D());
        assertEquals(Path.of("template.xml"), options.getTemplate().orElseThrow());
        assertEquals(Map.of("VAR_TARGET", "Mars"), options.getVariables());
        assertEquals("Mars", options.getVariable("target").orElseThrow());
    }

    @Test
    void malformedValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Pds4CreationOptions.fromMap(Map.of("RADII", "1")));
        assertThrows(IllegalArgumentException.class,
                () -> Pds4CreationOptions.fromMap(Map.of("BOUNDING_DEGREES", "1,2,x,4")));
        assertThrows(IllegalArgumentException.class,
                () -> Pds4CreationOptions.fromMap(Map.of("USE_SRC_LABEL", "maybe")));
        assertThrows(IllegalArgumentException.class,
                () -> Pds4CreationOptions.fromMap(Map.of("INTERLEAVE", "XYZ")));
    }

    @Test
    void copyIsIndependent() {
        final Pds4CreationOptions options = new Pds4CreationOptions().setVariable("TITLE", "a");
        final Pds4CreationOptions copy = options.copy().setVariable("VAR_TITLE", "b");
        assertEquals("a", options.getVariable("TITLE").orElseThrow());
        assertEquals("b", copy.getVariable("title").orElseThrow());
    }
}
