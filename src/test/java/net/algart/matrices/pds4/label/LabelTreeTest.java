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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class LabelTreeTest {
    private static final String LABEL = """
            <?xml version="1.0" encoding="UTF-8"?>
            <pds:Product_Observational xmlns:pds="http://pds.nasa.gov/pds4/pds/v1">
              <pds:Identification_Area>
                <pds:title>Test</pds:title>
              </pds:Identification_Area>
              <!-- comment -->
              <pds:File_Area_Observational>
                <pds:File><pds:file_name>a.img</pds:file_name></pds:File>
                <pds:Array_2D_Image><pds:offset unit="byte">0</pds:offset></pds:Array_2D_Image>
                <pds:Array_2D_Image><pds:offset unit="byte">100</pds:offset></pds:Array_2D_Image>
              </pds:File_Area_Observational>
            </pds:Product_Observational>
            """;

    @Test
    void findsByDottedPath() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse(LABEL);
        tree.stripNamespaces();
        final int root = tree.rootElement();
        assertEquals("Product_Observational", tree.name(root));
        assertEquals("Test", tree.value(root, "Identification_Area.title", null));
        assertEquals("a.img", tree.value(root, "File_Area_Observational.File.file_name", null));
        assertEquals(root, tree.find(tree.document(), "=Product_Observational"));
        assertEquals(LabelTree.NONE, tree.find(root, "=Other"));
        assertEquals(LabelTree.NONE, tree.find(root, "Identification_Area.absent"));
        assertEquals("default", tree.value(root, "Identification_Area.absent", "default"));
    }

    @Test
    void attributesAreChildren() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse(LABEL);
        tree.stripNamespaces();
        final int fileArea = tree.find(tree.rootElement(), "File_Area_Observational");
        final List<Integer> arrays = tree.childElements(fileArea, "Array_2D_Image");
        assertEquals(2, arrays.size());
        assertEquals("byte", tree.value(arrays.get(1), "offset.unit", null));
        assertEquals("100", tree.value(arrays.get(1), "offset", null));
        assertEquals(3, tree.childElements(fileArea).size());
    }

    @Test
    void setAttributeReplacesOrAppends() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse("<a x=\"1\"><b/></a>");
        final int a = tree.rootElement();
        tree.setAttribute(a, "x", "2");
        tree.setAttribute(a, "y", "3");
        assertEquals("2", tree.value(a, "x", null));
        assertEquals("3", tree.value(a, "y", null));
        final List<Integer> children = tree.children(a);
        assertEquals(LabelNodeKind.ATTRIBUTE, tree.kind(children.get(0)));
        assertEquals(LabelNodeKind.ATTRIBUTE, tree.kind(children.get(1)));
        assertEquals(LabelNodeKind.ELEMENT, tree.kind(children.get(2)));
    }

    @Test
    void removeChildElementsKeepsAttributes() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse("<a x=\"1\"><b/>text<c/></a>");
        final int a = tree.rootElement();
        tree.removeChildElements(a);
        assertEquals(1, tree.children(a).size());
        assertEquals("1", tree.value(a, "x", null));
    }

    @Test
    void attachedNodeCannotBeInsertedTwice() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse("<a><b/><c/></a>");
        final int a = tree.rootElement();
        final int b = tree.findChild(a, "b");
        final int c = tree.findChild(a, "c");
        assertThrows(IllegalArgumentException.class, () -> tree.insertAfter(c, b));
        tree.detach(b);
        tree.insertAfter(c, b);
        assertEquals(List.of(c, b), tree.childElements(a));
    }

    @Test
    void copyIsIndependent() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse("<a><b>1</b></a>");
        final LabelTree copy = tree.copy();
        final int b = copy.find(copy.rootElement(), "b");
        copy.setText(b, "2");
        assertEquals("1", tree.value(tree.rootElement(), "b", null));
        assertEquals("2", copy.value(copy.rootElement(), "b", null));
    }

    @Test
    void serializesAndParsesBack() throws Pds4Exception {
        final LabelTree tree = LabelTree.newDocument();
        final int root = tree.addElement(tree.document(), "Product_Observational");
        tree.setAttribute(root, "xmlns", "http://pds.nasa.gov/pds4/pds/v1");
        tree.addComment(root, " generated ");
        tree.addElement(root, "title", "A & B <test>");
        final String xml = tree.toXml();
        assertTrue(xml.contains("<title>A &amp; B &lt;test&gt;</title>"), xml);
        assertTrue(xml.contains("<!-- generated -->"), xml);
        final LabelTree parsed = LabelTree.parse(xml);
        assertEquals("A & B <test>", parsed.value(parsed.rootElement(), "title", null));
        assertEquals("http://pds.nasa.gov/pds4/pds/v1", parsed.value(parsed.rootElement(), "xmlns", null));
    }

    @Test
    void specialCharactersSurviveSerialization() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse(
                "<?xml-model href=\"PDS4_PDS_1G00.sch\"?><Product_Observational/>");
        final int root = tree.rootElement();
        tree.setAttribute(root, "note", "line 1\nline 2\t\"quoted\" & <more>");
        tree.addComment(root, "options: --verbose -");
        tree.addElement(root, "title", "x > 1");
        final String xml = tree.toXml();
        assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"), xml);
        assertTrue(xml.contains("<?xml-model href=\"PDS4_PDS_1G00.sch\"?>"), xml);
        assertTrue(xml.contains("&#10;"), xml);
        assertFalse(xml.contains("--verbose"), xml);
        final LabelTree parsed = LabelTree.parse(xml);
        final int parsedRoot = parsed.rootElement();
        assertEquals("Product_Observational", parsed.name(parsedRoot));
        assertEquals("line 1\nline 2\t\"quoted\" & <more>", parsed.value(parsedRoot, "note", null));
        assertEquals("x > 1", parsed.value(parsedRoot, "title", null));
        assertEquals(1, parsed.childElements(parsedRoot).size());
    }

    @Test
    void malformedXmlIsRejected() {
        assertThrows(Pds4Exception.class, () -> LabelTree.parse("<a><b></a>"));
    }
}
