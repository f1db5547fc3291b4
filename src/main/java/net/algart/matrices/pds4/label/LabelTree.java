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
import net.algart.matrices.pds4.Pds4Tools;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable XML tree of a PDS4 label.
 *
 * <p>All nodes are stored in an arena and addressed by <code>int</code> indexes;
 * children of every node are stored as a list of indexes. A node, {@link #detach(int) detached}
 * from its parent, stays in the arena and can be inserted into another place of the same tree.
 * Node 0 is always the {@link LabelNodeKind#DOCUMENT document} node.
 *
 * <p>Paths, used by {@link #find(int, String)} and {@link #value(int, String, String)},
 * consist of element or attribute names, separated by dots; the first component may start with
 * <code>=</code>, meaning that the start node itself must have this name.
 *
 * <p>This class is not thread-safe.
 */
public final class LabelTree {
    public static final int NONE = -1;

    private static final String INDENT = "  ";
    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";
    private static final String INDENT_AMOUNT_PROPERTY = "{http://xml.apache.org/xslt}indent-amount";

    private final List<LabelNodeKind> kinds = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private final List<String> texts = new ArrayList<>();
    private final List<Integer> parents = new ArrayList<>();
    private final List<List<Integer>> children = new ArrayList<>();

    private LabelTree() {
        newNode(LabelNodeKind.DOCUMENT, null, null);
    }

    public static LabelTree newDocument() {
        return new LabelTree();
    }

    public static LabelTree parse(Path file) throws IOException {
        Objects.requireNonNull(file, "Null file");
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static LabelTree parse(String xml) throws Pds4Exception {
        Objects.requireNonNull(xml, "Null xml");
        final Document document;
        try {
            final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            final DocumentBuilder builder = factory.newDocumentBuilder();
            document = builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new Pds4Exception("Cannot parse XML label: " + e.getMessage(), e);
        }
        document.normalize();
        final LabelTree result = new LabelTree();
        final NodeList nodes = document.getChildNodes();
        for (int k = 0, n = nodes.getLength(); k < n; k++) {
            result.importNode(0, nodes.item(k));
        }
        return result;
    }

    public int document() {
        return 0;
    }

    /**
     * Returns the first element child of the document or {@link #NONE}.
     *
     * @return index of the root element.
     */
    public int rootElement() {
        for (int child : children.get(0)) {
            if (kinds.get(child) == LabelNodeKind.ELEMENT) {
                return child;
            }
        }
        return NONE;
    }

    public int size() {
        return kinds.size();
    }

    public LabelNodeKind kind(int node) {
        return kinds.get(checkNode(node));
    }

    public String name(int node) {
        return names.get(checkNode(node));
    }

    public void setName(int node, String name) {
        Objects.requireNonNull(name, "Null name");
        if (!kinds.get(checkNode(node)).isNamed()) {
            throw new IllegalArgumentException("Node " + node + " (" + kinds.get(node) + ") has no name");
        }
        names.set(node, name);
    }

    /**
     * Returns the content of a text, comment or processing instruction node, <code>null</code> for others.
     *
     * @param node index of the node.
     * @return its text content.
     */
    public String text(int node) {
        return texts.get(checkNode(node));
    }

    public void setText(int node, String text) {
        Objects.requireNonNull(text, "Null text");
        final LabelNodeKind kind = kinds.get(checkNode(node));
        if (kind == LabelNodeKind.ELEMENT || kind == LabelNodeKind.ATTRIBUTE) {
            // replacing all content by a single text
            for (int child : new ArrayList<>(children.get(node))) {
                if (kinds.get(child) != LabelNodeKind.ATTRIBUTE) {
                    detach(child);
                }
            }
            addText(node, text);
            return;
        }
        if (kind == LabelNodeKind.DOCUMENT) {
            throw new IllegalArgumentException("Document node cannot contain text");
        }
        texts.set(node, text);
    }

    public int parent(int node) {
        return parents.get(checkNode(node));
    }

    public List<Integer> children(int node) {
        return Collections.unmodifiableList(children.get(checkNode(node)));
    }

    public List<Integer> childElements(int node) {
        final List<Integer> result = new ArrayList<>();
        for (int child : children.get(checkNode(node))) {
            if (kinds.get(child) == LabelNodeKind.ELEMENT) {
                result.add(child);
            }
        }
        return result;
    }

    public List<Integer> childElements(int node, String name) {
        Objects.requireNonNull(name, "Null name");
        final List<Integer> result = new ArrayList<>();
        for (int child : childElements(node)) {
            if (names.get(child).equals(name)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Returns the first element or attribute child with the given name, or {@link #NONE}.
     *
     * @param node parent node.
     * @param name required name.
     * @return found child.
     */
    public int findChild(int node, String name) {
        Objects.requireNonNull(name, "Null name");
        for (int child : children.get(checkNode(node))) {
            final LabelNodeKind kind = kinds.get(child);
            if ((kind == LabelNodeKind.ELEMENT || kind == LabelNodeKind.ATTRIBUTE)
                    && names.get(child).equals(name)) {
                return child;
            }
        }
        return NONE;
    }

    public int find(int node, String path) {
        Objects.requireNonNull(path, "Null path");
        if (node == NONE) {
            return NONE;
        }
        checkNode(node);
        String rest = path;
        if (rest.startsWith("=")) {
            final int p = rest.indexOf('.');
            final String selfName = p >= 0 ? rest.substring(1, p) : rest.substring(1);
            if (node == 0) {
                node = findChild(0, selfName);
                if (node == NONE) {
                    return NONE;
                }
            } else if (!selfName.equals(names.get(node))) {
                return NONE;
            }
            rest = p >= 0 ? rest.substring(p + 1) : "";
        }
        if (rest.isEmpty()) {
            return node;
        }
        for (String component : rest.split("\\.")) {
            node = findChild(node, component);
            if (node == NONE) {
                return NONE;
            }
        }
        return node;
    }

    public String value(int node, String path, String defaultValue) {
        final int found = node == NONE ? NONE : find(node, path);
        if (found == NONE) {
            return defaultValue;
        }
        if (kinds.get(found) == LabelNodeKind.TEXT) {
            return texts.get(found);
        }
        for (int child : children.get(found)) {
            if (kinds.get(child) == LabelNodeKind.TEXT) {
                return texts.get(child);
            }
        }
        return defaultValue;
    }

    public String value(int node, String defaultValue) {
        return value(node, "", defaultValue);
    }

    public int addElement(int parent, String name) {
        Objects.requireNonNull(name, "Null name");
        return addChild(parent, newNode(LabelNodeKind.ELEMENT, name, null));
    }

    public int addElement(int parent, String name, String text) {
        final int result = addElement(parent, name);
        addText(result, text);
        return result;
    }

    public int addText(int parent, String text) {
        Objects.requireNonNull(text, "Null text");
        return addChild(parent, newNode(LabelNodeKind.TEXT, null, text));
    }

    public int addComment(int parent, String text) {
        Objects.requireNonNull(text, "Null text");
        return addChild(parent, newNode(LabelNodeKind.COMMENT, null, text));
    }

    /**
     * Sets the attribute value, adding the attribute after the existing ones if it does not exist yet.
     *
     * @param element element node.
     * @param name    attribute name.
     * @param value   new value.
     * @return index of the attribute node.
     */
    public int setAttribute(int element, String name, String value) {
        Objects.requireNonNull(name, "Null name");
        Objects.requireNonNull(value, "Null value");
        if (kinds.get(checkNode(element)) != LabelNodeKind.ELEMENT) {
            throw new IllegalArgumentException("Node " + element + " is not an element");
        }
        int attribute = NONE;
        int position = 0;
        final List<Integer> list = children.get(element);
        for (int i = 0; i < list.size(); i++) {
            final int child = list.get(i);
            if (kinds.get(child) == LabelNodeKind.ATTRIBUTE) {
                position = i + 1;
                if (names.get(child).equals(name)) {
                    attribute = child;
                }
            }
        }
        if (attribute == NONE) {
            attribute = newNode(LabelNodeKind.ATTRIBUTE, name, null);
            insertChild(element, position, attribute);
        }
        setText(attribute, value);
        return attribute;
    }

    public void insertChild(int parent, int index, int child) {
        checkNode(parent);
        requireDetached(child);
        final List<Integer> list = children.get(parent);
        if (index < 0 || index > list.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " is out of range 0.." + list.size());
        }
        list.add(index, child);
        parents.set(child, parent);
    }

    public void insertAfter(int sibling, int node) {
        final int parent = parent(sibling);
        if (parent == NONE) {
            throw new IllegalArgumentException("Node " + sibling + " is detached");
        }
        insertChild(parent, children.get(parent).indexOf(sibling) + 1, node);
    }

    public int appendChild(int parent, int child) {
        insertChild(parent, children.get(checkNode(parent)).size(), child);
        return child;
    }

    public void detach(int node) {
        final int parent = parent(node);
        if (parent == NONE) {
            return;
        }
        children.get(parent).remove(Integer.valueOf(node));
        parents.set(node, NONE);
    }

    public void removeChildElements(int node) {
        for (int child : new ArrayList<>(children.get(checkNode(node)))) {
            if (kinds.get(child) != LabelNodeKind.ATTRIBUTE) {
                detach(child);
            }
        }
    }

    /**
     * Copies a subtree of another (or this) tree into this tree. The copy is detached.
     *
     * @param source     source tree.
     * @param sourceNode root of the copied subtree in the source tree.
     * @return index of the copy in this tree.
     */
    public int copyFrom(LabelTree source, int sourceNode) {
        Objects.requireNonNull(source, "Null source");
        final LabelNodeKind kind = source.kind(sourceNode);
        if (kind == LabelNodeKind.DOCUMENT) {
            throw new IllegalArgumentException("Document node cannot be copied");
        }
        final int result = newNode(kind, source.names.get(sourceNode), source.texts.get(sourceNode));
        for (int child : new ArrayList<>(source.children.get(sourceNode))) {
            appendChild(result, copyFrom(source, child));
        }
        return result;
    }

    public LabelTree copy() {
        final LabelTree result = new LabelTree();
        for (int child : children.get(0)) {
            result.appendChild(0, result.copyFrom(this, child));
        }
        return result;
    }

    /**
     * Removes namespace prefixes from all element and attribute names, reachable from the document.
     */
    public void stripNamespaces() {
        stripNamespaces(0);
    }

    public String toXml() throws Pds4Exception {
        final StringWriter writer = new StringWriter();
        writer.write(XML_DECLARATION);
        try {
            final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            final Document document = factory.newDocumentBuilder().newDocument();
            document.setXmlStandalone(true);
            for (int child : children.get(0)) {
                exportNode(document, document, child);
            }
            final TransformerFactory transformerFactory = TransformerFactory.newInstance();
            transformerFactory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            final Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty(INDENT_AMOUNT_PROPERTY, String.valueOf(INDENT.length()));
            transformer.transform(new DOMSource(document), new StreamResult(writer));
        } catch (ParserConfigurationException | TransformerException e) {
            throw new Pds4Exception("Cannot serialize XML label: " + e.getMessage(), e);
        }
        return writer.toString();
    }

    @Override
    public String toString() {
        return "label tree with " + size() + " nodes, root element "
                + (rootElement() == NONE ? "absent" : names.get(rootElement()));
    }

    private void stripNamespaces(int node) {
        final LabelNodeKind kind = kinds.get(node);
        if (kind == LabelNodeKind.ELEMENT || kind == LabelNodeKind.ATTRIBUTE) {
            names.set(node, Pds4Tools.removePrefix(names.get(node)));
        }
        for (int child : children.get(node)) {
            stripNamespaces(child);
        }
    }

    private void importNode(int parent, Node node) {
        switch (node.getNodeType()) {
            case Node.ELEMENT_NODE -> {
                final int element = addElement(parent, node.getNodeName());
                final NamedNodeMap attributes = node.getAttributes();
                for (int k = 0, n = attributes.getLength(); k < n; k++) {
                    final Node a = attributes.item(k);
                    setAttribute(element, a.getNodeName(), a.getNodeValue());
                }
                final NodeList nodes = node.getChildNodes();
                for (int k = 0, n = nodes.getLength(); k < n; k++) {
                    importNode(element, nodes.item(k));
                }
            }
            case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> {
                final String text = node.getNodeValue();
                if (!text.isBlank()) {
                    addText(parent, text);
                }
            }
            case Node.COMMENT_NODE -> addComment(parent, node.getNodeValue());
            case Node.PROCESSING_INSTRUCTION_NODE -> addChild(parent,
                    newNode(LabelNodeKind.PROCESSING_INSTRUCTION, node.getNodeName(), node.getNodeValue()));
            default -> {
                // document type and entity nodes are not a part of the label
            }
        }
    }

    private void exportNode(Document document, Node parent, int node) {
        switch (kinds.get(node)) {
            case TEXT -> parent.appendChild(document.createTextNode(texts.get(node)));
            case COMMENT -> parent.appendChild(document.createComment(commentText(texts.get(node))));
            case PROCESSING_INSTRUCTION -> parent.appendChild(
                    document.createProcessingInstruction(names.get(node), texts.get(node)));
            case ELEMENT -> {
                final Element element = document.createElement(names.get(node));
                for (int child : children.get(node)) {
                    if (kinds.get(child) == LabelNodeKind.ATTRIBUTE) {
                        element.setAttribute(names.get(child), value(child, ""));
                    } else {
                        exportNode(document, element, child);
                    }
                }
                parent.appendChild(element);
            }
            default -> throw new AssertionError("Unexpected node " + kinds.get(node));
        }
    }

    private int newNode(LabelNodeKind kind, String name, String text) {
        kinds.add(kind);
        names.add(name);
        texts.add(text);
        parents.add(NONE);
        children.add(new ArrayList<>());
        return kinds.size() - 1;
    }

    private int addChild(int parent, int child) {
        final LabelNodeKind parentKind = kinds.get(checkNode(parent));
        if (parentKind != LabelNodeKind.ELEMENT && parentKind != LabelNodeKind.DOCUMENT
                && parentKind != LabelNodeKind.ATTRIBUTE) {
            throw new IllegalArgumentException("Node " + parent + " (" + parentKind + ") cannot have children");
        }
        return appendChild(parent, child);
    }

    private void requireDetached(int node) {
        if (parents.get(checkNode(node)) != NONE || node == 0) {
            throw new IllegalArgumentException("Node " + node + " is already attached to the tree");
        }
    }

    private int checkNode(int node) {
        if (node < 0 || node >= kinds.size()) {
            throw new IndexOutOfBoundsException("Node index " + node + " is out of range 0.."
                    + (kinds.size() - 1));
        }
        return node;
    }

    // "--" is not allowed inside XML comments, and a comment cannot end with "-"
    private static String commentText(String text) {
        String result = text;
        while (result.contains("--")) {
            result = result.replace("--", "- -");
        }
        return result.endsWith("-") ? result + " " : result;
    }
}
