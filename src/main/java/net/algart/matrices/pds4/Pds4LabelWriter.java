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

import net.algart.matrices.pds4.geo.GeoTransform;
import net.algart.matrices.pds4.geo.Pds4GeoreferencingWriter;
import net.algart.matrices.pds4.geo.SpatialReference;
import net.algart.matrices.pds4.label.LabelNodeKind;
import net.algart.matrices.pds4.label.LabelTemplateSubstitution;
import net.algart.matrices.pds4.label.LabelTree;
import net.algart.matrices.pds4.layout.AxisSpec;
import net.algart.matrices.pds4.layout.Pds4Interleave;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Builds the label of a new PDS4 product from a template.
 *
 * <p>The template is the file, specified by {@link Pds4CreationOptions#TEMPLATE} option, or the source label
 * (while copying another PDS4 product, if {@link Pds4CreationOptions#USE_SRC_LABEL} is set),
 * or the default template <code>pds4_template.xml</code>, built into this library.
 * Template variables are substituted, cartography is replaced by the georeferencing of the new product
 * (or removed, if there is no georeferencing), and all <code>File_Area_Observational</code> elements
 * are replaced by a single new file area, describing the new image file.
 */
public final class Pds4LabelWriter {
    public static final String DEFAULT_TEMPLATE_RESOURCE = "pds4_template.xml";
    public static final String CART_NAMESPACE = "http://pds.nasa.gov/pds4/cart/v1";
    public static final String CART_SCHEMA = "https://pds.nasa.gov/pds4/cart/v1/PDS4_CART_1700.xsd";

    private static final double EARTH_SEMI_MAJOR = 6378137.0;

    private final Pds4CreationOptions options;
    private final Pds4Warnings warnings;

    private String imageFileName = null;
    private int sizeX = 0;
    private int sizeY = 0;
    private int numberOfBands = 0;
    private Pds4DataType dataType = null;
    private Pds4Interleave interleave = Pds4Interleave.BSQ;
    private SpatialReference spatialReference = null;
    private GeoTransform geoTransform = null;
    private OptionalDouble noDataValue = OptionalDouble.empty();
    private double valueOffset = 0.0;
    private double valueScale = 1.0;
    private String sourceLabel = null;

    public Pds4LabelWriter(Pds4CreationOptions options, Pds4Warnings warnings) {
        this.options = Objects.requireNonNull(options, "Null options").copy();
        this.warnings = Objects.requireNonNull(warnings, "Null warnings");
    }

    public Pds4LabelWriter setImageFileName(String imageFileName) {
        this.imageFileName = Objects.requireNonNull(imageFileName, "Null imageFileName");
        return this;
    }

    public Pds4LabelWriter setArray(int sizeX, int sizeY, int numberOfBands, Pds4DataType dataType,
                                    Pds4Interleave interleave) {
        if (sizeX <= 0 || sizeY <= 0 || numberOfBands <= 0) {
            throw new IllegalArgumentException("Zero or negative array sizes " + sizeX + "x" + sizeY
                    + "x" + numberOfBands);
        }
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.numberOfBands = numberOfBands;
        this.dataType = Objects.requireNonNull(dataType, "Null dataType");
        this.interleave = Objects.requireNonNull(interleave, "Null interleave");
        return this;
    }

    public Pds4LabelWriter setSpatialReference(SpatialReference spatialReference) {
        this.spatialReference = spatialReference;
        return this;
    }

    public Pds4LabelWriter setGeoTransform(GeoTransform geoTransform) {
        this.geoTransform = geoTransform;
        return this;
    }

    public Pds4LabelWriter setNoDataValue(OptionalDouble noDataValue) {
        this.noDataValue = Objects.requireNonNull(noDataValue, "Null noDataValue");
        return this;
    }

    public Pds4LabelWriter setValueOffset(double valueOffset) {
        this.valueOffset = valueOffset;
        return this;
    }

    public Pds4LabelWriter setValueScale(double valueScale) {
        this.valueScale = valueScale;
        return this;
    }

    public Pds4LabelWriter setSourceLabel(String sourceLabel) {
        this.sourceLabel = sourceLabel;
        return this;
    }

    /**
     * Builds the label.
     *
     * @param title default value of <code>${TITLE}</code> variable: usually the label file name
     *              without extension.
     * @return new label.
     * @throws IOException in a case of I/O error while reading the template, or if the template is invalid.
     */
    public LabelTree build(String title) throws IOException {
        Objects.requireNonNull(title, "Null title");
        if (imageFileName == null || dataType == null) {
            throw new IllegalStateException("Image file name and array are not set");
        }
        final LabelTree tree = loadTemplate();
        String prefix = "";
        int product = tree.find(tree.document(), "=Product_Observational");
        if (product == LabelTree.NONE) {
            product = tree.find(tree.document(), "=pds:Product_Observational");
            prefix = "pds:";
        }
        if (product == LabelTree.NONE) {
            throw new Pds4Exception("Cannot find Product_Observational element in template");
        }
        final boolean georeferenced = spatialReference != null && !spatialReference.isEmpty()
                && geoTransform != null;
        if (spatialReference != null && !spatialReference.isEmpty()) {
            deriveTarget();
        }
        new LabelTemplateSubstitution(options.getVariables(), title, warnings).substitute(tree, product);

        int disciplineArea = tree.find(product, prefix + "Observation_Area." + prefix + "Discipline_Area");
        if (!georeferenced) {
            removeCartography(tree, disciplineArea);
        } else {
            if (disciplineArea == LabelTree.NONE) {
                disciplineArea = addDisciplineArea(tree, product, prefix);
            }
            final int cartography = findOrCreateCartography(tree, product, disciplineArea);
            final Pds4GeoreferencingWriter writer = new Pds4GeoreferencingWriter(warnings)
                    .setLatitudeType(options.getLatitudeType())
                    .setLongitudeDirection(options.getLongitudeDirection());
            options.getRadii().ifPresent(r -> writer.setRadii(r[0], r[1]));
            options.getBoundingDegrees().ifPresent(b -> writer.setBoundingDegrees(b[0], b[1], b[2], b[3]));
            writer.write(tree, cartography, spatialReference, geoTransform, sizeX, sizeY);
        }
        replaceFileArea(tree, product, prefix, disciplineArea);
        return tree;
    }

    private LabelTree loadTemplate() throws IOException {
        if (options.getTemplate().isPresent()) {
            return LabelTree.parse(options.getTemplate().get());
        }
        if (options.isUseSourceLabel() && sourceLabel != null) {
            return LabelTree.parse(sourceLabel);
        }
        try (InputStream stream = Pds4LabelWriter.class.getResourceAsStream(DEFAULT_TEMPLATE_RESOURCE)) {
            if (stream == null) {
                throw new Pds4Exception("Cannot find " + DEFAULT_TEMPLATE_RESOURCE
                        + " and TEMPLATE creation option not specified");
            }
            return LabelTree.parse(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    private void deriveTarget() {
        if (options.getVariable("TARGET").isPresent()) {
            return;
        }
        if (Math.abs(spatialReference.semiMajor() - EARTH_SEMI_MAJOR) < 0.001 * EARTH_SEMI_MAJOR) {
            options.setVariableIfAbsent("TARGET", "Earth");
            options.setVariable("TARGET_TYPE", "Planet");
        } else {
            spatialReference.datumName().ifPresent(datum ->
                    options.setVariableIfAbsent("TARGET", datum.startsWith("D_") ? datum.substring(2) : datum));
        }
    }

    private static void removeCartography(LabelTree tree, int disciplineArea) {
        if (disciplineArea == LabelTree.NONE) {
            return;
        }
        for (int child : tree.childElements(disciplineArea)) {
            final String name = tree.name(child);
            if (name.equals("Cartography") || name.equals("cart:Cartography")) {
                tree.detach(child);
                break;
            }
        }
    }

    private static int addDisciplineArea(LabelTree tree, int product, String prefix) throws Pds4Exception {
        final int targetIdentification = tree.find(product,
                prefix + "Observation_Area." + prefix + "Target_Identification");
        if (targetIdentification == LabelTree.NONE) {
            throw new Pds4Exception("Cannot find Target_Identification element in template");
        }
        final int result = tree.addElement(tree.parent(targetIdentification), prefix + "Discipline_Area");
        tree.detach(result);
        tree.insertAfter(targetIdentification, result);
        return result;
    }

    private static int findOrCreateCartography(LabelTree tree, int product, int disciplineArea) {
        int result = tree.findChild(disciplineArea, "cart:Cartography");
        if (result == LabelTree.NONE) {
            result = tree.findChild(disciplineArea, "Cartography");
        }
        if (result != LabelTree.NONE) {
            tree.removeChildElements(result);
            return result;
        }
        result = tree.addElement(disciplineArea, "cart:Cartography");
        if (tree.findChild(product, "xmlns:cart") == LabelTree.NONE) {
            tree.setAttribute(product, "xmlns:cart", CART_NAMESPACE);
            final String schemaLocation = tree.value(product, "xsi:schemaLocation", null);
            if (schemaLocation != null) {
                tree.setAttribute(product, "xsi:schemaLocation",
                        schemaLocation + " " + CART_NAMESPACE + " " + CART_SCHEMA);
            }
        }
        return result;
    }

    private void replaceFileArea(LabelTree tree, int product, String prefix, int disciplineArea)
            throws Pds4Exception {
        final String fileAreaName = prefix + "File_Area_Observational";
        int observationArea = LabelTree.NONE;
        int templateSpecialConstants = LabelTree.NONE;
        for (int child : tree.childElements(product)) {
            final String name = tree.name(child);
            if (name.equals(prefix + "Observation_Area")) {
                observationArea = child;
            } else if (name.equals(fileAreaName) || name.equals(prefix + "File_Area_Observational_Supplemental")) {
                if (name.equals(fileAreaName) && templateSpecialConstants == LabelTree.NONE) {
                    templateSpecialConstants = findSpecialConstants(tree, child, prefix);
                    if (templateSpecialConstants != LabelTree.NONE) {
                        tree.detach(templateSpecialConstants);
                    }
                }
                tree.detach(child);
            }
        }
        if (observationArea == LabelTree.NONE) {
            throw new Pds4Exception("Cannot find Observation_Area in template");
        }
        final List<Integer> siblings = tree.children(product);
        for (int k = siblings.indexOf(observationArea) + 1; k < siblings.size(); k++) {
            final LabelNodeKind kind = tree.kind(siblings.get(k));
            if (kind != LabelNodeKind.COMMENT && kind != LabelNodeKind.ATTRIBUTE) {
                throw new Pds4Exception("Unexpected content found after Observation_Area in template");
            }
        }

        final int fileArea = tree.addElement(product, fileAreaName);
        final int file = tree.addElement(fileArea, prefix + "File");
        tree.addElement(file, prefix + "file_name", imageFileName);
        final String arrayType = options.getArrayType();
        final boolean array2D = options.isArray2D();
        final int array = tree.addElement(fileArea, prefix + arrayType);
        tree.addElement(array, prefix + "local_identifier", tree.value(disciplineArea,
                "disp:Display_Settings.Local_Internal_Reference.local_identifier_reference", "image"));
        final int offset = tree.addElement(array, prefix + "offset", "0");
        tree.setAttribute(offset, "unit", "byte");
        tree.addElement(array, prefix + "axes", array2D ? "2" : "3");
        tree.addElement(array, prefix + "axis_index_order", Pds4ArrayScanner.LAST_INDEX_FASTEST);
        final int elementArray = tree.addElement(array, prefix + "Element_Array");
        tree.addElement(elementArray, prefix + "data_type", dataType.tag());
        if (valueScale != 1.0) {
            tree.addElement(elementArray, prefix + "scaling_factor", Pds4Tools.formatDouble(valueScale));
        }
        if (valueOffset != 0.0) {
            tree.addElement(elementArray, prefix + "value_offset", Pds4Tools.formatDouble(valueOffset));
        }
        for (AxisSpec axis : interleave.axes(sizeX, sizeY, numberOfBands, array2D)) {
            final int axisArray = tree.addElement(array, prefix + "Axis_Array");
            tree.addElement(axisArray, prefix + "axis_name", axis.role().axisName());
            tree.addElement(axisArray, prefix + "elements", String.valueOf(axis.elementCount()));
            tree.addElement(axisArray, prefix + "sequence_number", String.valueOf(axis.sequencePosition()));
        }
        addSpecialConstants(tree, array, prefix, templateSpecialConstants);
    }

    private void addSpecialConstants(LabelTree tree, int array, String prefix, int templateSpecialConstants) {
        if (templateSpecialConstants != LabelTree.NONE) {
            tree.appendChild(array, templateSpecialConstants);
            if (noDataValue.isEmpty()) {
                return;
            }
            final String value = Pds4Tools.formatDouble(noDataValue.getAsDouble());
            final int missing = tree.findChild(templateSpecialConstants, prefix + "missing_constant");
            if (missing != LabelTree.NONE) {
                tree.setText(missing, value);
                return;
            }
            final int newMissing = tree.addElement(templateSpecialConstants, prefix + "missing_constant", value);
            tree.detach(newMissing);
            final int saturated = tree.findChild(templateSpecialConstants, prefix + "saturated_constant");
            if (saturated != LabelTree.NONE) {
                tree.insertAfter(saturated, newMissing);
            } else {
                tree.insertChild(templateSpecialConstants, firstContentIndex(tree, templateSpecialConstants),
                        newMissing);
            }
        } else if (noDataValue.isPresent()) {
            final int specialConstants = tree.addElement(array, prefix + "Special_Constants");
            tree.addElement(specialConstants, prefix + "missing_constant",
                    Pds4Tools.formatDouble(noDataValue.getAsDouble()));
        }
    }

    private static int findSpecialConstants(LabelTree tree, int fileArea, String prefix) {
        for (int child : tree.childElements(fileArea)) {
            if (tree.name(child).startsWith(prefix + "Array")) {
                final int result = tree.findChild(child, prefix + "Special_Constants");
                if (result != LabelTree.NONE) {
                    return result;
                }
            }
        }
        return LabelTree.NONE;
    }

    private static int firstContentIndex(LabelTree tree, int element) {
        final List<Integer> children = tree.children(element);
        int result = 0;
        while (result < children.size()
                && tree.kind(children.get(result)) == LabelNodeKind.ATTRIBUTE) {
            result++;
        }
        return result;
    }
}
