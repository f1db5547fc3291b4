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

import net.algart.matrices.pds4.constants.SpecialConstants;
import net.algart.matrices.pds4.label.LabelTree;
import net.algart.matrices.pds4.layout.ArrayDescriptor;
import net.algart.matrices.pds4.layout.ArrayStatistics;
import net.algart.matrices.pds4.layout.AxisLayoutResolver;
import net.algart.matrices.pds4.layout.AxisRole;
import net.algart.matrices.pds4.layout.AxisSpec;
import net.algart.matrices.pds4.layout.LayoutPlan;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Walks <code>File_Area_Observational</code> elements of a PDS4 label and finds all arrays,
 * which can be read by this library.
 *
 * <p>Problems of a single array (unsupported axis order or data type, invalid axes, etc.) lead to skipping
 * this array with a warning; other arrays are still analysed. But an arithmetic overflow while calculating
 * strides aborts the whole scanning with {@link TooLargePds4ArrayException}.
 */
public final class Pds4ArrayScanner {
    public static final String PRODUCT_OBSERVATIONAL = "Product_Observational";
    public static final String FILE_AREA_OBSERVATIONAL = "File_Area_Observational";
    public static final String LAST_INDEX_FASTEST = "Last Index Fastest";
    public static final String BOTTOM_TO_TOP = "Bottom to Top";
    public static final String VERTICAL_DISPLAY_DIRECTION_PATH =
            "Observation_Area.Discipline_Area.Display_Settings.Display_Direction.vertical_display_direction";

    private static final System.Logger LOG = System.getLogger(Pds4ArrayScanner.class.getName());

    private final Pds4Warnings warnings;

    public Pds4ArrayScanner(Pds4Warnings warnings) {
        this.warnings = Objects.requireNonNull(warnings, "Null warnings");
    }

    /**
     * Result of scanning.
     *
     * @param candidates all arrays, matching the lookup, in the order of the label.
     * @param selected   the first of candidates, the image file of which exists.
     */
    public record Result(List<Pds4Array> candidates, Optional<Pds4Array> selected) {
        public Result {
            candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
            Objects.requireNonNull(selected, "Null selected");
        }
    }

    /**
     * Finds the <code>Product_Observational</code> element in the document.
     *
     * @param tree label tree with stripped namespaces.
     * @return product element.
     * @throws Pds4Exception if the root element is not an observational product.
     */
    public static int findProduct(LabelTree tree) throws Pds4Exception {
        Objects.requireNonNull(tree, "Null tree");
        final int product = tree.find(tree.document(), "=" + PRODUCT_OBSERVATIONAL);
        if (product == LabelTree.NONE) {
            throw new Pds4Exception("Not a PDS4 label: no root " + PRODUCT_OBSERVATIONAL + " element");
        }
        return product;
    }

    /**
     * Scans the product.
     *
     * @param tree            label tree with stripped namespaces.
     * @param product         <code>Product_Observational</code> element.
     * @param labelFile       path to the label; image files are resolved relative to its directory.
     * @param fileAreaLookup  1-based index of the required <code>File_Area_Observational</code>, or a value
     *                        &le;0 for any.
     * @param arrayLookup     1-based index of the required array inside the file area, or a value &le;0 for any.
     * @return found arrays.
     * @throws TooLargePds4ArrayException in a case of arithmetic overflow.
     */
    public Result scan(LabelTree tree, int product, Path labelFile, int fileAreaLookup, int arrayLookup)
            throws TooLargePds4ArrayException {
        Objects.requireNonNull(tree, "Null tree");
        Objects.requireNonNull(labelFile, "Null labelFile");
        final boolean bottomToTop = BOTTOM_TO_TOP.equalsIgnoreCase(
                tree.value(product, VERTICAL_DISPLAY_DIRECTION_PATH, "").trim());
        final Path directory = labelFile.toAbsolutePath().getParent();
        final List<Pds4Array> candidates = new ArrayList<>();
        Pds4Array selected = null;
        int fileAreaIndex = 0;
        for (int fileArea : tree.childElements(product, FILE_AREA_OBSERVATIONAL)) {
            fileAreaIndex++;
            final String fileName = tree.value(fileArea, "File.file_name", null);
            if (fileName == null) {
                LOG.log(System.Logger.Level.DEBUG, () -> "File_Area_Observational without File.file_name");
                continue;
            }
            if (fileAreaLookup > 0 && fileAreaLookup != fileAreaIndex) {
                continue;
            }
            int arrayIndex = 0;
            for (int array : tree.childElements(fileArea)) {
                final int dim = declaredDimensions(tree, array);
                if (dim == 0) {
                    continue;
                }
                arrayIndex++;
                if (arrayLookup > 0 && arrayLookup != arrayIndex) {
                    continue;
                }
                final String context = context(tree.name(array), fileAreaIndex, arrayIndex);
                final ArrayDescriptor descriptor = readArray(
                        tree, array, dim, fileAreaIndex, arrayIndex, fileName.trim(), context);
                if (descriptor == null) {
                    continue;
                }
                final LayoutPlan plan;
                try {
                    plan = AxisLayoutResolver.resolve(descriptor.axes(), descriptor.dataType().bytesPerSample(),
                            descriptor.baseOffset(), bottomToTop);
                } catch (TooLargePds4ArrayException e) {
                    throw e;
                } catch (Pds4Exception e) {
                    warnings.warn("%s: %s", context, e.getMessage());
                    continue;
                }
                final Path imageFile = directory == null ? Path.of(descriptor.fileName()) :
                        directory.resolve(descriptor.fileName());
                final Pds4Array result = new Pds4Array(descriptor, plan, labelFile, imageFile);
                candidates.add(result);
                if (selected == null) {
                    if (Files.isRegularFile(imageFile) && Files.isReadable(imageFile)) {
                        selected = result;
                    } else {
                        warnings.warn("%s: Cannot open %s", context, imageFile);
                    }
                }
            }
        }
        return new Result(candidates, Optional.ofNullable(selected));
    }

    private static int declaredDimensions(LabelTree tree, int array) {
        final String name = tree.name(array);
        if (name.startsWith("Array_1D")) {
            return 1;
        } else if (name.startsWith("Array_2D")) {
            return 2;
        } else if (name.startsWith("Array_3D")) {
            return 3;
        } else if (name.equals("Array")) {
            return parseInt(tree.value(array, "axes", "0"));
        } else {
            return 0;
        }
    }

    private ArrayDescriptor readArray(
            LabelTree tree,
            int array,
            int dim,
            int fileAreaIndex,
            int arrayIndex,
            String fileName,
            String context) {
        final String elementName = tree.name(array);
        if (dim < 0 || dim > 3) {
            warnings.warn("%s: unsupported number of axes %d", context, dim);
            return null;
        }
        final String axisIndexOrder = tree.value(array, "axis_index_order", "").trim();
        if (!axisIndexOrder.equalsIgnoreCase(LAST_INDEX_FASTEST)) {
            warnings.warn("%s: axis_index_order = '%s' unhandled", context, axisIndexOrder);
            return null;
        }
        final String dataTypeTag = tree.value(array, "Element_Array.data_type", "").trim();
        final Optional<Pds4DataType> dataType = Pds4DataType.fromTag(dataTypeTag)
                .filter(Pds4DataType::isSupported);
        if (dataType.isEmpty()) {
            warnings.warn("%s: data_type = '%s' unhandled", context, dataTypeTag);
            return null;
        }
        final String offsetText = tree.value(array, "offset", "0").trim();
        final long offset;
        try {
            offset = Long.parseLong(offsetText);
        } catch (NumberFormatException e) {
            warnings.warn("%s: Invalid offset = %s", context, offsetText);
            return null;
        }
        if (offset < 0) {
            warnings.warn("%s: Invalid offset = %s", context, offsetText);
            return null;
        }

        final List<AxisSpec> axes = readAxes(tree, array, dim, context);
        if (axes == null) {
            return null;
        }
        final int samples = count(axes, AxisRole.SAMPLE);
        final int lines = count(axes, AxisRole.LINE);
        final int bands = axes.stream().anyMatch(a -> a.role() == AxisRole.BAND) ?
                count(axes, AxisRole.BAND) : 1;
        if (samples <= 0 || lines <= 0) {
            warnings.warn("%s: Invalid dataset dimensions : %d x %d", context, samples, lines);
            return null;
        }
        if (bands > Pds4Tools.MAX_NUMBER_OF_BANDS) {
            warnings.warn("%s: Invalid band count : %d", context, bands);
            return null;
        }
        final int specialConstants = tree.findChild(array, "Special_Constants");
        return ArrayDescriptor.newBuilder()
                .setFileAreaIndex(fileAreaIndex)
                .setArrayIndex(arrayIndex)
                .setElementName(elementName)
                .setName(tree.value(array, "name", null))
                .setLocalIdentifier(tree.value(array, "local_identifier", null))
                .setFileName(fileName)
                .setBaseOffset(offset)
                .setDataType(dataType.get())
                .setAxes(axes)
                .setValueOffset(parseDouble(tree, array, "Element_Array.value_offset", 0.0, context))
                .setScalingFactor(parseDouble(tree, array, "Element_Array.scaling_factor", 1.0, context))
                .setSpecialConstants(SpecialConstants.read(tree, specialConstants, context, warnings))
                .setStatistics(readStatistics(tree, tree.findChild(array, "Object_Statistics"), context))
                .build();
    }

    private List<AxisSpec> readAxes(LabelTree tree, int array, int dim, String context) {
        final AxisSpec[] byPosition = new AxisSpec[dim];
        final List<AxisSpec> result = new ArrayList<>();
        for (int axis : tree.childElements(array, "Axis_Array")) {
            final String axisName = tree.value(axis, "axis_name", null);
            final String elements = tree.value(axis, "elements", null);
            final String sequenceNumber = tree.value(axis, "sequence_number", null);
            if (axisName == null || elements == null || sequenceNumber == null) {
                continue;
            }
            final int position = parseInt(sequenceNumber);
            if (position < 1 || position > dim) {
                warnings.warn("%s: Invalid sequence_number = %s", context, sequenceNumber);
                continue;
            }
            final int count = parseInt(elements);
            if (count <= 0) {
                warnings.warn("%s: Invalid elements = %s", context, elements);
                continue;
            }
            if (byPosition[position - 1] != null) {
                warnings.warn("%s: Invalid sequence_number = %s", context, sequenceNumber);
                continue;
            }
            final Optional<AxisRole> role = AxisRole.fromAxisName(axisName.trim())
                    .filter(r -> r != AxisRole.BAND || dim == 3);
            if (role.isEmpty()) {
                warnings.warn("%s: Unsupported axis_name = %s", context, axisName);
                continue;
            }
            final AxisSpec spec = new AxisSpec(role.get(), count, position);
            byPosition[position - 1] = spec;
            result.add(spec);
        }
        if (result.size() != dim) {
            warnings.warn("%s: Found only %d Axis_Array elements. %d expected", context, result.size(), dim);
            return null;
        }
        return result;
    }

    private ArrayStatistics readStatistics(LabelTree tree, int statistics, String context) {
        if (statistics == LabelTree.NONE) {
            return null;
        }
        return new ArrayStatistics(
                parseOptional(tree, statistics, "minimum", context),
                parseOptional(tree, statistics, "maximum", context),
                parseOptional(tree, statistics, "mean", context),
                parseOptional(tree, statistics, "standard_deviation", context));
    }

    private double parseDouble(LabelTree tree, int node, String path, double defaultValue, String context) {
        final String s = tree.value(node, path, null);
        if (s == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            warnings.warn("%s: Invalid %s = '%s': %s used",
                    context, path, s, Pds4Tools.formatDouble(defaultValue));
            return defaultValue;
        }
    }

    private OptionalDouble parseOptional(LabelTree tree, int node, String path, String context) {
        final String s = tree.value(node, path, null);
        if (s == null) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(s.trim()));
        } catch (NumberFormatException e) {
            warnings.warn("%s: Invalid Object_Statistics.%s = '%s': ignored", context, path, s);
            return OptionalDouble.empty();
        }
    }

    static String context(String elementName, int fileAreaIndex, int arrayIndex) {
        return String.format(Locale.US, "%s (file area %d, array %d)", elementName, fileAreaIndex, arrayIndex);
    }

    private static int count(List<AxisSpec> axes, AxisRole role) {
        int result = 0;
        for (AxisSpec axis : axes) {
            if (axis.role() == role) {
                result = axis.elementCount();
            }
        }
        return result;
    }

    static int parseInt(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return 0;
            // - like atoi for wrong values
        }
    }
}
