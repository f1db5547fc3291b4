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

import net.algart.matrices.pds4.geo.Pds4GeoreferencingWriter;
import net.algart.matrices.pds4.label.LabelTemplateSubstitution;
import net.algart.matrices.pds4.layout.Pds4Interleave;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of creating a new PDS4 product by {@link Pds4Writer}.
 *
 * <p>Options can be set by the fluent setters or parsed from a string map by {@link #fromMap(Map)},
 * where keys are case-insensitive: <code>INTERLEAVE</code>, <code>IMAGE_FILENAME</code>,
 * <code>IMAGE_EXTENSION</code>, <code>TEMPLATE</code>, <code>USE_SRC_LABEL</code>,
 * <code>LATITUDE_TYPE</code>, <code>LONGITUDE_DIRECTION</code>, <code>RADII</code>,
 * <code>BOUNDING_DEGREES</code>, <code>ARRAY_TYPE</code> and any number of <code>VAR_xxx</code>
 * template variables.
 */
public final class Pds4CreationOptions {
    public static final String INTERLEAVE = "INTERLEAVE";
    public static final String IMAGE_FILENAME = "IMAGE_FILENAME";
    public static final String IMAGE_EXTENSION = "IMAGE_EXTENSION";
    public static final String TEMPLATE = "TEMPLATE";
    public static final String USE_SRC_LABEL = "USE_SRC_LABEL";
    public static final String LATITUDE_TYPE = "LATITUDE_TYPE";
    public static final String LONGITUDE_DIRECTION = "LONGITUDE_DIRECTION";
    public static final String RADII = "RADII";
    public static final String BOUNDING_DEGREES = "BOUNDING_DEGREES";
    public static final String ARRAY_TYPE = "ARRAY_TYPE";

    public static final String DEFAULT_IMAGE_EXTENSION = "img";
    public static final String DEFAULT_ARRAY_TYPE = "Array_3D_Image";

    private Pds4Interleave interleave = Pds4Interleave.BSQ;
    private String imageFileName = null;
    private String imageExtension = DEFAULT_IMAGE_EXTENSION;
    private Path template = null;
    private boolean useSourceLabel = true;
    private String latitudeType = Pds4GeoreferencingWriter.PLANETOCENTRIC;
    private String longitudeDirection = Pds4GeoreferencingWriter.POSITIVE_EAST;
    private double[] radii = null;
    private double[] boundingDegrees = null;
    private String arrayType = DEFAULT_ARRAY_TYPE;
    private final Map<String, String> variables = new LinkedHashMap<>();

    public Pds4CreationOptions() {
    }

    /**
     * Parses options from a map with case-insensitive keys.
     * Unknown keys, which are not template variables, are ignored with a warning in the log.
     *
     * @param options options map.
     * @return parsed options.
     * @throws IllegalArgumentException if some value has invalid format.
     */
    public static Pds4CreationOptions fromMap(Map<String, String> options) {
        Objects.requireNonNull(options, "Null options");
        final Pds4CreationOptions result = new Pds4CreationOptions();
        for (Map.Entry<String, String> entry : options.entrySet()) {
            final String key = Objects.requireNonNull(entry.getKey(), "Null option key");
            final String value = Objects.requireNonNull(entry.getValue(), "Null value of option " + key);
            if (LabelTemplateSubstitution.isVariable(key)) {
                result.variables.put(key.toUpperCase(Locale.ROOT), value);
                continue;
            }
            switch (key.toUpperCase(Locale.ROOT)) {
                case INTERLEAVE -> result.setInterleave(Pds4Interleave.fromName(value));
                case IMAGE_FILENAME -> result.setImageFileName(value);
                case IMAGE_EXTENSION -> result.setImageExtension(value);
                case TEMPLATE -> result.setTemplate(Path.of(value));
                case USE_SRC_LABEL -> result.setUseSourceLabel(parseBoolean(key, value));
                case LATITUDE_TYPE -> result.setLatitudeType(value);
                case LONGITUDE_DIRECTION -> result.setLongitudeDirection(value);
                case RADII -> {
                    final double[] radii = parseNumbers(key, value, 2);
                    result.setRadii(radii[0], radii[1]);
                }
                case BOUNDING_DEGREES -> {
                    final double[] d = parseNumbers(key, value, 4);
                    result.setBoundingDegrees(d[0], d[1], d[2], d[3]);
                }
                case ARRAY_TYPE -> result.setArrayType(value);
                default -> System.getLogger(Pds4CreationOptions.class.getName()).log(
                        System.Logger.Level.WARNING, "Unknown PDS4 creation option " + key + " ignored");
            }
        }
        return result;
    }

    public Pds4Interleave getInterleave() {
        return interleave;
    }

    public Pds4CreationOptions setInterleave(Pds4Interleave interleave) {
        this.interleave = Objects.requireNonNull(interleave, "Null interleave");
        return this;
    }

    public Optional<String> getImageFileName() {
        return Optional.ofNullable(imageFileName);
    }

    public Pds4CreationOptions setImageFileName(String imageFileName) {
        this.imageFileName = imageFileName;
        return this;
    }

    public String getImageExtension() {
        return imageExtension;
    }

    public Pds4CreationOptions setImageExtension(String imageExtension) {
        this.imageExtension = Objects.requireNonNull(imageExtension, "Null imageExtension");
        return this;
    }

    public Optional<Path> getTemplate() {
        return Optional.ofNullable(template);
    }

    public Pds4CreationOptions setTemplate(Path template) {
        this.template = template;
        return this;
    }

    public boolean isUseSourceLabel() {
        return useSourceLabel;
    }

    public Pds4CreationOptions setUseSourceLabel(boolean useSourceLabel) {
        this.useSourceLabel = useSourceLabel;
        return this;
    }

    public String getLatitudeType() {
        return latitudeType;
    }

    public Pds4CreationOptions setLatitudeType(String latitudeType) {
        this.latitudeType = Objects.requireNonNull(latitudeType, "Null latitudeType");
        return this;
    }

    public String getLongitudeDirection() {
        return longitudeDirection;
    }

    public Pds4CreationOptions setLongitudeDirection(String longitudeDirection) {
        this.longitudeDirection = Objects.requireNonNull(longitudeDirection, "Null longitudeDirection");
        return this;
    }

    public Optional<double[]> getRadii() {
        return Optional.ofNullable(radii == null ? null : radii.clone());
    }

    public Pds4CreationOptions setRadii(double semiMajor, double polarRadius) {
        this.radii = new double[]{semiMajor, polarRadius};
        return this;
    }

    /**
     * Returns the bounding box override: west, south, east, north.
     *
     * @return bounding degrees or empty result if they should be calculated.
     */
    public Optional<double[]> getBoundingDegrees() {
        return Optional.ofNullable(boundingDegrees == null ? null : boundingDegrees.clone());
    }

    public Pds4CreationOptions setBoundingDegrees(double west, double south, double east, double north) {
        this.boundingDegrees = new double[]{west, south, east, north};
        return this;
    }

    public String getArrayType() {
        return arrayType;
    }

    public Pds4CreationOptions setArrayType(String arrayType) {
        this.arrayType = Objects.requireNonNull(arrayType, "Null arrayType");
        return this;
    }

    public boolean isArray2D() {
        return arrayType.startsWith("Array_2D");
    }

    /**
     * Returns template variables with their <code>VAR_</code> prefix, in the order of adding.
     *
     * @return unmodifiable map of variables.
     */
    public Map<String, String> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public Optional<String> getVariable(String name) {
        return Optional.ofNullable(variables.get(variableKey(name)));
    }

    /**
     * Sets the template variable: <code>${NAME}</code> in the template will be replaced with the value.
     *
     * @param name  variable name with or without <code>VAR_</code> prefix.
     * @param value the value.
     * @return a reference to this object.
     */
    public Pds4CreationOptions setVariable(String name, String value) {
        Objects.requireNonNull(value, "Null value");
        variables.put(variableKey(name), value);
        return this;
    }

    void setVariableIfAbsent(String name, String value) {
        variables.putIfAbsent(variableKey(name), value);
    }

    public Pds4CreationOptions copy() {
        final Pds4CreationOptions result = new Pds4CreationOptions();
        result.interleave = interleave;
        result.imageFileName = imageFileName;
        result.imageExtension = imageExtension;
        result.template = template;
        result.useSourceLabel = useSourceLabel;
        result.latitudeType = latitudeType;
        result.longitudeDirection = longitudeDirection;
        result.radii = radii == null ? null : radii.clone();
        result.boundingDegrees = boundingDegrees == null ? null : boundingDegrees.clone();
        result.arrayType = arrayType;
        result.variables.putAll(variables);
        return result;
    }

    @Override
    public String toString() {
        return "PDS4 creation options: " + interleave
                + ", array type " + arrayType
                + (imageFileName != null ? ", image file " + imageFileName : ", image extension " + imageExtension)
                + (template != null ? ", template " + template : "")
                + (variables.isEmpty() ? "" : ", variables " + variables);
    }

    private static String variableKey(String name) {
        Objects.requireNonNull(name, "Null variable name");
        final String upper = name.toUpperCase(Locale.ROOT);
        return upper.startsWith(LabelTemplateSubstitution.VARIABLE_PREFIX) ?
                upper :
                LabelTemplateSubstitution.VARIABLE_PREFIX + upper;
    }

    private static boolean parseBoolean(String key, String value) {
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "YES", "TRUE", "ON", "1" -> true;
            case "NO", "FALSE", "OFF", "0" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean value of " + key + ": " + value);
        };
    }

    private static double[] parseNumbers(String key, String value, int count) {
        final String[] tokens = value.trim().split("[\\s,]+");
        if (tokens.length != count) {
            throw new IllegalArgumentException(key + " must contain " + count
                    + " comma-separated numbers, but it is \"" + value + "\"");
        }
        final double[] result = new double[count];
        for (int k = 0; k < count; k++) {
            try {
                result[k] = Double.parseDouble(tokens[k]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number in " + key + ": " + value, e);
            }
        }
        return result;
    }
}
