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

package net.algart.matrices.pds4.layout;

import net.algart.matrices.pds4.Pds4DataType;
import net.algart.matrices.pds4.constants.SpecialConstants;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Description of one raster array, found in a <code>File_Area_Observational</code> of a PDS4 label.
 * Objects of this class are immutable.
 */
public final class ArrayDescriptor {
    private final int fileAreaIndex;
    private final int arrayIndex;
    private final String elementName;
    private final String name;
    private final String localIdentifier;
    private final String fileName;
    private final long baseOffset;
    private final Pds4DataType dataType;
    private final List<AxisSpec> axes;
    private final double valueOffset;
    private final double scalingFactor;
    private final SpecialConstants specialConstants;
    private final ArrayStatistics statistics;

    private ArrayDescriptor(Builder builder) {
        this.fileAreaIndex = builder.fileAreaIndex;
        this.arrayIndex = builder.arrayIndex;
        this.elementName = Objects.requireNonNull(builder.elementName, "Null elementName");
        this.name = builder.name;
        this.localIdentifier = builder.localIdentifier;
        this.fileName = Objects.requireNonNull(builder.fileName, "Null fileName");
        this.baseOffset = builder.baseOffset;
        this.dataType = Objects.requireNonNull(builder.dataType, "Null dataType");
        this.axes = builder.axes.stream()
                .sorted(Comparator.comparingInt(AxisSpec::sequencePosition))
                .toList();
        this.valueOffset = builder.valueOffset;
        this.scalingFactor = builder.scalingFactor;
        this.specialConstants = builder.specialConstants;
        this.statistics = builder.statistics;
        if (axes.isEmpty() || axes.size() > 3) {
            throw new IllegalArgumentException("Illegal number of axes " + axes.size());
        }
        if (baseOffset < 0) {
            throw new IllegalArgumentException("Negative offset " + baseOffset);
        }
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Returns 1-based index of <code>File_Area_Observational</code>, containing this array.
     *
     * @return index of the file area.
     */
    public int fileAreaIndex() {
        return fileAreaIndex;
    }

    /**
     * Returns 1-based index of this array among all arrays of its file area.
     *
     * @return index of the array.
     */
    public int arrayIndex() {
        return arrayIndex;
    }

    public String elementName() {
        return elementName;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Optional<String> localIdentifier() {
        return Optional.ofNullable(localIdentifier);
    }

    public String fileName() {
        return fileName;
    }

    public long baseOffset() {
        return baseOffset;
    }

    public Pds4DataType dataType() {
        return dataType;
    }

    /**
     * Returns the axes in the order of their sequence numbers.
     *
     * @return list of axes.
     */
    public List<AxisSpec> axes() {
        return axes;
    }

    public int dimensions() {
        return axes.size();
    }

    public int samples() {
        return count(AxisRole.SAMPLE);
    }

    public int lines() {
        return count(AxisRole.LINE);
    }

    public int bands() {
        return count(AxisRole.BAND);
    }

    /**
     * Returns letters of the axis roles in the order of sequence numbers, like <code>"BLS"</code>.
     *
     * @return axis order.
     */
    public String axisOrder() {
        return axes.stream().map(a -> String.valueOf(a.role().letter())).collect(Collectors.joining());
    }

    public double valueOffset() {
        return valueOffset;
    }

    public double scalingFactor() {
        return scalingFactor;
    }

    public SpecialConstants specialConstants() {
        return specialConstants;
    }

    public Optional<ArrayStatistics> statistics() {
        return Optional.ofNullable(statistics);
    }

    /**
     * Returns a human-readable identification of this array: its name, or local identifier,
     * or index, if there is neither name nor local identifier.
     *
     * @return the array identification.
     */
    public String displayName() {
        return name != null ? name : localIdentifier != null ? localIdentifier : String.valueOf(arrayIndex);
    }

    @Override
    public String toString() {
        return elementName + " \"" + displayName() + "\" #" + fileAreaIndex + ":" + arrayIndex
                + " in " + fileName + ": " + dataType + ", " + axes + ", offset " + baseOffset;
    }

    private int count(AxisRole role) {
        for (AxisSpec axis : axes) {
            if (axis.role() == role) {
                return axis.elementCount();
            }
        }
        return 1;
    }

    public static final class Builder {
        private int fileAreaIndex = 1;
        private int arrayIndex = 1;
        private String elementName = "Array_2D_Image";
        private String name = null;
        private String localIdentifier = null;
        private String fileName = null;
        private long baseOffset = 0;
        private Pds4DataType dataType = null;
        private List<AxisSpec> axes = List.of();
        private double valueOffset = 0.0;
        private double scalingFactor = 1.0;
        private SpecialConstants specialConstants = SpecialConstants.empty();
        private ArrayStatistics statistics = null;

        private Builder() {
        }

        public Builder setFileAreaIndex(int fileAreaIndex) {
            this.fileAreaIndex = fileAreaIndex;
            return this;
        }

        public Builder setArrayIndex(int arrayIndex) {
            this.arrayIndex = arrayIndex;
            return this;
        }

        public Builder setElementName(String elementName) {
            this.elementName = Objects.requireNonNull(elementName, "Null elementName");
            return this;
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder setLocalIdentifier(String localIdentifier) {
            this.localIdentifier = localIdentifier;
            return this;
        }

        public Builder setFileName(String fileName) {
            this.fileName = Objects.requireNonNull(fileName, "Null fileName");
            return this;
        }

        public Builder setBaseOffset(long baseOffset) {
            this.baseOffset = baseOffset;
            return this;
        }

        public Builder setDataType(Pds4DataType dataType) {
            this.dataType = Objects.requireNonNull(dataType, "Null dataType");
            return this;
        }

        public Builder setAxes(List<AxisSpec> axes) {
            this.axes = List.copyOf(Objects.requireNonNull(axes, "Null axes"));
            return this;
        }

        public Builder setValueOffset(double valueOffset) {
            this.valueOffset = valueOffset;
            return this;
        }

        public Builder setScalingFactor(double scalingFactor) {
            this.scalingFactor = scalingFactor;
            return this;
        }

        public Builder setSpecialConstants(SpecialConstants specialConstants) {
            this.specialConstants = Objects.requireNonNull(specialConstants, "Null specialConstants");
            return this;
        }

        public Builder setStatistics(ArrayStatistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public ArrayDescriptor build() {
            return new ArrayDescriptor(this);
        }
    }
}
