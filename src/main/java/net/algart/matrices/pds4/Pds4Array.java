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
import net.algart.matrices.pds4.constants.ValidityMask;
import net.algart.matrices.pds4.layout.ArrayDescriptor;
import net.algart.matrices.pds4.layout.ArrayStatistics;
import net.algart.matrices.pds4.layout.LayoutPlan;
import net.algart.matrices.pds4.layout.Pds4Interleave;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One usable array, found in a PDS4 label: its descriptor, physical layout and the image file,
 * which contains the samples.
 */
public final class Pds4Array {
    public static final String SUBDATASET_PREFIX = "PDS4:";

    private final ArrayDescriptor descriptor;
    private final LayoutPlan plan;
    private final Path labelFile;
    private final Path imageFile;

    Pds4Array(ArrayDescriptor descriptor, LayoutPlan plan, Path labelFile, Path imageFile) {
        this.descriptor = Objects.requireNonNull(descriptor, "Null descriptor");
        this.plan = Objects.requireNonNull(plan, "Null plan");
        this.labelFile = Objects.requireNonNull(labelFile, "Null labelFile");
        this.imageFile = Objects.requireNonNull(imageFile, "Null imageFile");
    }

    public ArrayDescriptor descriptor() {
        return descriptor;
    }

    public LayoutPlan plan() {
        return plan;
    }

    public Path labelFile() {
        return labelFile;
    }

    public Path imageFile() {
        return imageFile;
    }

    public Pds4DataType dataType() {
        return descriptor.dataType();
    }

    public Pds4SampleType sampleType() {
        return descriptor.dataType().sampleType();
    }

    public int sizeX() {
        return plan.samples();
    }

    public int sizeY() {
        return plan.lines();
    }

    public int numberOfBands() {
        return plan.bands();
    }

    public SpecialConstants specialConstants() {
        return descriptor.specialConstants();
    }

    public OptionalDouble noDataValue() {
        return descriptor.specialConstants().noDataValue();
    }

    public boolean requiresMask(boolean forced) {
        return descriptor.specialConstants().requiresMask(sampleType().isComplex(), forced);
    }

    public ValidityMask validityMask() {
        return new ValidityMask(sampleType(), descriptor.specialConstants().maskValues());
    }

    /**
     * Returns the statistics of the array. They are meaningful only for a single band,
     * so this method returns empty result for multi-band arrays.
     *
     * @return statistics from the label.
     */
    public Optional<ArrayStatistics> statistics() {
        return plan.bands() == 1 ? descriptor.statistics() : Optional.empty();
    }

    public Optional<Pds4Interleave> interleave() {
        return descriptor.dimensions() == 3 ?
                Pds4Interleave.fromAxisOrder(descriptor.axisOrder()) :
                Optional.empty();
    }

    /**
     * Returns the name of the interleave in the metadata domain of the image structure:
     * <code>BAND</code>, <code>PIXEL</code> or <code>LINE</code>. For 2-dimensional arrays it is empty.
     *
     * @return interleave name.
     */
    public Optional<String> interleaveName() {
        if (descriptor.dimensions() != 3) {
            return Optional.empty();
        }
        return Optional.of(interleave().map(Pds4Interleave::metadataName).orElse("LINE"));
    }

    public String subdatasetName() {
        return subdatasetName(labelFile.toString(), descriptor.fileAreaIndex(), descriptor.arrayIndex());
    }

    public String subdatasetDescription() {
        return "Image file " + descriptor.fileName() + ", array " + descriptor.displayName();
    }

    public static String subdatasetName(String labelFile, int fileAreaIndex, int arrayIndex) {
        Objects.requireNonNull(labelFile, "Null labelFile");
        return SUBDATASET_PREFIX + labelFile + ":" + fileAreaIndex + ":" + arrayIndex;
    }

    @Override
    public String toString() {
        return "PDS4 array " + descriptor.displayName() + " (" + sampleType() + ", "
                + sizeX() + "x" + sizeY() + "x" + numberOfBands() + ") in " + imageFile;
    }
}
