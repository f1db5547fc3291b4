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
import net.algart.matrices.pds4.geo.Pds4Georeferencing;
import net.algart.matrices.pds4.geo.SpatialReference;
import net.algart.matrices.pds4.label.LabelTree;
import net.algart.matrices.pds4.layout.AxisLayoutResolver;
import net.algart.matrices.pds4.layout.LayoutPlan;
import net.algart.matrices.pds4.layout.Pds4Interleave;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Writer of new PDS4 products: a raw image file and the XML label, describing it.
 *
 * <p>The image file is created immediately; the label is written by {@link #close()}.
 * Samples are always stored in little-endian byte order.
 * The areas of the image that were not written are filled by the no-data value, if it is set
 * before the first writing, or by zero.
 */
public final class Pds4Writer extends Pds4IO {
    private static final Set<Pds4SampleType> SUPPORTED_SAMPLE_TYPES = EnumSet.of(
            Pds4SampleType.UINT8,
            Pds4SampleType.INT16,
            Pds4SampleType.UINT16,
            Pds4SampleType.INT32,
            Pds4SampleType.UINT32,
            Pds4SampleType.FLOAT,
            Pds4SampleType.DOUBLE,
            Pds4SampleType.COMPLEX_FLOAT,
            Pds4SampleType.COMPLEX_DOUBLE);

    private static final int COPY_BUFFER_SIZE = 1 << 20;

    private final Pds4CreationOptions options;
    private final int sizeX;
    private final int sizeY;
    private final int numberOfBands;
    private final Pds4SampleType sampleType;
    private final Pds4DataType dataType;
    private final Pds4Interleave interleave;
    private final Path imageFilePath;

    private SpatialReference spatialReference = null;
    private GeoTransform geoTransform = null;
    private OptionalDouble noDataValue = OptionalDouble.empty();
    private double valueOffset = 0.0;
    private double valueScale = 1.0;
    private String sourceLabel = null;
    private boolean closed = false;

    public Pds4Writer(
            Path labelFile,
            int sizeX,
            int sizeY,
            int numberOfBands,
            Pds4SampleType sampleType,
            Pds4CreationOptions options) throws IOException {
        super(labelFile);
        Objects.requireNonNull(sampleType, "Null sampleType");
        Objects.requireNonNull(options, "Null options");
        if (!SUPPORTED_SAMPLE_TYPES.contains(sampleType)) {
            throw new UnsupportedPds4FormatException("PDS4 writer does not support creating files of type "
                    + sampleType);
        }
        if (sizeX <= 0 || sizeY <= 0) {
            throw new IllegalArgumentException("Zero or negative image sizes " + sizeX + "x" + sizeY);
        }
        if (numberOfBands <= 0 || numberOfBands > Pds4Tools.MAX_NUMBER_OF_BANDS) {
            throw new IllegalArgumentException("Invalid number of bands " + numberOfBands);
        }
        this.options = options.copy();
        if (this.options.isArray2D() && numberOfBands > 1) {
            throw new UnsupportedPds4FormatException("ARRAY_TYPE=" + this.options.getArrayType()
                    + " is not supported for a multi-band raster");
        }
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.numberOfBands = numberOfBands;
        this.sampleType = sampleType;
        this.dataType = Pds4DataType.forWriting(sampleType);
        this.interleave = this.options.isArray2D() ? Pds4Interleave.BIP : this.options.getInterleave();
        final LayoutPlan plan = AxisLayoutResolver.resolve(
                interleave.axes(sizeX, sizeY, numberOfBands, this.options.isArray2D()),
                dataType.bytesPerSample(), 0, false);
        this.imageFilePath = labelFile.resolveSibling(this.options.getImageFileName().orElseGet(
                () -> resetExtension(labelFile.getFileName().toString(), this.options.getImageExtension())));
        if (imageFilePath.toAbsolutePath().normalize().equals(labelFile.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("Image file and label file must be different: " + labelFile);
        }
        this.imageFile = Pds4ImageFile.create(imageFilePath, plan, dataType);
        if (LOGGABLE_DEBUG) {
            LOG.log(System.Logger.Level.DEBUG, "Creating " + imageFile + " for label " + labelFile);
        }
    }

    /**
     * Creates a copy of the array, opened by the reader: all bands, georeferencing, no-data value,
     * value offset and scale. The label of the reader is used as a template,
     * if {@link Pds4CreationOptions#USE_SRC_LABEL} is set and there is no explicit template.
     *
     * @param reader    source reader.
     * @param labelFile path to the new label.
     * @param options   creation options.
     * @throws IOException in a case of I/O error.
     */
    public static void copy(Pds4Reader reader, Path labelFile, Pds4CreationOptions options) throws IOException {
        Objects.requireNonNull(reader, "Null reader");
        final Pds4Array source = reader.array();
        try (Pds4Writer writer = new Pds4Writer(labelFile, source.sizeX(), source.sizeY(), source.numberOfBands(),
                source.sampleType(), options)) {
            final Pds4Georeferencing georeferencing = reader.georeferencing();
            georeferencing.spatialReference().ifPresent(writer::setSpatialReference);
            georeferencing.geoTransform().ifPresent(writer::setGeoTransform);
            source.noDataValue().ifPresent(writer::setNoDataValue);
            writer.setValueOffset(source.descriptor().valueOffset());
            writer.setValueScale(source.descriptor().scalingFactor());
            writer.setSourceLabel(reader.labelText());
            writer.imageFile.markInitialized();
            // - all samples will be written below
            final int rowBytes = source.sizeX() * source.sampleType().bytesPerSample();
            final int rowsPerChunk = Math.max(1, COPY_BUFFER_SIZE / Math.max(1, rowBytes));
            for (int band = 0; band < source.numberOfBands(); band++) {
                for (int y = 0; y < source.sizeY(); y += rowsPerChunk) {
                    final int sizeY = Math.min(rowsPerChunk, source.sizeY() - y);
                    final byte[] samples = reader.readSamples(band, 0, y, source.sizeX(), sizeY);
                    writer.writeSamples(band, 0, y, source.sizeX(), sizeY, samples);
                }
            }
        }
    }

    public int sizeX() {
        return sizeX;
    }

    public int sizeY() {
        return sizeY;
    }

    public int numberOfBands() {
        return numberOfBands;
    }

    public Pds4SampleType sampleType() {
        return sampleType;
    }

    public Pds4DataType dataType() {
        return dataType;
    }

    public Pds4Interleave interleave() {
        return interleave;
    }

    public Path imageFilePath() {
        return imageFilePath;
    }

    public LayoutPlan plan() {
        return imageFile.plan();
    }

    public Pds4ImageFile.State imageFileState() {
        synchronized (fileLock) {
            return imageFile.state();
        }
    }

    public Optional<GeoTransform> geoTransform() {
        return Optional.ofNullable(geoTransform);
    }

    /**
     * Sets the affine transform of the new product.
     *
     * @param geoTransform new transform.
     * @return a reference to this object.
     * @throws IllegalArgumentException if the transform is not north-up.
     */
    public Pds4Writer setGeoTransform(GeoTransform geoTransform) {
        Objects.requireNonNull(geoTransform, "Null geoTransform");
        this.geoTransform = geoTransform.requireNorthUp();
        return this;
    }

    public Optional<SpatialReference> spatialReference() {
        return Optional.ofNullable(spatialReference);
    }

    public Pds4Writer setSpatialReference(SpatialReference spatialReference) {
        this.spatialReference = Objects.requireNonNull(spatialReference, "Null spatialReference");
        return this;
    }

    public OptionalDouble noDataValue() {
        return noDataValue;
    }

    /**
     * Sets the no-data value. If it is called before the first writing, the whole image file
     * is filled by this value.
     *
     * @param noDataValue new no-data value.
     * @return a reference to this object.
     */
    public Pds4Writer setNoDataValue(double noDataValue) {
        synchronized (fileLock) {
            this.noDataValue = OptionalDouble.of(noDataValue);
            if (imageFile.state() == Pds4ImageFile.State.UNINITIALIZED) {
                imageFile.setFillValue(this.noDataValue);
            }
        }
        return this;
    }

    public double valueOffset() {
        return valueOffset;
    }

    public Pds4Writer setValueOffset(double valueOffset) {
        this.valueOffset = valueOffset;
        return this;
    }

    public double valueScale() {
        return valueScale;
    }

    public Pds4Writer setValueScale(double valueScale) {
        this.valueScale = valueScale;
        return this;
    }

    public Pds4Writer setSourceLabel(String sourceLabel) {
        this.sourceLabel = sourceLabel;
        return this;
    }

    /**
     * Writes samples of the rectangular area of one band. The samples must be stored line by line
     * in the native byte order of the current JVM.
     *
     * @param band    index of the band.
     * @param fromX   starting sample in every line.
     * @param fromY   starting line.
     * @param sizeX   number of samples in every line.
     * @param sizeY   number of lines.
     * @param samples samples.
     * @throws IOException in a case of I/O error.
     */
    public void writeSamples(int band, int fromX, int fromY, int sizeX, int sizeY, byte[] samples)
            throws IOException {
        synchronized (fileLock) {
            requireNotClosed();
            imageFile.writeSamples(band, fromX, fromY, sizeX, sizeY, samples);
        }
    }

    /**
     * Writes samples, stored in a Java array, corresponding to the {@link #sampleType() sample type}.
     *
     * @param band      index of the band.
     * @param fromX     starting sample in every line.
     * @param fromY     starting line.
     * @param sizeX     number of samples in every line.
     * @param sizeY     number of lines.
     * @param javaArray samples.
     * @throws IOException in a case of I/O error.
     */
    public void writeJavaArray(int band, int fromX, int fromY, int sizeX, int sizeY, Object javaArray)
            throws IOException {
        Objects.requireNonNull(javaArray, "Null javaArray");
        if (javaArray.getClass().getComponentType() != sampleType.elementType()) {
            throw new IllegalArgumentException("Java array " + javaArray.getClass().getSimpleName()
                    + " does not correspond to " + sampleType + " sample type");
        }
        writeSamples(band, fromX, fromY, sizeX, sizeY, Pds4SampleType.bytes(javaArray, ByteOrder.nativeOrder()));
    }

    /**
     * Builds the label without writing it: useful for preview.
     *
     * @return label of the new product.
     * @throws IOException in a case of problems with the template.
     */
    public LabelTree buildLabel() throws IOException {
        final Pds4LabelWriter labelWriter = new Pds4LabelWriter(options, warnings)
                .setImageFileName(imageFilePath.getFileName().toString())
                .setArray(sizeX, sizeY, numberOfBands, dataType, interleave)
                .setSpatialReference(spatialReference)
                .setGeoTransform(geoTransform)
                .setNoDataValue(noDataValue)
                .setValueOffset(valueOffset)
                .setValueScale(valueScale)
                .setSourceLabel(sourceLabel);
        return labelWriter.build(resetExtension(labelFile.getFileName().toString(), null));
    }

    /**
     * Initializes the image file, if nothing was written, writes the label and closes the image file.
     *
     * @throws IOException in a case of I/O error.
     */
    @Override
    public void close() throws IOException {
        synchronized (fileLock) {
            if (closed) {
                return;
            }
            closed = true;
            try {
                imageFile.requireInitialized();
                final String xml = buildLabel().toXml();
                Files.writeString(labelFile, xml, StandardCharsets.UTF_8);
                if (LOGGABLE_DEBUG) {
                    LOG.log(System.Logger.Level.DEBUG, "PDS4 label " + labelFile + " written");
                }
            } finally {
                super.close();
            }
        }
    }

    @Override
    public String toString() {
        return "PDS4 writer to " + labelFile + ": " + sizeX + "x" + sizeY + "x" + numberOfBands + " "
                + sampleType + ", " + interleave;
    }

    /**
     * Replaces the extension of the file name, or removes it if <code>extension</code> is <code>null</code>.
     */
    static String resetExtension(String fileName, String extension) {
        final int p = fileName.lastIndexOf('.');
        final String base = p > 0 ? fileName.substring(0, p) : fileName;
        return extension == null ? base : base + "." + extension;
    }

    private void requireNotClosed() {
        if (closed) {
            throw new IllegalStateException("Writer of " + labelFile + " is already closed");
        }
    }
}
