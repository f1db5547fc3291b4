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

import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.SimpleMemoryModel;
import net.algart.arrays.UpdatablePArray;
import net.algart.matrices.pds4.constants.ValidityMask;
import net.algart.matrices.pds4.geo.Pds4Georeferencing;
import net.algart.matrices.pds4.geo.Pds4GeoreferencingReader;
import net.algart.matrices.pds4.label.LabelTree;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reader of PDS4 products: an XML label and raw image files, described by it.
 *
 * <p>The label may describe several arrays. By default, the first readable one is selected;
 * another array can be chosen by the 1-based index of <code>File_Area_Observational</code> element
 * and the 1-based index of the array inside it, or by the subdataset name
 * <code>PDS4:&lt;label&gt;:&lt;file-area&gt;:&lt;array&gt;</code> (see {@link #open(String)}).
 * If the label contains several arrays and no array is requested, they are listed by
 * {@link #subdatasets()}.
 *
 * <p>All samples are returned in the native byte order of the current JVM.
 */
public final class Pds4Reader extends Pds4IO {
    /**
     * If this system property is <code>true</code>, the validity mask is built even when it is not necessary.
     */
    public static final String FORCE_MASK_PROPERTY = "net.algart.matrices.pds4.forceMask";

    public static final int HEADER_LENGTH_TO_IDENTIFY = 1024;

    private static final boolean FORCE_MASK = Pds4Tools.getBooleanProperty(FORCE_MASK_PROPERTY);
    private static final String PDS4_NAMESPACE = "pds.nasa.gov/pds4/pds/v1";

    private final String labelText;
    private final LabelTree label;
    private final List<Pds4Array> subdatasets;
    private final Pds4Array array;
    private final Pds4Georeferencing georeferencing;
    private volatile boolean forceMask = FORCE_MASK;

    public Pds4Reader(Path labelFile) throws IOException {
        this(labelFile, -1, -1, false);
    }

    /**
     * Opens the array with the given indexes.
     *
     * @param labelFile      path to the label.
     * @param fileAreaIndex  1-based index of <code>File_Area_Observational</code>, or 0 for any.
     * @param arrayIndex     1-based index of the array inside the file area, or 0 for any.
     * @throws IOException in a case of I/O error or if there is no such array.
     */
    public Pds4Reader(Path labelFile, int fileAreaIndex, int arrayIndex) throws IOException {
        this(labelFile, fileAreaIndex, arrayIndex, true);
    }

    private Pds4Reader(Path labelFile, int fileAreaIndex, int arrayIndex, boolean lookup) throws IOException {
        super(labelFile);
        if (!Files.isRegularFile(labelFile)) {
            throw new FileNotFoundException("Label file " + labelFile
                    + (Files.exists(labelFile) ? " is not a regular file" : " does not exist"));
        }
        this.labelText = Files.readString(labelFile, StandardCharsets.UTF_8);
        this.label = LabelTree.parse(labelText);
        label.stripNamespaces();
        final int product = Pds4ArrayScanner.findProduct(label);
        final Pds4ArrayScanner.Result scan = new Pds4ArrayScanner(warnings).scan(
                label, product, labelFile, fileAreaIndex, arrayIndex);
        this.subdatasets = !lookup && scan.candidates().size() > 1 ?
                scan.candidates() :
                Collections.emptyList();
        this.array = scan.selected().orElse(null);
        if (array == null && subdatasets.isEmpty()) {
            throw new Pds4Exception("No readable array found in " + labelFile
                    + (lookup ? " (file area " + fileAreaIndex + ", array " + arrayIndex + ")" : ""));
        }
        if (array != null) {
            this.imageFile = Pds4ImageFile.openForReading(array.imageFile(), array.plan(), array.dataType());
            if (LOGGABLE_DEBUG) {
                LOG.log(System.Logger.Level.DEBUG, "Opened " + array);
            }
        }
        this.georeferencing = new Pds4GeoreferencingReader(warnings).read(label, product);
    }

    /**
     * Opens PDS4 product by a file name or by a subdataset name
     * <code>PDS4:&lt;label&gt;:&lt;file-area&gt;:&lt;array&gt;</code>.
     * The label path may start with a Windows drive letter, like <code>PDS4:C:\data\x.xml:1:1</code>.
     *
     * @param name file name or subdataset name.
     * @return new reader.
     * @throws IOException in a case of I/O error or invalid name.
     */
    public static Pds4Reader open(String name) throws IOException {
        Objects.requireNonNull(name, "Null name");
        if (!name.regionMatches(true, 0, Pds4Array.SUBDATASET_PREFIX, 0, Pds4Array.SUBDATASET_PREFIX.length())) {
            return new Pds4Reader(Path.of(name));
        }
        final String[] tokens = Arrays.stream(name.split(":"))
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
        final String file;
        final String fileAreaIndex;
        final String arrayIndex;
        if (tokens.length == 5 && tokens[1].length() == 1
                && (tokens[2].startsWith("\\") || tokens[2].startsWith("/"))) {
            file = tokens[1] + ":" + tokens[2];
            fileAreaIndex = tokens[3];
            arrayIndex = tokens[4];
        } else if (tokens.length == 4) {
            file = tokens[1];
            fileAreaIndex = tokens[2];
            arrayIndex = tokens[3];
        } else {
            throw new Pds4Exception("Invalid syntax for PDS4 subdataset name: " + name);
        }
        return new Pds4Reader(Path.of(file),
                Pds4ArrayScanner.parseInt(fileAreaIndex), Pds4ArrayScanner.parseInt(arrayIndex));
    }

    /**
     * Checks whether the beginning of a file looks like a PDS4 label.
     *
     * @param header first bytes of the file.
     * @return whether it is a PDS4 label.
     */
    public static boolean isPds4Label(byte[] header) {
        Objects.requireNonNull(header, "Null header");
        final String s = new String(header, StandardCharsets.ISO_8859_1);
        return s.contains("Product_Observational") && s.contains(PDS4_NAMESPACE);
    }

    public static boolean isPds4Label(Path file) throws IOException {
        Objects.requireNonNull(file, "Null file");
        if (file.toString().toUpperCase(Locale.ROOT).startsWith(Pds4Array.SUBDATASET_PREFIX)) {
            return true;
        }
        try (InputStream stream = Files.newInputStream(file)) {
            return isPds4Label(stream.readNBytes(HEADER_LENGTH_TO_IDENTIFY));
        }
    }

    public boolean hasArray() {
        return array != null;
    }

    /**
     * Returns the opened array.
     *
     * @return the selected array.
     * @throws IllegalStateException if the label contains only {@link #subdatasets()} without readable data.
     */
    public Pds4Array array() {
        if (array == null) {
            throw new IllegalStateException("No array is opened in " + labelFile + ": please choose a subdataset");
        }
        return array;
    }

    /**
     * Returns all arrays of the label, if there are 2 or more arrays and no array was specified while opening.
     *
     * @return list of subdatasets, usually empty.
     */
    public List<Pds4Array> subdatasets() {
        return subdatasets;
    }

    public List<String> subdatasetNames() {
        final List<String> result = new ArrayList<>();
        for (Pds4Array a : subdatasets) {
            result.add(a.subdatasetName());
        }
        return result;
    }

    public Pds4Georeferencing georeferencing() {
        return georeferencing;
    }

    /**
     * Returns the original text of the label.
     *
     * @return the label XML.
     */
    public String labelText() {
        return labelText;
    }

    /**
     * Returns a copy of the parsed label with stripped namespaces.
     *
     * @return the label tree.
     */
    public LabelTree label() {
        return label.copy();
    }

    public boolean isForceMask() {
        return forceMask;
    }

    public Pds4Reader setForceMask(boolean forceMask) {
        this.forceMask = forceMask;
        return this;
    }

    public boolean hasMask() {
        return array().requiresMask(forceMask);
    }

    public byte[] readSamples(int band) throws IOException {
        final Pds4Array a = array();
        return readSamples(band, 0, 0, a.sizeX(), a.sizeY());
    }

    public byte[] readSamples(int band, int fromX, int fromY, int sizeX, int sizeY) throws IOException {
        array();
        synchronized (fileLock) {
            return imageFile.readSamples(band, fromX, fromY, sizeX, sizeY);
        }
    }

    /**
     * Reads samples as a Java array: <code>byte[]</code>, <code>short[]</code>, <code>int[]</code>,
     * <code>float[]</code> or <code>double[]</code>, depending on {@link Pds4SampleType#elementType()}.
     * Unsigned values are stored in signed Java types with the same bits.
     *
     * @param band  index of the band.
     * @param fromX starting sample in every line.
     * @param fromY starting line.
     * @param sizeX number of samples in every line.
     * @param sizeY number of lines.
     * @return Java array of samples.
     * @throws IOException in a case of I/O error.
     */
    public Object readJavaArray(int band, int fromX, int fromY, int sizeX, int sizeY) throws IOException {
        final byte[] bytes = readSamples(band, fromX, fromY, sizeX, sizeY);
        return array().sampleType().javaArray(bytes, ByteOrder.nativeOrder());
    }

    public Matrix<UpdatablePArray> readMatrix(int band) throws IOException {
        final Pds4Array a = array();
        return readMatrix(band, 0, 0, a.sizeX(), a.sizeY());
    }

    public Matrix<UpdatablePArray> readMatrix(int band, int fromX, int fromY, int sizeX, int sizeY)
            throws IOException {
        final Object javaArray = readJavaArray(band, fromX, fromY, sizeX, sizeY);
        return array().sampleType().asMatrix(javaArray, sizeX, sizeY);
    }

    /**
     * Reads the validity mask of the rectangular area: 255 for valid pixels and 0 for pixels, equal
     * to one of the special constants.
     *
     * @param band  index of the band.
     * @param fromX starting sample in every line.
     * @param fromY starting line.
     * @param sizeX number of samples in every line.
     * @param sizeY number of lines.
     * @return mask bytes, line by line.
     * @throws IOException in a case of I/O error.
     * @throws IllegalStateException if this array has no mask (see {@link #hasMask()}).
     */
    public byte[] readMask(int band, int fromX, int fromY, int sizeX, int sizeY) throws IOException {
        final ValidityMask mask = requireMask();
        final byte[] samples = readSamples(band, fromX, fromY, sizeX, sizeY);
        return mask.evaluate(samples, ByteOrder.nativeOrder(), sizeX, sizeY);
    }

    /**
     * Reads the mask of one block of the regular grid of blocks <code>blockSizeX*blockSizeY</code>.
     * The result always contains <code>blockSizeX*blockSizeY</code> elements; for partial blocks
     * at the right and bottom image boundaries only the part inside the image is filled,
     * and other elements are zero.
     *
     * @param band       index of the band.
     * @param blockX     x-index of the block in the grid.
     * @param blockY     y-index of the block in the grid.
     * @param blockSizeX width of every block.
     * @param blockSizeY height of every block.
     * @return mask of the block.
     * @throws IOException in a case of I/O error.
     */
    public byte[] readMaskBlock(int band, int blockX, int blockY, int blockSizeX, int blockSizeY)
            throws IOException {
        final Pds4Array a = array();
        if (blockSizeX <= 0 || blockSizeY <= 0) {
            throw new IllegalArgumentException("Zero or negative block sizes " + blockSizeX + "x" + blockSizeY);
        }
        final long fromX = (long) blockX * (long) blockSizeX;
        final long fromY = (long) blockY * (long) blockSizeY;
        if (blockX < 0 || blockY < 0 || fromX >= a.sizeX() || fromY >= a.sizeY()) {
            throw new IndexOutOfBoundsException("Block (" + blockX + ", " + blockY + ") is out of the image "
                    + a.sizeX() + "x" + a.sizeY());
        }
        final ValidityMask mask = requireMask();
        final int sizeX = (int) Math.min(blockSizeX, a.sizeX() - fromX);
        final int sizeY = (int) Math.min(blockSizeY, a.sizeY() - fromY);
        final byte[] samples = readSamples(band, (int) fromX, (int) fromY, sizeX, sizeY);
        final byte[] result = new byte[Math.multiplyExact(blockSizeX, blockSizeY)];
        final int bytesPerSample = a.sampleType().bytesPerSample();
        final byte[] rows = new byte[Math.multiplyExact(result.length, bytesPerSample)];
        for (int y = 0; y < sizeY; y++) {
            System.arraycopy(samples, y * sizeX * bytesPerSample, rows, y * blockSizeX * bytesPerSample,
                    sizeX * bytesPerSample);
        }
        mask.evaluate(rows, ByteOrder.nativeOrder(), sizeX, sizeY, blockSizeX, result);
        return result;
    }

    public Matrix<UpdatablePArray> readMaskMatrix(int band) throws IOException {
        final Pds4Array a = array();
        final byte[] mask = readMask(band, 0, 0, a.sizeX(), a.sizeY());
        return Matrices.matrix((UpdatablePArray) SimpleMemoryModel.asUpdatableArray(mask), a.sizeX(), a.sizeY());
    }

    @Override
    public String toString() {
        return "PDS4 reader of " + labelFile + (array == null ? " (" + subdatasets.size() + " subdatasets)" :
                ": " + array);
    }

    private ValidityMask requireMask() {
        if (!hasMask()) {
            throw new IllegalStateException("Array " + array().descriptor().displayName()
                    + " has no validity mask: special constants " + array().specialConstants()
                    + " are not enough for masking");
        }
        return array().validityMask();
    }
}
