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

import net.algart.matrices.pds4.layout.LayoutPlan;
import org.scijava.io.handle.BytesHandle;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.handle.FileHandle;
import org.scijava.io.location.BytesLocation;
import org.scijava.io.location.FileLocation;
import org.scijava.io.location.Location;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Raw image file, containing samples of one PDS4 array, with random access according to its {@link LayoutPlan}.
 *
 * <p>A newly created file is {@link State#UNINITIALIZED uninitialized}: it is not filled by anything
 * until the first writing. Every method that writes data calls {@link #requireInitialized()} first:
 * this method sets the file length, filling it with the no-data value, if it is specified and non-zero.
 * So, the areas that were never written are always well-defined.
 *
 * <p>This class is not thread-safe.
 */
public final class Pds4ImageFile implements Closeable {
    public enum State {
        UNINITIALIZED,
        INITIALIZED
    }

    private static final System.Logger LOG = System.getLogger(Pds4ImageFile.class.getName());

    private final DataHandle<? extends Location> handle;
    private final String description;
    private final LayoutPlan plan;
    private final Pds4DataType dataType;
    private final boolean writable;
    private State state;
    private OptionalDouble fillValue = OptionalDouble.empty();

    private Pds4ImageFile(
            DataHandle<? extends Location> handle,
            String description,
            LayoutPlan plan,
            Pds4DataType dataType,
            boolean writable,
            State state) {
        this.handle = Objects.requireNonNull(handle, "Null handle");
        this.description = Objects.requireNonNull(description, "Null description");
        this.plan = Objects.requireNonNull(plan, "Null plan");
        this.dataType = Objects.requireNonNull(dataType, "Null dataType");
        if (!dataType.isSupported()) {
            throw new IllegalArgumentException("Data type " + dataType + " is not supported");
        }
        if (dataType.bytesPerSample() != plan.elementSize()) {
            throw new IllegalArgumentException("Element size " + plan.elementSize() + " of the layout "
                    + "does not match " + dataType + " data type");
        }
        this.writable = writable;
        this.state = state;
    }

    public static Pds4ImageFile openForReading(Path file, LayoutPlan plan, Pds4DataType dataType)
            throws IOException {
        final DataHandle<Location> handle = getExistingFileHandle(file);
        return new Pds4ImageFile(handle, file.toString(), plan, dataType, false, State.INITIALIZED);
    }

    /**
     * Creates new image file. If the file already exists, it is deleted.
     *
     * @param file     path to the new file.
     * @param plan     layout of samples.
     * @param dataType encoding of samples.
     * @return new uninitialized image file.
     * @throws IOException in a case of I/O error.
     */
    public static Pds4ImageFile create(Path file, LayoutPlan plan, Pds4DataType dataType) throws IOException {
        Objects.requireNonNull(file, "Null file");
        Files.deleteIfExists(file);
        return new Pds4ImageFile(getFileHandle(file, "rw"), file.toString(), plan, dataType, true, State.UNINITIALIZED);
    }

    /**
     * Opens the image file in memory: useful mostly for testing.
     *
     * @param bytes    file content; if the file is modified, its content will be written into this location.
     * @param plan     layout of samples.
     * @param dataType encoding of samples.
     * @param writable whether the data may be written.
     * @return image file in memory.
     */
    public static Pds4ImageFile openInMemory(
            BytesLocation bytes,
            LayoutPlan plan,
            Pds4DataType dataType,
            boolean writable) {
        return new Pds4ImageFile(getBytesHandle(bytes), "memory bytes", plan, dataType, writable,
                writable ? State.UNINITIALIZED : State.INITIALIZED);
    }

    public LayoutPlan plan() {
        return plan;
    }

    public Pds4DataType dataType() {
        return dataType;
    }

    public boolean isWritable() {
        return writable;
    }

    public State state() {
        return state;
    }

    public OptionalDouble fillValue() {
        return fillValue;
    }

    /**
     * Sets the value, which fills the file while initialization.
     *
     * @param fillValue no-data value or empty for zero filling.
     * @return a reference to this object.
     * @throws IllegalStateException if the file is already initialized.
     */
    public Pds4ImageFile setFillValue(OptionalDouble fillValue) {
        Objects.requireNonNull(fillValue, "Null fillValue");
        if (state != State.UNINITIALIZED) {
            throw new IllegalStateException("Cannot change fill value of already initialized " + description);
        }
        this.fillValue = fillValue;
        return this;
    }

    public long fileLength() throws IOException {
        return handle.length();
    }

    /**
     * Transits this file into {@link State#INITIALIZED} state. If the file is uninitialized,
     * it is resized to the full size of the array; when there is a non-zero fill value,
     * all samples are filled by it.
     *
     * @throws IOException in a case of I/O error.
     */
    public void requireInitialized() throws IOException {
        if (state == State.INITIALIZED) {
            return;
        }
        requireWritable();
        final long length = plan.minOffset() + plan.addressedSpan();
        if (fillValue.isEmpty() || fillValue.getAsDouble() == 0.0) {
            handle.setLength(length);
            LOG.log(System.Logger.Level.DEBUG, () -> "Image file " + description + " resized to " + length);
        } else {
            fill(length, fillValue.getAsDouble());
        }
        state = State.INITIALIZED;
    }

    /**
     * Marks this file as initialized without filling: used when all samples will be written anyway.
     */
    public void markInitialized() {
        requireWritable();
        state = State.INITIALIZED;
    }

    /**
     * Reads the rectangular block of samples of one band. The result is stored line by line
     * in the native byte order of the current JVM: bytes are swapped when necessary.
     * Complex samples consist of two components (real and imaginary parts), every of them is swapped
     * separately.
     *
     * @param band  index of the band.
     * @param fromX starting sample in every line.
     * @param fromY starting line.
     * @param sizeX number of samples in every line.
     * @param sizeY number of lines.
     * @return samples of the block.
     * @throws IOException in a case of I/O error.
     */
    public byte[] readSamples(int band, int fromX, int fromY, int sizeX, int sizeY) throws IOException {
        checkBlock(band, fromX, fromY, sizeX, sizeY);
        final int elementSize = plan.elementSize();
        final int rowLength = Math.multiplyExact(sizeX, elementSize);
        final byte[] result = new byte[Math.multiplyExact(rowLength, sizeY)];
        if (sizeX == 0 || sizeY == 0) {
            return result;
        }
        final byte[] span = plan.isContiguousLine() ? null : new byte[spanLength(sizeX)];
        for (int y = 0; y < sizeY; y++) {
            handle.seek(plan.offset(band, fromY + y, fromX));
            if (span == null) {
                handle.readFully(result, y * rowLength, rowLength);
            } else {
                handle.readFully(span);
                for (int x = 0, disp = y * rowLength; x < sizeX; x++, disp += elementSize) {
                    System.arraycopy(span, (int) (x * plan.pixelStride()), result, disp, elementSize);
                }
            }
        }
        if (dataType.needsSwap()) {
            swapBytes(result, dataType.sampleType().bytesPerComponent());
        }
        return result;
    }

    /**
     * Writes the rectangular block of samples of one band. The samples must be stored line by line
     * in the native byte order of the current JVM.
     *
     * @param band    index of the band.
     * @param fromX   starting sample in every line.
     * @param fromY   starting line.
     * @param sizeX   number of samples in every line.
     * @param sizeY   number of lines.
     * @param samples samples of the block.
     * @throws IOException in a case of I/O error.
     */
    public void writeSamples(int band, int fromX, int fromY, int sizeX, int sizeY, byte[] samples)
            throws IOException {
        Objects.requireNonNull(samples, "Null samples");
        checkBlock(band, fromX, fromY, sizeX, sizeY);
        final int elementSize = plan.elementSize();
        final int rowLength = Math.multiplyExact(sizeX, elementSize);
        if (samples.length < (long) rowLength * (long) sizeY) {
            throw new IllegalArgumentException("Insufficient length of samples array: " + samples.length
                    + " < " + sizeX + "*" + sizeY + "*" + elementSize);
        }
        requireInitialized();
        if (sizeX == 0 || sizeY == 0) {
            return;
        }
        byte[] data = samples;
        if (dataType.needsSwap()) {
            data = Arrays.copyOf(samples, rowLength * sizeY);
            swapBytes(data, dataType.sampleType().bytesPerComponent());
        }
        final byte[] span = plan.isContiguousLine() ? null : new byte[spanLength(sizeX)];
        for (int y = 0; y < sizeY; y++) {
            final long position = plan.offset(band, fromY + y, fromX);
            handle.seek(position);
            if (span == null) {
                handle.write(data, y * rowLength, rowLength);
            } else {
                handle.readFully(span);
                for (int x = 0, disp = y * rowLength; x < sizeX; x++, disp += elementSize) {
                    System.arraycopy(data, disp, span, (int) (x * plan.pixelStride()), elementSize);
                }
                handle.seek(position);
                handle.write(span);
            }
        }
    }

    public ByteOrder byteOrder() {
        return dataType.byteOrder();
    }

    @Override
    public void close() throws IOException {
        handle.close();
    }

    @Override
    public String toString() {
        return "image file " + description + " (" + state.name().toLowerCase(Locale.ROOT) + ", " + dataType + ", " + plan + ")";
    }

    public static DataHandle<Location> getExistingFileHandle(Path file) throws FileNotFoundException {
        Objects.requireNonNull(file, "Null file");
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("File " + file
                    + (Files.exists(file) ? " is not a regular file" : " does not exist"));
        }
        return getFileHandle(file, "r");
    }

    /**
     * Warning: you should never call {@link DataHandle#set(Object)} method of the returned result!
     * It can lead to unpredictable <code>ClassCastException</code>.
     */
    @SuppressWarnings("rawtypes, unchecked")
    static DataHandle<Location> getFileHandle(Path file, String mode) {
        Objects.requireNonNull(file, "Null file");
        Objects.requireNonNull(mode, "Null mode");
        FileHandle fileHandle = new FileHandle(new FileLocation(file.toFile()));
        fileHandle.setMode(mode);
        fileHandle.setLittleEndian(true);
        // - samples are swapped by this class itself, but all new PDS4 files are little-endian
        return (DataHandle) fileHandle;
    }

    /**
     * Warning: you should never call {@link DataHandle#set(Object)} method of the returned result!
     * It can lead to unpredictable <code>ClassCastException</code>.
     */
    @SuppressWarnings("rawtypes, unchecked")
    static DataHandle<Location> getBytesHandle(BytesLocation bytesLocation) {
        Objects.requireNonNull(bytesLocation, "Null bytesLocation");
        BytesHandle bytesHandle = new BytesHandle(bytesLocation);
        return (DataHandle) bytesHandle;
    }

    static void swapBytes(byte[] data, int bytesPerElement) {
        if (bytesPerElement <= 1) {
            return;
        }
        for (int p = 0; p + bytesPerElement <= data.length; p += bytesPerElement) {
            for (int i = p, j = p + bytesPerElement - 1; i < j; i++, j--) {
                final byte v = data[i];
                data[i] = data[j];
                data[j] = v;
            }
        }
    }

    private void fill(long length, double value) throws IOException {
        final int elementSize = plan.elementSize();
        final byte[] sample = new byte[elementSize];
        dataType.sampleType().writeSample(sample, 0, value, dataType.byteOrder());
        final long totalElements = length / elementSize;
        final int chunkElements = (int) Math.min(totalElements,
                Math.max(1, (long) plan.samples() * (long) plan.bands()));
        // - one line of all bands
        final byte[] chunk = new byte[chunkElements * elementSize];
        for (int k = 0; k < chunk.length; k += elementSize) {
            System.arraycopy(sample, 0, chunk, k, elementSize);
        }
        handle.seek(0);
        for (long written = 0; written < totalElements; ) {
            final int n = (int) Math.min(chunkElements, totalElements - written);
            handle.write(chunk, 0, n * elementSize);
            written += n;
        }
        final int tail = (int) (length - totalElements * elementSize);
        if (tail > 0) {
            handle.write(new byte[tail]);
        }
        LOG.log(System.Logger.Level.DEBUG, () -> "Image file " + description + " filled by "
                + Pds4Tools.formatDouble(value) + " (" + length + " bytes)");
    }

    private int spanLength(int sizeX) {
        final long result = (sizeX - 1) * plan.pixelStride() + plan.elementSize();
        if (result > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large block width " + sizeX + " for " + plan);
        }
        return (int) result;
    }

    private void checkBlock(int band, int fromX, int fromY, int sizeX, int sizeY) {
        if (band < 0 || band >= plan.bands()) {
            throw new IndexOutOfBoundsException("Band index " + band + " is out of range 0.."
                    + (plan.bands() - 1));
        }
        if (sizeX < 0 || sizeY < 0) {
            throw new IllegalArgumentException("Negative block sizes " + sizeX + "x" + sizeY);
        }
        if (fromX < 0 || fromY < 0 || fromX > plan.samples() - sizeX || fromY > plan.lines() - sizeY) {
            throw new IndexOutOfBoundsException("Block " + sizeX + "x" + sizeY + " at (" + fromX + ", " + fromY
                    + ") is out of the image " + plan.samples() + "x" + plan.lines());
        }
    }

    private void requireWritable() {
        if (!writable) {
            throw new IllegalStateException("Image file " + description + " is opened for reading only");
        }
    }
}
