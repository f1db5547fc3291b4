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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Numeric kind of samples in a PDS4 array, independent of the byte order.
 * Complex types are stored as pairs (real, imaginary) of floating-point values;
 * their Java arrays contain 2 elements per sample.
 */
public enum Pds4SampleType {
    INT8("int8", 1, byte.class, true, false),
    UINT8("uint8", 1, byte.class, false, false),
    INT16("int16", 2, short.class, true, false),
    UINT16("uint16", 2, short.class, false, false),
    INT32("int32", 4, int.class, true, false),
    UINT32("uint32", 4, int.class, false, false),
    FLOAT("float", 4, float.class, true, false),
    DOUBLE("double", 8, double.class, true, false),
    COMPLEX_FLOAT("complex-float", 8, float.class, true, true),
    COMPLEX_DOUBLE("complex-double", 16, double.class, true, true);

    private final String prettyName;
    private final int bytesPerSample;
    private final Class<?> elementType;
    private final boolean signed;
    private final boolean complex;

    Pds4SampleType(String prettyName, int bytesPerSample, Class<?> elementType, boolean signed, boolean complex) {
        this.prettyName = prettyName;
        this.bytesPerSample = bytesPerSample;
        this.elementType = elementType;
        this.signed = signed;
        this.complex = complex;
    }

    public String prettyName() {
        return prettyName;
    }

    public int bytesPerSample() {
        return bytesPerSample;
    }

    /**
     * Size of one Java array element: for complex types it is the half of {@link #bytesPerSample()}.
     *
     * @return number of bytes in one component of the sample.
     */
    public int bytesPerComponent() {
        return complex ? bytesPerSample >> 1 : bytesPerSample;
    }

    public Class<?> elementType() {
        return elementType;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isComplex() {
        return complex;
    }

    public boolean isFloatingPoint() {
        return elementType == float.class || elementType == double.class;
    }

    /**
     * Converts the given value to the precision of this type, as if it would be stored in a sample
     * and read back. Integer types round to the nearest integer and saturate at the range bounds
     * (NaN becomes 0); <code>FLOAT</code> rounds to <code>float</code> precision.
     * For complex types, the real part is converted.
     *
     * @param value some value.
     * @return the same value in the precision of this sample type.
     */
    public double castToSampleWidth(double value) {
        return switch (this) {
            case INT8 -> clampRound(value, Byte.MIN_VALUE, Byte.MAX_VALUE);
            case UINT8 -> clampRound(value, 0, 0xFF);
            case INT16 -> clampRound(value, Short.MIN_VALUE, Short.MAX_VALUE);
            case UINT16 -> clampRound(value, 0, 0xFFFF);
            case INT32 -> clampRound(value, Integer.MIN_VALUE, Integer.MAX_VALUE);
            case UINT32 -> clampRound(value, 0, 0xFFFFFFFFL);
            case FLOAT, COMPLEX_FLOAT -> (float) value;
            case DOUBLE, COMPLEX_DOUBLE -> value;
        };
    }

    /**
     * Reads one sample (for complex types, its real part) from the byte array.
     *
     * @param bytes     bytes of samples.
     * @param offset    offset of the sample in bytes.
     * @param byteOrder byte order of the samples.
     * @return the sample value.
     */
    public double readSample(byte[] bytes, int offset, ByteOrder byteOrder) {
        Objects.requireNonNull(bytes, "Null bytes");
        Objects.requireNonNull(byteOrder, "Null byteOrder");
        return readSample(ByteBuffer.wrap(bytes).order(byteOrder), offset);
    }

    public double readSample(ByteBuffer bb, int offset) {
        return switch (this) {
            case INT8 -> bb.get(offset);
            case UINT8 -> bb.get(offset) & 0xFF;
            case INT16 -> bb.getShort(offset);
            case UINT16 -> bb.getShort(offset) & 0xFFFF;
            case INT32 -> bb.getInt(offset);
            case UINT32 -> bb.getInt(offset) & 0xFFFFFFFFL;
            case FLOAT, COMPLEX_FLOAT -> bb.getFloat(offset);
            case DOUBLE, COMPLEX_DOUBLE -> bb.getDouble(offset);
        };
    }

    /**
     * Writes the value, cast by {@link #castToSampleWidth(double)}, into the byte array.
     * For complex types, the value becomes the real part and the imaginary part is zero.
     *
     * @param bytes     resulting bytes.
     * @param offset    offset of the sample in bytes.
     * @param value     value to store.
     * @param byteOrder byte order of the samples.
     */
    public void writeSample(byte[] bytes, int offset, double value, ByteOrder byteOrder) {
        Objects.requireNonNull(bytes, "Null bytes");
        Objects.requireNonNull(byteOrder, "Null byteOrder");
        final ByteBuffer bb = ByteBuffer.wrap(bytes).order(byteOrder);
        final double v = castToSampleWidth(value);
        switch (this) {
            case INT8, UINT8 -> bb.put(offset, (byte) (long) v);
            case INT16, UINT16 -> bb.putShort(offset, (short) (long) v);
            case INT32, UINT32 -> bb.putInt(offset, (int) (long) v);
            case FLOAT -> bb.putFloat(offset, (float) v);
            case DOUBLE -> bb.putDouble(offset, v);
            case COMPLEX_FLOAT -> {
                bb.putFloat(offset, (float) v);
                bb.putFloat(offset + 4, 0.0f);
            }
            case COMPLEX_DOUBLE -> {
                bb.putDouble(offset, v);
                bb.putDouble(offset + 8, 0.0);
            }
        }
    }

    public Object javaArray(byte[] bytes, ByteOrder byteOrder) {
        Objects.requireNonNull(bytes, "Null bytes");
        Objects.requireNonNull(byteOrder, "Null byteOrder");
        if (bytes.length % bytesPerSample != 0) {
            throw new IllegalArgumentException("Length of byte array " + bytes.length
                    + " is not a multiple of " + bytesPerSample + " bytes per " + prettyName + " sample");
        }
        if (elementType == byte.class) {
            return bytes;
        }
        final ByteBuffer bb = ByteBuffer.wrap(bytes).order(byteOrder);
        final int n = bytes.length / bytesPerComponent();
        if (elementType == short.class) {
            final short[] result = new short[n];
            bb.asShortBuffer().get(result);
            return result;
        } else if (elementType == int.class) {
            final int[] result = new int[n];
            bb.asIntBuffer().get(result);
            return result;
        } else if (elementType == float.class) {
            final float[] result = new float[n];
            bb.asFloatBuffer().get(result);
            return result;
        } else {
            final double[] result = new double[n];
            bb.asDoubleBuffer().get(result);
            return result;
        }
    }

    public static byte[] bytes(Object javaArray, ByteOrder byteOrder) {
        Objects.requireNonNull(javaArray, "Null javaArray");
        Objects.requireNonNull(byteOrder, "Null byteOrder");
        if (javaArray instanceof byte[] a) {
            return a;
        } else if (javaArray instanceof short[] a) {
            final ByteBuffer bb = ByteBuffer.allocate(2 * a.length).order(byteOrder);
            bb.asShortBuffer().put(a);
            return bb.array();
        } else if (javaArray instanceof int[] a) {
            final ByteBuffer bb = ByteBuffer.allocate(4 * a.length).order(byteOrder);
            bb.asIntBuffer().put(a);
            return bb.array();
        } else if (javaArray instanceof float[] a) {
            final ByteBuffer bb = ByteBuffer.allocate(4 * a.length).order(byteOrder);
            bb.asFloatBuffer().put(a);
            return bb.array();
        } else if (javaArray instanceof double[] a) {
            final ByteBuffer bb = ByteBuffer.allocate(8 * a.length).order(byteOrder);
            bb.asDoubleBuffer().put(a);
            return bb.array();
        } else {
            throw new IllegalArgumentException("The specified javaArray is not a supported array: "
                    + javaArray.getClass());
        }
    }

    public static Pds4SampleType of(Class<?> elementType, boolean signedIntegers) {
        Objects.requireNonNull(elementType, "Null elementType");
        if (elementType == byte.class) {
            return signedIntegers ? INT8 : UINT8;
        } else if (elementType == short.class) {
            return signedIntegers ? INT16 : UINT16;
        } else if (elementType == int.class) {
            return signedIntegers ? INT32 : UINT32;
        } else if (elementType == float.class) {
            return FLOAT;
        } else if (elementType == double.class) {
            return DOUBLE;
        } else {
            throw new IllegalArgumentException("Element type " + elementType
                    + " is not a supported PDS4 sample type");
        }
    }

    /**
     * Returns AlgART matrix <code>sizeX*sizeY</code>, backed by the given Java array.
     * For complex types, the result is 3-dimensional <code>2*sizeX*sizeY</code> matrix:
     * the first dimension separates real and imaginary parts.
     *
     * @param javaArray array of samples, returned by {@link #javaArray(byte[], ByteOrder)}.
     * @param sizeX     number of samples in every line.
     * @param sizeY     number of lines.
     * @return matrix view of the samples.
     */
    public Matrix<UpdatablePArray> asMatrix(Object javaArray, int sizeX, int sizeY) {
        Objects.requireNonNull(javaArray, "Null javaArray");
        if (javaArray.getClass().getComponentType() != elementType) {
            throw new IllegalArgumentException("Java array " + javaArray.getClass().getSimpleName()
                    + " does not correspond to " + prettyName + " sample type");
        }
        if (sizeX < 0 || sizeY < 0) {
            throw new IllegalArgumentException("Negative sizeX = " + sizeX + " or sizeY = " + sizeY);
        }
        final UpdatablePArray array = (UpdatablePArray) SimpleMemoryModel.asUpdatableArray(javaArray);
        return complex ?
                Matrices.matrix(array, 2, sizeX, sizeY) :
                Matrices.matrix(array, sizeX, sizeY);
    }

    @Override
    public String toString() {
        return prettyName;
    }

    private static double clampRound(double value, long min, long max) {
        if (Double.isNaN(value)) {
            return 0;
        }
        if (value <= min) {
            return min;
        }
        if (value >= max) {
            return max;
        }
        return value >= 0.0 ? Math.floor(value + 0.5) : Math.ceil(value - 0.5);
    }
}
