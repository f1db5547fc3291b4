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

import java.nio.ByteOrder;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Values of <code>Element_Array.data_type</code>: the closed PDS4 vocabulary of sample encodings.
 *
 * <p>Some encodings are known, but not supported by this library:
 * 64-bit integers and bit strings. For them {@link #sampleType()} returns <code>null</code>.
 */
public enum Pds4DataType {
    COMPLEX_LSB16("ComplexLSB16", Pds4SampleType.COMPLEX_DOUBLE, ByteOrder.LITTLE_ENDIAN),
    COMPLEX_MSB16("ComplexMSB16", Pds4SampleType.COMPLEX_DOUBLE, ByteOrder.BIG_ENDIAN),
    COMPLEX_LSB8("ComplexLSB8", Pds4SampleType.COMPLEX_FLOAT, ByteOrder.LITTLE_ENDIAN),
    COMPLEX_MSB8("ComplexMSB8", Pds4SampleType.COMPLEX_FLOAT, ByteOrder.BIG_ENDIAN),
    IEEE754_LSB_DOUBLE("IEEE754LSBDouble", Pds4SampleType.DOUBLE, ByteOrder.LITTLE_ENDIAN),
    IEEE754_MSB_DOUBLE("IEEE754MSBDouble", Pds4SampleType.DOUBLE, ByteOrder.BIG_ENDIAN),
    IEEE754_LSB_SINGLE("IEEE754LSBSingle", Pds4SampleType.FLOAT, ByteOrder.LITTLE_ENDIAN),
    IEEE754_MSB_SINGLE("IEEE754MSBSingle", Pds4SampleType.FLOAT, ByteOrder.BIG_ENDIAN),
    SIGNED_BYTE("SignedByte", Pds4SampleType.INT8, ByteOrder.LITTLE_ENDIAN),
    SIGNED_LSB2("SignedLSB2", Pds4SampleType.INT16, ByteOrder.LITTLE_ENDIAN),
    SIGNED_MSB2("SignedMSB2", Pds4SampleType.INT16, ByteOrder.BIG_ENDIAN),
    SIGNED_LSB4("SignedLSB4", Pds4SampleType.INT32, ByteOrder.LITTLE_ENDIAN),
    SIGNED_MSB4("SignedMSB4", Pds4SampleType.INT32, ByteOrder.BIG_ENDIAN),
    SIGNED_LSB8("SignedLSB8", null, ByteOrder.LITTLE_ENDIAN),
    SIGNED_MSB8("SignedMSB8", null, ByteOrder.BIG_ENDIAN),
    SIGNED_BIT_STRING("SignedBitString", null, ByteOrder.BIG_ENDIAN),
    UNSIGNED_BYTE("UnsignedByte", Pds4SampleType.UINT8, ByteOrder.LITTLE_ENDIAN),
    UNSIGNED_LSB2("UnsignedLSB2", Pds4SampleType.UINT16, ByteOrder.LITTLE_ENDIAN),
    UNSIGNED_MSB2("UnsignedMSB2", Pds4SampleType.UINT16, ByteOrder.BIG_ENDIAN),
    UNSIGNED_LSB4("UnsignedLSB4", Pds4SampleType.UINT32, ByteOrder.LITTLE_ENDIAN),
    UNSIGNED_MSB4("UnsignedMSB4", Pds4SampleType.UINT32, ByteOrder.BIG_ENDIAN),
    UNSIGNED_LSB8("UnsignedLSB8", null, ByteOrder.LITTLE_ENDIAN),
    UNSIGNED_MSB8("UnsignedMSB8", null, ByteOrder.BIG_ENDIAN),
    UNSIGNED_BIT_STRING("UnsignedBitString", null, ByteOrder.BIG_ENDIAN);

    private static final Map<String, Pds4DataType> LOOKUP = new HashMap<>();

    static {
        for (Pds4DataType v : values()) {
            LOOKUP.put(v.tag.toLowerCase(Locale.ROOT), v);
        }
    }

    private final String tag;
    private final Pds4SampleType sampleType;
    private final ByteOrder byteOrder;

    Pds4DataType(String tag, Pds4SampleType sampleType, ByteOrder byteOrder) {
        this.tag = tag;
        this.sampleType = sampleType;
        this.byteOrder = byteOrder;
    }

    public String tag() {
        return tag;
    }

    /**
     * Returns the numeric kind of samples or <code>null</code> if this encoding is not supported.
     *
     * @return sample type or <code>null</code>.
     */
    public Pds4SampleType sampleType() {
        return sampleType;
    }

    public boolean isSupported() {
        return sampleType != null;
    }

    public ByteOrder byteOrder() {
        return byteOrder;
    }

    public boolean isSignedByte() {
        return this == SIGNED_BYTE;
    }

    public int bytesPerSample() {
        return requireSupported().bytesPerSample();
    }

    /**
     * Returns <code>true</code> if the bytes of samples must be reversed to be interpreted
     * in the native byte order of the current JVM.
     *
     * @return whether byte swapping is necessary.
     */
    public boolean needsSwap() {
        return requireSupported().bytesPerSample() > 1 && byteOrder != ByteOrder.nativeOrder();
    }

    /**
     * Returns the encoding, used while writing arrays with the given sample type: always little-endian.
     *
     * @param sampleType numeric kind of samples.
     * @return the corresponding LSB data type.
     */
    public static Pds4DataType forWriting(Pds4SampleType sampleType) {
        Objects.requireNonNull(sampleType, "Null sampleType");
        return switch (sampleType) {
            case INT8 -> SIGNED_BYTE;
            case UINT8 -> UNSIGNED_BYTE;
            case INT16 -> SIGNED_LSB2;
            case UINT16 -> UNSIGNED_LSB2;
            case INT32 -> SIGNED_LSB4;
            case UINT32 -> UNSIGNED_LSB4;
            case FLOAT -> IEEE754_LSB_SINGLE;
            case DOUBLE -> IEEE754_LSB_DOUBLE;
            case COMPLEX_FLOAT -> COMPLEX_LSB8;
            case COMPLEX_DOUBLE -> COMPLEX_LSB16;
        };
    }

    public static Optional<Pds4DataType> fromTag(String tag) {
        return tag == null ? Optional.empty() : Optional.ofNullable(LOOKUP.get(tag.toLowerCase(Locale.ROOT)));
    }

    @Override
    public String toString() {
        return tag;
    }

    private Pds4SampleType requireSupported() {
        if (sampleType == null) {
            throw new IllegalStateException("Data type " + tag + " is not supported");
        }
        return sampleType;
    }
}
