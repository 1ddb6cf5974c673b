package com.sommerph.zkkeyset.codec;

import org.bouncycastle.util.Pack;

import java.io.ByteArrayOutputStream;

/**
 * Append-only writer for the canonical binary layout.
 * <p>
 * All integers are written as unsigned 64-bit little-endian values, byte strings are
 * prefixed with their length.
 */
public final class CanonicalOutput {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public CanonicalOutput writeU8(int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("Value does not fit in one byte: " + value);
        }
        out.write(value);
        return this;
    }

    public CanonicalOutput writeU64(long value) {
        out.writeBytes(Pack.longToLittleEndian(value));
        return this;
    }

    public CanonicalOutput writeSize(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Size must not be negative: " + value);
        }
        return writeU64(value);
    }

    public CanonicalOutput writeBytes(byte[] bytes) {
        writeSize(bytes.length);
        out.writeBytes(bytes);
        return this;
    }

    public CanonicalOutput write(CanonicalSerializable value) {
        value.serialize(this);
        return this;
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }

}
