package com.sommerph.zkkeyset.codec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Reader for the canonical binary layout written by {@link CanonicalOutput}.
 * Every read is bounds checked; malformed input is reported as {@link MalformedKeyDataException}.
 */
public final class CanonicalInput {

    private final ByteBuffer buffer;

    public CanonicalInput(byte[] bytes) {
        this.buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Decodes a complete value from {@code bytes}, rejecting trailing data.
     */
    public static <T> T decode(byte[] bytes, CanonicalReader<T> reader) {
        CanonicalInput in = new CanonicalInput(bytes);
        T value = reader.read(in);
        if (in.remaining() != 0) {
            throw new MalformedKeyDataException(in.remaining() + " trailing bytes after canonical value");
        }
        return value;
    }

    public int readU8() {
        require(1);
        return buffer.get() & 0xFF;
    }

    public long readU64() {
        require(Long.BYTES);
        return buffer.getLong();
    }

    /**
     * Reads a u64 that must be representable as a non-negative {@code int}.
     */
    public int readSize() {
        long value = readU64();
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new MalformedKeyDataException("Size out of range: " + Long.toUnsignedString(value));
        }
        return (int) value;
    }

    public byte[] readBytes() {
        int length = readSize();
        require(length);
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    public int remaining() {
        return buffer.remaining();
    }

    private void require(int count) {
        if (buffer.remaining() < count) {
            throw new MalformedKeyDataException(
                    "Truncated input: need " + count + " bytes at offset " + buffer.position() + ", have " + buffer.remaining());
        }
    }

}
