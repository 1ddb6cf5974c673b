package com.sommerph.zkkeyset.commitment;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import org.bouncycastle.util.encoders.Hex;

/**
 * A 32-byte Keccak-256 commitment.
 */
@EqualsAndHashCode
public final class Commitment {

    public static final int LENGTH = 32;

    private final byte[] digest;

    Commitment(byte[] digest) {
        if (digest.length != LENGTH) {
            throw new IllegalArgumentException("Commitment must be " + LENGTH + " bytes, got " + digest.length);
        }
        this.digest = digest.clone();
    }

    public static Commitment fromHex(String hex) {
        return new Commitment(Hex.decode(hex));
    }

    public byte[] toByteArray() {
        return digest.clone();
    }

    @JsonValue
    public String toHex() {
        return Hex.toHexString(digest);
    }

    @Override
    public String toString() {
        return toHex();
    }

}
