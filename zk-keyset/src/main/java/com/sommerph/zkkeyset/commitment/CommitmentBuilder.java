package com.sommerph.zkkeyset.commitment;

import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.util.Pack;

import java.nio.charset.StandardCharsets;

/**
 * Builds a {@link Commitment} by hashing a domain separation tag followed by the committed fields.
 * <p>
 * Variable-size fields are prefixed with their length as a u64 so that adjacent fields cannot be
 * confused with each other.
 */
public final class CommitmentBuilder {

    private final KeccakDigest hasher = new KeccakDigest(256);

    public CommitmentBuilder(String tag) {
        constantString(tag);
    }

    public CommitmentBuilder constantString(String value) {
        return fixedSizeBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    public CommitmentBuilder fixedSizeBytes(byte[] bytes) {
        hasher.update(bytes, 0, bytes.length);
        return this;
    }

    public CommitmentBuilder u64(long value) {
        return fixedSizeBytes(Pack.longToLittleEndian(value));
    }

    public CommitmentBuilder varSizeBytes(byte[] bytes) {
        return u64(bytes.length).fixedSizeBytes(bytes);
    }

    public Commitment finish() {
        byte[] digest = new byte[hasher.getDigestSize()];
        hasher.doFinal(digest, 0);
        return new Commitment(digest);
    }

}
