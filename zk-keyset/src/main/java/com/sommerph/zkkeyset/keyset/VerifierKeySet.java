package com.sommerph.zkkeyset.keyset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sommerph.zkkeyset.codec.CanonicalInput;
import com.sommerph.zkkeyset.codec.CanonicalOutput;
import com.sommerph.zkkeyset.codec.CanonicalSerializable;
import com.sommerph.zkkeyset.codec.MalformedKeyDataException;
import com.sommerph.zkkeyset.commitment.Commitment;
import com.sommerph.zkkeyset.commitment.CommitmentBuilder;
import com.sommerph.zkkeyset.commitment.Committable;
import com.sommerph.zkkeyset.model.key.TransactionVerifyingKey;
import com.sommerph.zkkeyset.model.key.TransactionVerifyingKey.Variant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The verifying keys for every supported transaction. Its {@link #commit() commitment} is what
 * ledger state records to pin the key set in use.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class VerifierKeySet implements CanonicalSerializable, Committable {

    public static final String COMMITMENT_TAG = "VerifCRS Comm";

    private final TransactionVerifyingKey mint;
    private final KeySet<TransactionVerifyingKey> xfr;
    private final KeySet<TransactionVerifyingKey> freeze;

    @JsonCreator
    public VerifierKeySet(@JsonProperty("mint") TransactionVerifyingKey mint,
            @JsonProperty("xfr") KeySet<TransactionVerifyingKey> xfr,
            @JsonProperty("freeze") KeySet<TransactionVerifyingKey> freeze) {
        if (mint == null || xfr == null || freeze == null) {
            throw new IllegalArgumentException("Verifier key set needs mint, xfr and freeze keys");
        }
        if (xfr.getOrder() != freeze.getOrder()) {
            throw new IllegalArgumentException("Transfer and freeze keys use different orders: "
                    + xfr.getOrder().getName() + " and " + freeze.getOrder().getName());
        }
        if (mint.getVariant() != Variant.MINT) {
            throw new IllegalArgumentException("Mint key is a " + mint.getVariant() + " key");
        }
        requireVariant(xfr, Variant.TRANSFER);
        requireVariant(freeze, Variant.FREEZE);
        this.mint = mint;
        this.xfr = xfr;
        this.freeze = freeze;
    }

    public static VerifierKeySet deserialize(CanonicalInput in, KeyOrder order) {
        TransactionVerifyingKey mint = TransactionVerifyingKey.deserialize(in);
        KeySet<TransactionVerifyingKey> xfr = KeySet.deserialize(in, order, TransactionVerifyingKey::deserialize);
        KeySet<TransactionVerifyingKey> freeze = KeySet.deserialize(in, order, TransactionVerifyingKey::deserialize);
        try {
            return new VerifierKeySet(mint, xfr, freeze);
        } catch (IllegalArgumentException e) {
            throw new MalformedKeyDataException("Invalid verifier key set: " + e.getMessage(), e);
        }
    }

    private static void requireVariant(KeySet<TransactionVerifyingKey> keys, Variant variant) {
        for (TransactionVerifyingKey key : keys) {
            if (key.getVariant() != variant) {
                throw new IllegalArgumentException("Expected only " + variant + " keys, found a " + key.getVariant()
                        + " key of size " + key.getSize());
            }
        }
    }

    @JsonIgnore
    public KeyOrder getOrder() {
        return xfr.getOrder();
    }

    @Override
    public void serialize(CanonicalOutput out) {
        out.write(mint).write(xfr).write(freeze);
    }

    /**
     * Commits to the canonical encoding of this key set. Equal key sets always give equal commitments.
     */
    @Override
    public Commitment commit() {
        byte[] bytes;
        try {
            bytes = toCanonicalBytes();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Verifier key set could not be serialized for commitment", e);
        }
        return new CommitmentBuilder(COMMITMENT_TAG).varSizeBytes(bytes).finish();
    }

}
