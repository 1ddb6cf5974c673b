package com.sommerph.zkkeyset.model.key;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sommerph.zkkeyset.codec.CanonicalInput;
import com.sommerph.zkkeyset.codec.CanonicalOutput;
import com.sommerph.zkkeyset.codec.MalformedKeyDataException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Verifying key for any of the three transaction types.
 * <p>
 * Exactly one of {@link #getTransfer()}, {@link #getFreeze()} and {@link #getMint()} is set,
 * as indicated by {@link #getVariant()}. Transfer and freeze keys report the size of the
 * wrapped key. Mint transactions always have one input and two outputs, so a mint key
 * reports {@code (1, 2)} whatever its content.
 * <p>
 * Canonical layout: one tag byte ({@link Variant#getTag()}) followed by the wrapped key.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TransactionVerifyingKey implements SizedKey {

    public static final int MINT_NUM_INPUTS = 1;
    public static final int MINT_NUM_OUTPUTS = 2;

    @Getter
    public enum Variant {
        TRANSFER(0),
        FREEZE(1),
        MINT(2);

        private final int tag;

        Variant(int tag) {
            this.tag = tag;
        }

        public static Variant fromTag(int tag) {
            for (Variant variant : values()) {
                if (variant.tag == tag) {
                    return variant;
                }
            }
            throw new MalformedKeyDataException("Unknown transaction verifying key tag: " + tag);
        }
    }

    @JsonIgnore
    private final Variant variant;
    private final TransferVerifyingKey transfer;
    private final FreezeVerifyingKey freeze;
    private final MintVerifyingKey mint;

    @JsonCreator
    TransactionVerifyingKey(@JsonProperty("transfer") TransferVerifyingKey transfer,
            @JsonProperty("freeze") FreezeVerifyingKey freeze,
            @JsonProperty("mint") MintVerifyingKey mint) {
        int present = (transfer != null ? 1 : 0) + (freeze != null ? 1 : 0) + (mint != null ? 1 : 0);
        if (present != 1) {
            throw new IllegalArgumentException("Exactly one of transfer, freeze or mint must be set, got " + present);
        }
        this.transfer = transfer;
        this.freeze = freeze;
        this.mint = mint;
        this.variant = transfer != null ? Variant.TRANSFER : freeze != null ? Variant.FREEZE : Variant.MINT;
    }

    public static TransactionVerifyingKey transfer(TransferVerifyingKey key) {
        return new TransactionVerifyingKey(key, null, null);
    }

    public static TransactionVerifyingKey freeze(FreezeVerifyingKey key) {
        return new TransactionVerifyingKey(null, key, null);
    }

    public static TransactionVerifyingKey mint(MintVerifyingKey key) {
        return new TransactionVerifyingKey(null, null, key);
    }

    public static TransactionVerifyingKey deserialize(CanonicalInput in) {
        return switch (Variant.fromTag(in.readU8())) {
            case TRANSFER -> transfer(TransferVerifyingKey.deserialize(in));
            case FREEZE -> freeze(FreezeVerifyingKey.deserialize(in));
            case MINT -> mint(MintVerifyingKey.deserialize(in));
        };
    }

    @Override
    @JsonIgnore
    public int getNumInputs() {
        return switch (variant) {
            case TRANSFER -> transfer.getNumInputs();
            case FREEZE -> freeze.getNumInputs();
            case MINT -> MINT_NUM_INPUTS;
        };
    }

    @Override
    @JsonIgnore
    public int getNumOutputs() {
        return switch (variant) {
            case TRANSFER -> transfer.getNumOutputs();
            case FREEZE -> freeze.getNumOutputs();
            case MINT -> MINT_NUM_OUTPUTS;
        };
    }

    @Override
    public void serialize(CanonicalOutput out) {
        out.writeU8(variant.getTag());
        switch (variant) {
            case TRANSFER -> transfer.serialize(out);
            case FREEZE -> freeze.serialize(out);
            case MINT -> mint.serialize(out);
        }
    }

}
