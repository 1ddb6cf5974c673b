package com.sommerph.zkkeyset.keyset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sommerph.zkkeyset.codec.CanonicalInput;
import com.sommerph.zkkeyset.codec.CanonicalOutput;
import com.sommerph.zkkeyset.codec.CanonicalSerializable;
import com.sommerph.zkkeyset.codec.MalformedKeyDataException;
import com.sommerph.zkkeyset.model.key.FreezeProvingKey;
import com.sommerph.zkkeyset.model.key.MintProvingKey;
import com.sommerph.zkkeyset.model.key.TransferProvingKey;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The proving keys for every supported transaction: one mint key and transfer and freeze keys
 * for each supported size.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ProverKeySet implements CanonicalSerializable {

    private final MintProvingKey mint;
    private final KeySet<TransferProvingKey> xfr;
    private final KeySet<FreezeProvingKey> freeze;

    @JsonCreator
    public ProverKeySet(@JsonProperty("mint") MintProvingKey mint,
            @JsonProperty("xfr") KeySet<TransferProvingKey> xfr,
            @JsonProperty("freeze") KeySet<FreezeProvingKey> freeze) {
        if (mint == null || xfr == null || freeze == null) {
            throw new IllegalArgumentException("Prover key set needs mint, xfr and freeze keys");
        }
        if (xfr.getOrder() != freeze.getOrder()) {
            throw new IllegalArgumentException("Transfer and freeze keys use different orders: "
                    + xfr.getOrder().getName() + " and " + freeze.getOrder().getName());
        }
        this.mint = mint;
        this.xfr = xfr;
        this.freeze = freeze;
    }

    public static ProverKeySet deserialize(CanonicalInput in, KeyOrder order) {
        MintProvingKey mint = MintProvingKey.deserialize(in);
        KeySet<TransferProvingKey> xfr = KeySet.deserialize(in, order, TransferProvingKey::deserialize);
        KeySet<FreezeProvingKey> freeze = KeySet.deserialize(in, order, FreezeProvingKey::deserialize);
        try {
            return new ProverKeySet(mint, xfr, freeze);
        } catch (IllegalArgumentException e) {
            throw new MalformedKeyDataException("Invalid prover key set: " + e.getMessage(), e);
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

}
