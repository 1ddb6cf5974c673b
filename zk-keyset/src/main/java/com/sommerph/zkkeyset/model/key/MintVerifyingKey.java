package com.sommerph.zkkeyset.model.key;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sommerph.zkkeyset.codec.CanonicalInput;
import com.sommerph.zkkeyset.codec.CanonicalOutput;
import com.sommerph.zkkeyset.codec.CanonicalSerializable;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString
@EqualsAndHashCode
public final class MintVerifyingKey implements CanonicalSerializable {

    @ToString.Exclude
    private final byte[] keyBytes;

    @JsonCreator
    public MintVerifyingKey(@JsonProperty("keyBytes") byte[] keyBytes) {
        if (keyBytes == null) {
            throw new IllegalArgumentException("mint verifying key material must not be null");
        }
        this.keyBytes = keyBytes.clone();
    }

    public static MintVerifyingKey deserialize(CanonicalInput in) {
        return new MintVerifyingKey(in.readBytes());
    }

    public byte[] getKeyBytes() {
        return keyBytes.clone();
    }

    @Override
    public void serialize(CanonicalOutput out) {
        out.writeBytes(keyBytes);
    }

}
