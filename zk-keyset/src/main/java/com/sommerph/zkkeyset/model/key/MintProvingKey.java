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
public final class MintProvingKey implements CanonicalSerializable {

    @ToString.Exclude
    private final byte[] keyBytes;

    @JsonCreator
    public MintProvingKey(@JsonProperty("keyBytes") byte[] keyBytes) {
        if (keyBytes == null) {
            throw new IllegalArgumentException("mint proving key material must not be null");
        }
        this.keyBytes = keyBytes.clone();
    }

    public static MintProvingKey deserialize(CanonicalInput in) {
        return new MintProvingKey(in.readBytes());
    }

    public byte[] getKeyBytes() {
        return keyBytes.clone();
    }

    @Override
    public void serialize(CanonicalOutput out) {
        out.writeBytes(keyBytes);
    }

}
