package com.sommerph.zkkeyset.model.key;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sommerph.zkkeyset.codec.CanonicalInput;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class FreezeVerifyingKey extends CircuitKey {

    @JsonCreator
    public FreezeVerifyingKey(@JsonProperty("numInputs") int numInputs,
            @JsonProperty("numOutputs") int numOutputs,
            @JsonProperty("keyBytes") byte[] keyBytes) {
        super(numInputs, numOutputs, keyBytes);
    }

    public static FreezeVerifyingKey deserialize(CanonicalInput in) {
        int numInputs = in.readSize();
        int numOutputs = in.readSize();
        return new FreezeVerifyingKey(numInputs, numOutputs, in.readBytes());
    }

}
