package com.sommerph.zkkeyset.model.key;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sommerph.zkkeyset.codec.CanonicalInput;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class TransferProvingKey extends CircuitKey {

    @JsonCreator
    public TransferProvingKey(@JsonProperty("numInputs") int numInputs,
            @JsonProperty("numOutputs") int numOutputs,
            @JsonProperty("keyBytes") byte[] keyBytes) {
        super(numInputs, numOutputs, keyBytes);
    }

    public static TransferProvingKey deserialize(CanonicalInput in) {
        int numInputs = in.readSize();
        int numOutputs = in.readSize();
        return new TransferProvingKey(numInputs, numOutputs, in.readBytes());
    }

}
