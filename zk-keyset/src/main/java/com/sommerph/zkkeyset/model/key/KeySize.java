package com.sommerph.zkkeyset.model.key;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * The transaction shape a key supports: number of inputs and number of outputs.
 */
@Value
public class KeySize {

    int numInputs;
    int numOutputs;

    @JsonCreator
    public KeySize(@JsonProperty("numInputs") int numInputs, @JsonProperty("numOutputs") int numOutputs) {
        if (numInputs < 0 || numOutputs < 0) {
            throw new IllegalArgumentException("Key size must not be negative: (" + numInputs + ", " + numOutputs + ")");
        }
        this.numInputs = numInputs;
        this.numOutputs = numOutputs;
    }

    public static KeySize of(int numInputs, int numOutputs) {
        return new KeySize(numInputs, numOutputs);
    }

    /**
     * True if this size is at least {@code other} in both dimensions.
     */
    public boolean dominates(KeySize other) {
        return numInputs >= other.numInputs && numOutputs >= other.numOutputs;
    }

    @Override
    public String toString() {
        return "(" + numInputs + ", " + numOutputs + ")";
    }

}
