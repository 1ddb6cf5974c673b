package com.sommerph.zkkeyset.keyset;

import lombok.Getter;

@Getter
public class DuplicateKeysException extends KeySetException {

    private final int numInputs;
    private final int numOutputs;

    public DuplicateKeysException(int numInputs, int numOutputs) {
        super("Duplicate keys for size (" + numInputs + ", " + numOutputs + ")");
        this.numInputs = numInputs;
        this.numOutputs = numOutputs;
    }

}
