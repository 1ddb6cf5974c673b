package com.sommerph.zkkeyset.keyset;

/**
 * Orders keys by number of outputs first, then by number of inputs.
 */
public enum OrderByOutputs implements KeyOrder {
    INSTANCE;

    @Override
    public SortKey sortKey(int numInputs, int numOutputs) {
        return new SortKey(numOutputs, numInputs);
    }

    @Override
    public String getName() {
        return "outputs";
    }
}
