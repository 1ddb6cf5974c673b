package com.sommerph.zkkeyset.keyset;

/**
 * Orders keys by number of inputs first, then by number of outputs.
 */
public enum OrderByInputs implements KeyOrder {
    INSTANCE;

    @Override
    public SortKey sortKey(int numInputs, int numOutputs) {
        return new SortKey(numInputs, numOutputs);
    }

    @Override
    public String getName() {
        return "inputs";
    }
}
