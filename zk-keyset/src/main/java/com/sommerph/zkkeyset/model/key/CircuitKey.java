package com.sommerph.zkkeyset.model.key;

import com.sommerph.zkkeyset.codec.CanonicalOutput;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Key material for one circuit size, as produced by the setup.
 * Canonical layout: {@code numInputs, numOutputs, keyBytes}.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class CircuitKey implements SizedKey {

    private final int numInputs;
    private final int numOutputs;
    @ToString.Exclude
    @Getter(AccessLevel.NONE)
    private final byte[] keyBytes;

    protected CircuitKey(int numInputs, int numOutputs, byte[] keyBytes) {
        if (numInputs < 0 || numOutputs < 0) {
            throw new IllegalArgumentException("Key size must not be negative: (" + numInputs + ", " + numOutputs + ")");
        }
        if (keyBytes == null) {
            throw new IllegalArgumentException("Key material must not be null");
        }
        this.numInputs = numInputs;
        this.numOutputs = numOutputs;
        this.keyBytes = keyBytes.clone();
    }

    public byte[] getKeyBytes() {
        return keyBytes.clone();
    }

    @Override
    public void serialize(CanonicalOutput out) {
        out.writeSize(numInputs).writeSize(numOutputs).writeBytes(keyBytes);
    }

}
