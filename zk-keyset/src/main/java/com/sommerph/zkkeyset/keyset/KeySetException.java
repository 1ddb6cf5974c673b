package com.sommerph.zkkeyset.keyset;

/**
 * A batch of keys could not be turned into a {@link KeySet}.
 */
public abstract class KeySetException extends Exception {

    protected KeySetException(String message) {
        super(message);
    }

}
