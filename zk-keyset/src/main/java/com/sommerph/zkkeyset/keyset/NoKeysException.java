package com.sommerph.zkkeyset.keyset;

public class NoKeysException extends KeySetException {

    public NoKeysException() {
        super("A key set needs at least one key");
    }

}
