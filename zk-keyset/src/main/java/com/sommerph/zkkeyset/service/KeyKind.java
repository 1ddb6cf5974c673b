package com.sommerph.zkkeyset.service;

/**
 * The transaction types whose keys come in several sizes.
 */
public enum KeyKind {
    TRANSFER,
    FREEZE;

    public static KeyKind fromName(String name) {
        for (KeyKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported key kind: " + name + " (expected transfer or freeze)");
    }
}
