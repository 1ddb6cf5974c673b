package com.sommerph.zkkeyset.service;

public class KeySetNotFoundException extends RuntimeException {

    public KeySetNotFoundException(String message) {
        super(message);
    }

}
