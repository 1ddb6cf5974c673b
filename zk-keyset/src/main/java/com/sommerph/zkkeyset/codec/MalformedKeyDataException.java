package com.sommerph.zkkeyset.codec;

public class MalformedKeyDataException extends RuntimeException {

    public MalformedKeyDataException(String message) {
        super(message);
    }

    public MalformedKeyDataException(String message, Throwable cause) {
        super(message, cause);
    }

}
