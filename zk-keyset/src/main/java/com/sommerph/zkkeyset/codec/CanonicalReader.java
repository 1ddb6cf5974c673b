package com.sommerph.zkkeyset.codec;

@FunctionalInterface
public interface CanonicalReader<T> {

    T read(CanonicalInput in);

}
