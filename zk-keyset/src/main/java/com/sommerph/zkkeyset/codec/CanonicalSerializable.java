package com.sommerph.zkkeyset.codec;

/**
 * A value with a canonical, fixed-layout binary encoding. Equal values always encode to equal bytes.
 */
public interface CanonicalSerializable {

    void serialize(CanonicalOutput out);

    default byte[] toCanonicalBytes() {
        CanonicalOutput out = new CanonicalOutput();
        serialize(out);
        return out.toByteArray();
    }

}
