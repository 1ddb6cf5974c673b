package com.sommerph.zkkeyset.model.key;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.sommerph.zkkeyset.codec.CanonicalSerializable;

/**
 * A key for a circuit of fixed size. The reported size never changes for the lifetime of the key.
 */
public interface SizedKey extends CanonicalSerializable {

    int getNumInputs();

    int getNumOutputs();

    @JsonIgnore
    default KeySize getSize() {
        return KeySize.of(getNumInputs(), getNumOutputs());
    }

}
