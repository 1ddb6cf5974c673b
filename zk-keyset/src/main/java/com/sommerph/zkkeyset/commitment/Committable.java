package com.sommerph.zkkeyset.commitment;

public interface Committable {

    Commitment commit();

}
