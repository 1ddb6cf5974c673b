package com.sommerph.zkkeyset.keyset;

import com.sommerph.zkkeyset.codec.CanonicalInput;
import com.sommerph.zkkeyset.codec.CanonicalOutput;
import com.sommerph.zkkeyset.codec.CanonicalSerializable;
import lombok.Value;

import java.util.Comparator;

@Value
public class SortKey implements Comparable<SortKey>, CanonicalSerializable {

    private static final Comparator<SortKey> ORDER =
            Comparator.comparingInt(SortKey::getPrimary).thenComparingInt(SortKey::getSecondary);

    int primary;
    int secondary;

    public static SortKey deserialize(CanonicalInput in) {
        int primary = in.readSize();
        return new SortKey(primary, in.readSize());
    }

    @Override
    public int compareTo(SortKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public void serialize(CanonicalOutput out) {
        out.writeSize(primary).writeSize(secondary);
    }

    @Override
    public String toString() {
        return "(" + primary + ", " + secondary + ")";
    }

}
