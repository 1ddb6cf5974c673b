package com.sommerph.zkkeyset.keyset;

/**
 * Strategy deciding how key sizes are ordered inside a {@link KeySet}.
 * <p>
 * Implementations are stateless and must map distinct sizes to distinct sort keys. The primary
 * axis of the sort key is the one best-fit lookups can restrict by range; the secondary axis is
 * filtered during the scan.
 */
public interface KeyOrder {

    SortKey sortKey(int numInputs, int numOutputs);

    /**
     * Stable name used in configuration.
     */
    String getName();

    static KeyOrder forName(String name) {
        return switch (name.toLowerCase()) {
            case "inputs" -> OrderByInputs.INSTANCE;
            case "outputs" -> OrderByOutputs.INSTANCE;
            default -> throw new IllegalArgumentException("Unsupported key order: " + name);
        };
    }

}
