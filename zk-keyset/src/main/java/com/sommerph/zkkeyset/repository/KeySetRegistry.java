package com.sommerph.zkkeyset.repository;

import com.sommerph.zkkeyset.keyset.ProverKeySet;
import com.sommerph.zkkeyset.keyset.VerifierKeySet;

import java.util.Set;

/**
 * Named key sets, as handed over by the setup that generated them.
 */
public interface KeySetRegistry {

    void saveVerifierKeySet(String name, VerifierKeySet keySet);
    VerifierKeySet loadVerifierKeySet(String name);
    boolean existsVerifierKeySet(String name);
    Set<String> verifierKeySetNames();

    void saveProverKeySet(String name, ProverKeySet keySet);
    ProverKeySet loadProverKeySet(String name);
    boolean existsProverKeySet(String name);

}
