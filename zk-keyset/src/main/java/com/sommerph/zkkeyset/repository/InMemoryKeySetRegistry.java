package com.sommerph.zkkeyset.repository;

import com.sommerph.zkkeyset.keyset.ProverKeySet;
import com.sommerph.zkkeyset.keyset.VerifierKeySet;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryKeySetRegistry implements KeySetRegistry {

    private final Map<String, VerifierKeySet> verifierKeySets = new ConcurrentHashMap<>();
    private final Map<String, ProverKeySet> proverKeySets = new ConcurrentHashMap<>();

    @Override
    public void saveVerifierKeySet(String name, VerifierKeySet keySet) {
        if (verifierKeySets.put(name, keySet) != null) {
            log.warn("Replaced verifier key set: {}", name);
        }
    }

    @Override
    public VerifierKeySet loadVerifierKeySet(String name) {
        return verifierKeySets.get(name);
    }

    @Override
    public boolean existsVerifierKeySet(String name) {
        return verifierKeySets.containsKey(name);
    }

    @Override
    public Set<String> verifierKeySetNames() {
        return new TreeSet<>(verifierKeySets.keySet());
    }

    @Override
    public void saveProverKeySet(String name, ProverKeySet keySet) {
        if (proverKeySets.put(name, keySet) != null) {
            log.warn("Replaced prover key set: {}", name);
        }
    }

    @Override
    public ProverKeySet loadProverKeySet(String name) {
        return proverKeySets.get(name);
    }

    @Override
    public boolean existsProverKeySet(String name) {
        return proverKeySets.containsKey(name);
    }

}
