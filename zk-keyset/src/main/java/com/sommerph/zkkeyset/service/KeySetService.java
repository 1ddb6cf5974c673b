package com.sommerph.zkkeyset.service;

import com.sommerph.zkkeyset.commitment.Commitment;
import com.sommerph.zkkeyset.keyset.BestFit;
import com.sommerph.zkkeyset.keyset.KeyOrder;
import com.sommerph.zkkeyset.keyset.KeySet;
import com.sommerph.zkkeyset.keyset.ProverKeySet;
import com.sommerph.zkkeyset.keyset.VerifierKeySet;
import com.sommerph.zkkeyset.model.key.KeySize;
import com.sommerph.zkkeyset.model.key.SizedKey;
import com.sommerph.zkkeyset.model.key.TransactionVerifyingKey;
import com.sommerph.zkkeyset.repository.KeySetRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class KeySetService {

    private final KeySetRegistry registry;
    private final KeyOrder keyOrder;

    public Commitment registerVerifierKeySet(String name, VerifierKeySet keySet) {
        requireConfiguredOrder(keySet.getOrder());
        Commitment commitment = keySet.commit();
        log.info("Register verifier key set {}: transfer sizes {}, freeze sizes {}, commitment {}",
                name, keySet.getXfr().sizes(), keySet.getFreeze().sizes(), commitment);
        registry.saveVerifierKeySet(name, keySet);
        return commitment;
    }

    public void registerProverKeySet(String name, ProverKeySet keySet) {
        requireConfiguredOrder(keySet.getOrder());
        log.info("Register prover key set {}: transfer sizes {}, freeze sizes {}",
                name, keySet.getXfr().sizes(), keySet.getFreeze().sizes());
        registry.saveProverKeySet(name, keySet);
    }

    public Set<String> verifierKeySetNames() {
        return registry.verifierKeySetNames();
    }

    public VerifierKeySet loadVerifierKeySet(String name) {
        if (!registry.existsVerifierKeySet(name)) {
            throw new KeySetNotFoundException("No verifier key set registered as: " + name);
        }
        return registry.loadVerifierKeySet(name);
    }

    public ProverKeySet loadProverKeySet(String name) {
        if (!registry.existsProverKeySet(name)) {
            throw new KeySetNotFoundException("No prover key set registered as: " + name);
        }
        return registry.loadProverKeySet(name);
    }

    public Commitment commitment(String name) {
        return loadVerifierKeySet(name).commit();
    }

    public KeySet<TransactionVerifyingKey> verifyingKeys(String name, KeyKind kind) {
        VerifierKeySet keySet = loadVerifierKeySet(name);
        return switch (kind) {
            case TRANSFER -> keySet.getXfr();
            case FREEZE -> keySet.getFreeze();
        };
    }

    public KeySet<? extends SizedKey> provingKeys(String name, KeyKind kind) {
        ProverKeySet keySet = loadProverKeySet(name);
        return switch (kind) {
            case TRANSFER -> keySet.getXfr();
            case FREEZE -> keySet.getFreeze();
        };
    }

    public List<KeySize> supportedSizes(String name, KeyKind kind) {
        return verifyingKeys(name, kind).sizes();
    }

    public KeySize maxSize(String name, KeyKind kind) {
        return verifyingKeys(name, kind).maxSize();
    }

    public Optional<TransactionVerifyingKey> exactFitVerifyingKey(String name, KeyKind kind, int numInputs, int numOutputs) {
        log.info("Exact fit {} verifying key in {} for size ({}, {})", kind, name, numInputs, numOutputs);
        return verifyingKeys(name, kind).exactFitKey(numInputs, numOutputs);
    }

    public BestFit<TransactionVerifyingKey> bestFitVerifyingKey(String name, KeyKind kind, int numInputs, int numOutputs) {
        log.info("Best fit {} verifying key in {} for size ({}, {})", kind, name, numInputs, numOutputs);
        BestFit<TransactionVerifyingKey> result = verifyingKeys(name, kind).bestFitKey(numInputs, numOutputs);
        logBestFit(result);
        return result;
    }

    public BestFit<? extends SizedKey> bestFitProvingKey(String name, KeyKind kind, int numInputs, int numOutputs) {
        log.info("Best fit {} proving key in {} for size ({}, {})", kind, name, numInputs, numOutputs);
        BestFit<? extends SizedKey> result = provingKeys(name, kind).bestFitKey(numInputs, numOutputs);
        logBestFit(result);
        return result;
    }

    private void requireConfiguredOrder(KeyOrder order) {
        if (order != keyOrder) {
            throw new IllegalArgumentException("Key set is ordered by " + order.getName()
                    + " but this service is configured for " + keyOrder.getName());
        }
    }

    private static void logBestFit(BestFit<?> result) {
        result.match(found -> {
            log.info("Best fit key has size {}", found.getSize());
            return null;
        }, notFound -> {
            log.warn("No key is large enough; max supported size is {}", notFound.getMaxSize());
            return null;
        });
    }

}
