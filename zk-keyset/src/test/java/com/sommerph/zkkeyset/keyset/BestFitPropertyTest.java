package com.sommerph.zkkeyset.keyset;

import com.sommerph.zkkeyset.model.key.KeySize;
import com.sommerph.zkkeyset.model.key.TransferProvingKey;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static com.sommerph.zkkeyset.TestKeys.transferPk;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compares lookups against a brute force search over randomly generated key sets.
 */
class BestFitPropertyTest {

    private static final int MAX_DIMENSION = 8;

    private static List<TransferProvingKey> randomKeys(Random random) {
        Set<KeySize> sizes = new LinkedHashSet<>();
        int count = 1 + random.nextInt(12);
        while (sizes.size() < count) {
            sizes.add(KeySize.of(random.nextInt(MAX_DIMENSION), random.nextInt(MAX_DIMENSION)));
        }
        List<TransferProvingKey> keys = new ArrayList<>();
        sizes.forEach(size -> keys.add(transferPk(size.getNumInputs(), size.getNumOutputs())));
        return keys;
    }

    private static Optional<KeySize> bruteForceBestFit(List<TransferProvingKey> keys, KeyOrder order, KeySize requested) {
        return keys.stream()
                .map(TransferProvingKey::getSize)
                .filter(size -> size.dominates(requested))
                .min(Comparator.comparing((KeySize size) -> order.sortKey(size.getNumInputs(), size.getNumOutputs())));
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 1234L, 98765L})
    void bestFitIsMinimalDominatingSize(long seed) throws KeySetException {
        Random random = new Random(seed);
        for (int round = 0; round < 50; round++) {
            List<TransferProvingKey> keys = randomKeys(random);
            for (KeyOrder order : List.of(OrderByInputs.INSTANCE, OrderByOutputs.INSTANCE)) {
                KeySet<TransferProvingKey> keySet = KeySet.of(order, keys);
                for (int numInputs = 0; numInputs <= MAX_DIMENSION; numInputs++) {
                    for (int numOutputs = 0; numOutputs <= MAX_DIMENSION; numOutputs++) {
                        KeySize requested = KeySize.of(numInputs, numOutputs);
                        Optional<KeySize> expected = bruteForceBestFit(keys, order, requested);
                        BestFit<TransferProvingKey> actual = keySet.bestFitKey(numInputs, numOutputs);

                        if (expected.isPresent()) {
                            assertThat(actual.asFound().getSize()).isEqualTo(expected.get());
                            assertThat(actual.asFound().getKey().getSize()).isEqualTo(expected.get());
                        } else {
                            assertThat(actual).isEqualTo(BestFit.notFound(keySet.maxSize()));
                        }
                    }
                }
            }
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {3L, 11L, 2024L})
    void ordersAgreeOnExactFitAndOnWhetherAKeyFits(long seed) throws KeySetException {
        Random random = new Random(seed);
        for (int round = 0; round < 50; round++) {
            List<TransferProvingKey> keys = randomKeys(random);
            KeySet<TransferProvingKey> byInputs = KeySet.of(OrderByInputs.INSTANCE, keys);
            KeySet<TransferProvingKey> byOutputs = KeySet.of(OrderByOutputs.INSTANCE, keys);
            for (int numInputs = 0; numInputs <= MAX_DIMENSION; numInputs++) {
                for (int numOutputs = 0; numOutputs <= MAX_DIMENSION; numOutputs++) {
                    assertThat(byInputs.exactFitKey(numInputs, numOutputs))
                            .isEqualTo(byOutputs.exactFitKey(numInputs, numOutputs));
                    assertThat(byInputs.bestFitKey(numInputs, numOutputs).isFound())
                            .isEqualTo(byOutputs.bestFitKey(numInputs, numOutputs).isFound());
                }
            }
            for (TransferProvingKey key : keys) {
                assertThat(byInputs.bestFitKey(key.getNumInputs(), key.getNumOutputs()))
                        .isEqualTo(byOutputs.bestFitKey(key.getNumInputs(), key.getNumOutputs()));
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {10, 100, 1000})
    void bestFitFindsKeyBehindManyTooNarrowKeys(int narrowKeys) throws KeySetException {
        // keys with many inputs but a single output, clustered right above the requested size
        List<TransferProvingKey> keys = new ArrayList<>();
        for (int i = 0; i < narrowKeys; i++) {
            keys.add(transferPk(2 + i, 1));
        }
        keys.add(transferPk(2 + narrowKeys, 2));
        KeySet<TransferProvingKey> byInputs = KeySet.of(OrderByInputs.INSTANCE, keys);
        KeySet<TransferProvingKey> byOutputs = KeySet.of(OrderByOutputs.INSTANCE, keys);

        assertThat(byInputs.bestFitKey(2, 2).asFound().getSize()).isEqualTo(KeySize.of(2 + narrowKeys, 2));
        assertThat(byOutputs.bestFitKey(2, 2).asFound().getSize()).isEqualTo(KeySize.of(2 + narrowKeys, 2));
        assertThat(byInputs.bestFitKey(2, 3)).isEqualTo(BestFit.notFound(KeySize.of(2 + narrowKeys, 2)));
    }

}
