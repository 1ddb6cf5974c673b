package com.sommerph.zkkeyset.keyset;

import com.sommerph.zkkeyset.codec.CanonicalInput;
import com.sommerph.zkkeyset.codec.CanonicalOutput;
import com.sommerph.zkkeyset.codec.CanonicalReader;
import com.sommerph.zkkeyset.codec.CanonicalSerializable;
import com.sommerph.zkkeyset.codec.MalformedKeyDataException;
import com.sommerph.zkkeyset.model.key.KeySize;
import com.sommerph.zkkeyset.model.key.SizedKey;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collector;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keys indexed by the transaction size they support, ordered by a {@link KeyOrder}.
 * <p>
 * A key set holds at least one key and never two keys of the same size. It is immutable once
 * built, so it can be shared between threads without locking.
 * <p>
 * Canonical layout: the number of entries followed by each {@code (sortKey, key)} pair in
 * ascending sort key order.
 *
 * @param <K> the key type
 */
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode
public final class KeySet<K extends SizedKey> implements Iterable<K>, CanonicalSerializable {

    @Getter
    @ToString.Include
    private final KeyOrder order;
    private final NavigableMap<SortKey, K> keys;

    KeySet(KeyOrder order, NavigableMap<SortKey, K> keys) {
        this.order = order;
        this.keys = Collections.unmodifiableNavigableMap(keys);
    }

    /**
     * Builds a key set from keys in any order.
     *
     * @throws DuplicateKeysException if two keys have the same size
     * @throws NoKeysException if {@code keys} is empty
     */
    public static <K extends SizedKey> KeySet<K> of(KeyOrder order, Iterable<? extends K> keys) throws KeySetException {
        NavigableMap<SortKey, K> map = new TreeMap<>();
        for (K key : keys) {
            SortKey sortKey = order.sortKey(key.getNumInputs(), key.getNumOutputs());
            if (map.containsKey(sortKey)) {
                throw new DuplicateKeysException(key.getNumInputs(), key.getNumOutputs());
            }
            map.put(sortKey, key);
        }
        if (map.isEmpty()) {
            throw new NoKeysException();
        }
        return new KeySet<>(order, map);
    }

    @SafeVarargs
    public static <K extends SizedKey> KeySet<K> of(KeyOrder order, K... keys) throws KeySetException {
        return of(order, List.of(keys));
    }

    /**
     * Rebuilds a key set from decoded {@code (sortKey, key)} pairs.
     *
     * @throws IllegalArgumentException if a stored sort key does not belong to its key under {@code order}
     */
    public static <K extends SizedKey> KeySet<K> fromEntries(KeyOrder order, List<Map.Entry<SortKey, K>> entries)
            throws KeySetException {
        List<K> keys = new ArrayList<>(entries.size());
        for (Map.Entry<SortKey, K> entry : entries) {
            K key = entry.getValue();
            SortKey expected = order.sortKey(key.getNumInputs(), key.getNumOutputs());
            if (!expected.equals(entry.getKey())) {
                throw new IllegalArgumentException("Sort key " + entry.getKey() + " does not match key of size "
                        + key.getSize() + " under order '" + order.getName() + "'");
            }
            keys.add(key);
        }
        return of(order, keys);
    }

    /**
     * Collects a stream into a key set. Invalid input is treated as a programming error.
     */
    public static <K extends SizedKey> Collector<K, ?, KeySet<K>> toKeySet(KeyOrder order) {
        return Collectors.collectingAndThen(Collectors.toList(), keys -> {
            try {
                return of(order, keys);
            } catch (KeySetException e) {
                throw new IllegalArgumentException(e.getMessage(), e);
            }
        });
    }

    public static <K extends SizedKey> KeySet<K> deserialize(CanonicalInput in, KeyOrder order, CanonicalReader<K> keyReader) {
        int count = in.readSize();
        // each entry takes at least the two sort key words
        if (count > in.remaining() / (2 * Long.BYTES)) {
            throw new MalformedKeyDataException("Key set claims " + count + " entries but only " + in.remaining() + " bytes remain");
        }
        List<Map.Entry<SortKey, K>> entries = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            SortKey sortKey = SortKey.deserialize(in);
            entries.add(Map.entry(sortKey, keyReader.read(in)));
        }
        try {
            return fromEntries(order, entries);
        } catch (KeySetException | IllegalArgumentException e) {
            throw new MalformedKeyDataException("Invalid key set: " + e.getMessage(), e);
        }
    }

    /**
     * The size of the last key in sort order.
     *
     * @throws IllegalStateException if the key set is empty, which construction rules out
     */
    public KeySize maxSize() {
        if (keys.isEmpty()) {
            throw new IllegalStateException("Key set is empty; it was not built through KeySet.of");
        }
        return keys.lastEntry().getValue().getSize();
    }

    public Optional<K> exactFitKey(int numInputs, int numOutputs) {
        checkSize(numInputs, numOutputs);
        return Optional.ofNullable(keys.get(order.sortKey(numInputs, numOutputs)));
    }

    /**
     * Returns the smallest key, in this set's order, whose size is at least
     * {@code (numInputs, numOutputs)} in both dimensions. If there is none, the result carries
     * {@link #maxSize()}.
     */
    public BestFit<K> bestFitKey(int numInputs, int numOutputs) {
        KeySize requested = KeySize.of(numInputs, numOutputs);
        // Keys before the requested sort key are too small on the primary axis. Keys after it may
        // still be too small on the secondary axis: under OrderByInputs (3, 1) sorts after (2, 2)
        // although 1 < 2. So the tail is scanned for the first key that is large enough in both.
        for (K key : keys.tailMap(order.sortKey(numInputs, numOutputs), true).values()) {
            KeySize size = key.getSize();
            if (size.dominates(requested)) {
                return BestFit.found(size, key);
            }
        }
        return BestFit.notFound(maxSize());
    }

    /**
     * Supported sizes in ascending sort key order.
     */
    public List<KeySize> sizes() {
        return keys.values().stream().map(SizedKey::getSize).collect(Collectors.toUnmodifiableList());
    }

    /**
     * The {@code (sortKey, key)} pairs in ascending sort key order.
     */
    public List<Map.Entry<SortKey, K>> entries() {
        return List.copyOf(keys.entrySet());
    }

    public int size() {
        return keys.size();
    }

    public Stream<K> stream() {
        return keys.values().stream();
    }

    @Override
    public Iterator<K> iterator() {
        return keys.values().iterator();
    }

    @Override
    public void serialize(CanonicalOutput out) {
        out.writeSize(keys.size());
        keys.forEach((sortKey, key) -> {
            sortKey.serialize(out);
            key.serialize(out);
        });
    }

    private static void checkSize(int numInputs, int numOutputs) {
        if (numInputs < 0 || numOutputs < 0) {
            throw new IllegalArgumentException("Requested size must not be negative: (" + numInputs + ", " + numOutputs + ")");
        }
    }

    @ToString.Include(name = "sizes")
    private List<KeySize> sizesForToString() {
        return sizes();
    }

}
