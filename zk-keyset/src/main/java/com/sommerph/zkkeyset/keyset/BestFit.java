package com.sommerph.zkkeyset.keyset;

import com.sommerph.zkkeyset.model.key.KeySize;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.function.Function;

/**
 * Outcome of {@link KeySet#bestFitKey(int, int)}: either the smallest key that is large enough,
 * or the largest size the key set could have served.
 *
 * @param <K> the key type
 */
public abstract class BestFit<K> {

    private BestFit() {
    }

    public static <K> BestFit<K> found(KeySize size, K key) {
        return new Found<>(size, key);
    }

    public static <K> BestFit<K> notFound(KeySize maxSize) {
        return new NotFound<>(maxSize);
    }

    public abstract boolean isFound();

    public abstract <R> R match(Function<Found<K>, R> onFound, Function<NotFound<K>, R> onNotFound);

    public Found<K> asFound() {
        return match(found -> found, notFound -> {
            throw new IllegalStateException("No key supports the requested size; max size is " + notFound.getMaxSize());
        });
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Found<K> extends BestFit<K> {

        private final KeySize size;
        private final K key;

        private Found(KeySize size, K key) {
            this.size = size;
            this.key = key;
        }

        @Override
        public boolean isFound() {
            return true;
        }

        @Override
        public <R> R match(Function<Found<K>, R> onFound, Function<NotFound<K>, R> onNotFound) {
            return onFound.apply(this);
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class NotFound<K> extends BestFit<K> {

        private final KeySize maxSize;

        private NotFound(KeySize maxSize) {
            this.maxSize = maxSize;
        }

        @Override
        public boolean isFound() {
            return false;
        }

        @Override
        public <R> R match(Function<Found<K>, R> onFound, Function<NotFound<K>, R> onNotFound) {
            return onNotFound.apply(this);
        }
    }

}
