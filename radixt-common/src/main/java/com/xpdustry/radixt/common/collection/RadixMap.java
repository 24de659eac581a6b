package com.xpdustry.radixt.common.collection;

import com.google.common.base.Preconditions;
import com.xpdustry.radixt.common.string.ByteStrings;
import java.util.Arrays;
import java.util.Map;
import java.util.function.BiFunction;
import org.jspecify.annotations.Nullable;

/**
 * A map from byte sequence keys to non-null values, iterated in ascending unsigned lexicographic key order.
 * {@link CharSequence} keys are encoded as UTF-8.
 */
public interface RadixMap<V> extends Iterable<RadixMap.Entry<V>> {

    static <V> RadixMap.Mutable<V> create() {
        return new RadixMapImpl<>();
    }

    static <V> RadixMap.Mutable<V> from(final Iterable<? extends Entry<? extends V>> entries) {
        Preconditions.checkNotNull(entries, "entries");
        final RadixMap.Mutable<V> map = create();
        for (final var entry : entries) {
            map.put(entry.key, entry.value);
        }
        return map;
    }

    static <V> RadixMap.Mutable<V> from(final Map<? extends CharSequence, ? extends V> entries) {
        Preconditions.checkNotNull(entries, "entries");
        final RadixMap.Mutable<V> map = create();
        entries.forEach(map::put);
        return map;
    }

    int size();

    default boolean isEmpty() {
        return this.size() == 0;
    }

    @Nullable V get(final byte[] key);

    default @Nullable V get(final CharSequence key) {
        return this.get(ByteStrings.encode(key));
    }

    default boolean containsKey(final byte[] key) {
        return this.get(key) != null;
    }

    default boolean containsKey(final CharSequence key) {
        return this.containsKey(ByteStrings.encode(key));
    }

    /**
     * Returns whether at least one key of this map starts with {@code prefix}.
     */
    boolean hasPrefix(final byte[] prefix);

    default boolean hasPrefix(final CharSequence prefix) {
        return this.hasPrefix(ByteStrings.encode(prefix));
    }

    /**
     * Returns the entries whose key starts with {@code prefix}, in key order.
     */
    Iterable<Entry<V>> startingWith(final byte[] prefix);

    default Iterable<Entry<V>> startingWith(final CharSequence prefix) {
        return this.startingWith(ByteStrings.encode(prefix));
    }

    Iterable<byte[]> keys();

    Iterable<byte[]> keysStartingWith(final byte[] prefix);

    default Iterable<byte[]> keysStartingWith(final CharSequence prefix) {
        return this.keysStartingWith(ByteStrings.encode(prefix));
    }

    Iterable<V> values();

    Iterable<V> valuesStartingWith(final byte[] prefix);

    default Iterable<V> valuesStartingWith(final CharSequence prefix) {
        return this.valuesStartingWith(ByteStrings.encode(prefix));
    }

    final class Entry<V> {

        private final byte[] key;
        private final V value;

        /**
         * Takes ownership of {@code key}.
         */
        Entry(final byte[] key, final V value) {
            this.key = key;
            this.value = value;
        }

        public static <V> Entry<V> of(final byte[] key, final V value) {
            Preconditions.checkNotNull(key, "key");
            Preconditions.checkNotNull(value, "value");
            return new Entry<>(key.clone(), value);
        }

        public static <V> Entry<V> of(final CharSequence key, final V value) {
            Preconditions.checkNotNull(value, "value");
            return new Entry<>(ByteStrings.encode(key), value);
        }

        public byte[] key() {
            return this.key.clone();
        }

        public V value() {
            return this.value;
        }

        public String keyAsString() {
            return ByteStrings.decode(this.key);
        }

        @Override
        public boolean equals(final Object other) {
            return other instanceof Entry<?> cast && Arrays.equals(this.key, cast.key) && this.value.equals(cast.value);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(this.key) + this.value.hashCode();
        }

        @Override
        public String toString() {
            return this.keyAsString() + "=" + this.value;
        }
    }

    interface Mutable<V> extends RadixMap<V> {

        @Nullable V put(final byte[] key, final V value);

        default @Nullable V put(final CharSequence key, final V value) {
            return this.put(ByteStrings.encode(key), value);
        }

        @Nullable V remove(final byte[] key);

        default @Nullable V remove(final CharSequence key) {
            return this.remove(ByteStrings.encode(key));
        }

        void clear();

        /**
         * Replaces the value of each key starting with {@code prefix} with the result of {@code function},
         * in key order. The function receives a copy of the key and must not return {@code null}.
         */
        void replaceAll(final byte[] prefix, final BiFunction<? super byte[], ? super V, ? extends V> function);

        default void replaceAll(
                final CharSequence prefix, final BiFunction<? super byte[], ? super V, ? extends V> function) {
            this.replaceAll(ByteStrings.encode(prefix), function);
        }

        default void replaceAll(final BiFunction<? super byte[], ? super V, ? extends V> function) {
            this.replaceAll(ByteStrings.EMPTY, function);
        }

        /**
         * Replaces the value of {@code key} with the result of {@code function} if the key is present.
         * A {@code null} result removes the key.
         *
         * @return the new value, or {@code null} if there is none
         */
        @Nullable V computeIfPresent(
                final byte[] key, final BiFunction<? super byte[], ? super V, ? extends @Nullable V> function);

        default @Nullable V computeIfPresent(
                final CharSequence key, final BiFunction<? super byte[], ? super V, ? extends @Nullable V> function) {
            return this.computeIfPresent(ByteStrings.encode(key), function);
        }
    }
}
