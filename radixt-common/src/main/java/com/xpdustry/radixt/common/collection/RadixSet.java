package com.xpdustry.radixt.common.collection;

import com.google.common.base.Preconditions;
import com.xpdustry.radixt.common.string.ByteStrings;

/**
 * A set of byte sequence keys, iterated in ascending unsigned lexicographic order.
 * {@link CharSequence} keys are encoded as UTF-8.
 */
public interface RadixSet extends Iterable<byte[]> {

    static RadixSet.Mutable create() {
        return new RadixSetImpl();
    }

    static RadixSet.Mutable from(final Iterable<? extends CharSequence> keys) {
        Preconditions.checkNotNull(keys, "keys");
        final var set = create();
        for (final var key : keys) {
            set.add(key);
        }
        return set;
    }

    static RadixSet.Mutable fromBytes(final Iterable<byte[]> keys) {
        Preconditions.checkNotNull(keys, "keys");
        final var set = create();
        for (final var key : keys) {
            set.add(key);
        }
        return set;
    }

    int size();

    default boolean isEmpty() {
        return this.size() == 0;
    }

    boolean contains(final byte[] key);

    default boolean contains(final CharSequence key) {
        return this.contains(ByteStrings.encode(key));
    }

    boolean hasPrefix(final byte[] prefix);

    default boolean hasPrefix(final CharSequence prefix) {
        return this.hasPrefix(ByteStrings.encode(prefix));
    }

    Iterable<byte[]> startingWith(final byte[] prefix);

    default Iterable<byte[]> startingWith(final CharSequence prefix) {
        return this.startingWith(ByteStrings.encode(prefix));
    }

    /**
     * Lazily returns the keys present in both sets, in order.
     */
    default Iterable<byte[]> intersection(final RadixSet other) {
        Preconditions.checkNotNull(other, "other");
        return SortedKeyMerge.intersection(this, other);
    }

    /**
     * Lazily returns the keys present in either set, in order and without duplicates.
     */
    default Iterable<byte[]> union(final RadixSet other) {
        Preconditions.checkNotNull(other, "other");
        return SortedKeyMerge.union(this, other);
    }

    interface Mutable extends RadixSet {

        /**
         * @return {@code true} if the key was not present
         */
        boolean add(final byte[] key);

        default boolean add(final CharSequence key) {
            return this.add(ByteStrings.encode(key));
        }

        /**
         * @return {@code true} if the key was present
         */
        boolean remove(final byte[] key);

        default boolean remove(final CharSequence key) {
            return this.remove(ByteStrings.encode(key));
        }

        void clear();
    }
}
