package com.xpdustry.radixt.common.collection;

import com.google.common.collect.Iterables;
import com.xpdustry.radixt.common.string.ByteStrings;
import com.xpdustry.radixt.common.tree.RadixTree;
import java.util.Iterator;
import java.util.function.BiFunction;
import org.jspecify.annotations.Nullable;

final class RadixMapImpl<V> implements RadixMap.Mutable<V> {

    private final RadixTree<V> tree = new RadixTree<>();

    @Override
    public int size() {
        return this.tree.size();
    }

    @Override
    public @Nullable V get(final byte[] key) {
        return this.tree.get(key);
    }

    @Override
    public boolean containsKey(final byte[] key) {
        return this.tree.contains(key);
    }

    @Override
    public boolean hasPrefix(final byte[] prefix) {
        return this.tree.hasPrefix(prefix);
    }

    @Override
    public @Nullable V put(final byte[] key, final V value) {
        return this.tree.put(key, value);
    }

    @Override
    public @Nullable V remove(final byte[] key) {
        return this.tree.remove(key);
    }

    @Override
    public void clear() {
        this.tree.clear();
    }

    @Override
    public void replaceAll(final byte[] prefix, final BiFunction<? super byte[], ? super V, ? extends V> function) {
        this.tree.replaceAll(prefix, function);
    }

    @Override
    public @Nullable V computeIfPresent(
            final byte[] key, final BiFunction<? super byte[], ? super V, ? extends @Nullable V> function) {
        return this.tree.computeIfPresent(key, function);
    }

    @Override
    public Iterator<Entry<V>> iterator() {
        return this.tree.iterator(ByteStrings.EMPTY, Entry::new);
    }

    @Override
    public Iterable<Entry<V>> startingWith(final byte[] prefix) {
        final var copy = prefix.clone();
        return () -> this.tree.iterator(copy, Entry::new);
    }

    @Override
    public Iterable<byte[]> keys() {
        return this.keysStartingWith(ByteStrings.EMPTY);
    }

    @Override
    public Iterable<byte[]> keysStartingWith(final byte[] prefix) {
        final var copy = prefix.clone();
        return () -> this.tree.iterator(copy, (key, value) -> key);
    }

    @Override
    public Iterable<V> values() {
        return this.valuesStartingWith(ByteStrings.EMPTY);
    }

    @Override
    public Iterable<V> valuesStartingWith(final byte[] prefix) {
        final var copy = prefix.clone();
        return () -> this.tree.values(copy);
    }

    @Override
    public String toString() {
        return Iterables.toString(this);
    }
}
