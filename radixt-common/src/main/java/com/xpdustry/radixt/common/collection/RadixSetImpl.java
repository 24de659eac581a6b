package com.xpdustry.radixt.common.collection;

import com.google.common.collect.Iterables;
import com.xpdustry.radixt.common.string.ByteStrings;
import java.util.Iterator;

final class RadixSetImpl implements RadixSet.Mutable {

    private final RadixMap.Mutable<Boolean> map = new RadixMapImpl<>();

    @Override
    public int size() {
        return this.map.size();
    }

    @Override
    public boolean contains(final byte[] key) {
        return this.map.containsKey(key);
    }

    @Override
    public boolean hasPrefix(final byte[] prefix) {
        return this.map.hasPrefix(prefix);
    }

    @Override
    public boolean add(final byte[] key) {
        return this.map.put(key, Boolean.TRUE) == null;
    }

    @Override
    public boolean remove(final byte[] key) {
        return this.map.remove(key) != null;
    }

    @Override
    public void clear() {
        this.map.clear();
    }

    @Override
    public Iterator<byte[]> iterator() {
        return this.map.keys().iterator();
    }

    @Override
    public Iterable<byte[]> startingWith(final byte[] prefix) {
        return this.map.keysStartingWith(prefix);
    }

    @Override
    public String toString() {
        return Iterables.toString(Iterables.transform(this, ByteStrings::decode));
    }
}
