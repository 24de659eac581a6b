package com.xpdustry.radixt.common.collection;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import com.xpdustry.radixt.common.string.ByteStrings;
import java.util.Comparator;

/**
 * Merges of two key sequences that are both sorted in radix order and free of duplicates.
 */
final class SortedKeyMerge {

    private static final Comparator<byte[]> ORDERING = ByteStrings.ordering();

    private SortedKeyMerge() {}

    static Iterable<byte[]> intersection(final Iterable<byte[]> left, final Iterable<byte[]> right) {
        return () -> new AbstractIterator<>() {

            private final PeekingIterator<byte[]> l = Iterators.peekingIterator(left.iterator());
            private final PeekingIterator<byte[]> r = Iterators.peekingIterator(right.iterator());

            @Override
            protected byte[] computeNext() {
                while (this.l.hasNext() && this.r.hasNext()) {
                    final var result = ORDERING.compare(this.l.peek(), this.r.peek());
                    if (result < 0) {
                        this.l.next();
                    } else if (result > 0) {
                        this.r.next();
                    } else {
                        this.r.next();
                        return this.l.next();
                    }
                }
                return this.endOfData();
            }
        };
    }

    static Iterable<byte[]> union(final Iterable<byte[]> left, final Iterable<byte[]> right) {
        return () -> new AbstractIterator<>() {

            private final PeekingIterator<byte[]> l = Iterators.peekingIterator(left.iterator());
            private final PeekingIterator<byte[]> r = Iterators.peekingIterator(right.iterator());

            @Override
            protected byte[] computeNext() {
                if (!this.l.hasNext()) {
                    return this.r.hasNext() ? this.r.next() : this.endOfData();
                }
                if (!this.r.hasNext()) {
                    return this.l.next();
                }
                final var result = ORDERING.compare(this.l.peek(), this.r.peek());
                if (result < 0) {
                    return this.l.next();
                } else if (result > 0) {
                    return this.r.next();
                } else {
                    this.r.next();
                    return this.l.next();
                }
            }
        };
    }
}
