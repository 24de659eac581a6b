package com.xpdustry.radixt.common.tree;

import com.google.common.primitives.Bytes;
import org.jspecify.annotations.Nullable;

/**
 * A node of the radix tree. It owns its edge label, its optional value and its children.
 * Children are kept in an exactly sized array sorted by the unsigned value of their first label byte,
 * the array is only allocated once the node gets its first child.
 */
final class RadixNode<V> {

    private byte[] label;
    private @Nullable V value;
    private RadixNode<V> @Nullable [] children = null;

    RadixNode(final byte[] label, final @Nullable V value) {
        this.label = label;
        this.value = value;
    }

    byte[] label() {
        return this.label;
    }

    void label(final byte[] label) {
        this.label = label;
    }

    /**
     * Prepends {@code prefix} to the label, used when a parent is merged into this node.
     */
    void prepend(final byte[] prefix) {
        this.label = Bytes.concat(prefix, this.label);
    }

    byte first() {
        return this.label[0];
    }

    @Nullable V value() {
        return this.value;
    }

    void value(final @Nullable V value) {
        this.value = value;
    }

    boolean hasValue() {
        return this.value != null;
    }

    int childCount() {
        return this.children == null ? 0 : this.children.length;
    }

    RadixNode<V> childAt(final int index) {
        if (this.children == null) {
            throw new IndexOutOfBoundsException(index);
        }
        return this.children[index];
    }

    /**
     * Binary search of the child whose label starts with {@code first}.
     *
     * @return the index of the child, or {@code -(insertion point) - 1} if there is none
     */
    int indexOf(final byte first) {
        if (this.children == null) {
            return -1;
        }
        final var target = Byte.toUnsignedInt(first);
        int low = 0;
        int high = this.children.length - 1;
        while (low <= high) {
            final var middle = (low + high) >>> 1;
            final var current = Byte.toUnsignedInt(this.children[middle].first());
            if (current < target) {
                low = middle + 1;
            } else if (current > target) {
                high = middle - 1;
            } else {
                return middle;
            }
        }
        return -(low + 1);
    }

    @Nullable RadixNode<V> child(final byte first) {
        final var index = this.indexOf(first);
        return index < 0 ? null : this.children[index];
    }

    void insertChild(final int index, final RadixNode<V> child) {
        if (this.children == null) {
            final RadixNode<V>[] created = allocate(1);
            created[0] = child;
            this.children = created;
            return;
        }
        final RadixNode<V>[] grown = allocate(this.children.length + 1);
        System.arraycopy(this.children, 0, grown, 0, index);
        grown[index] = child;
        System.arraycopy(this.children, index, grown, index + 1, this.children.length - index);
        this.children = grown;
    }

    /**
     * Replaces the child at {@code index} by a node whose label starts with the same byte.
     */
    void replaceChild(final int index, final RadixNode<V> child) {
        if (this.children == null) {
            throw new IndexOutOfBoundsException(index);
        }
        this.children[index] = child;
    }

    void removeChild(final int index) {
        if (this.children == null) {
            throw new IndexOutOfBoundsException(index);
        }
        if (this.children.length == 1) {
            this.children = null;
            return;
        }
        final RadixNode<V>[] shrunk = allocate(this.children.length - 1);
        System.arraycopy(this.children, 0, shrunk, 0, index);
        System.arraycopy(this.children, index + 1, shrunk, index, this.children.length - index - 1);
        this.children = shrunk;
    }

    void children(final RadixNode<V>[] children) {
        this.children = children;
    }

    void clear() {
        this.value = null;
        this.children = null;
    }

    @SuppressWarnings("unchecked")
    static <V> RadixNode<V>[] allocate(final int length) {
        return (RadixNode<V>[]) new RadixNode<?>[length];
    }
}
