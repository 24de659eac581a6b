package com.xpdustry.radixt.common.tree;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Bytes;
import com.xpdustry.radixt.common.string.ByteStrings;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.function.BiFunction;
import org.jspecify.annotations.Nullable;

/**
 * A compressed prefix tree keyed by byte sequences.
 *
 * <p>Every node but the root has a non-empty label, no node has two children starting with the same byte,
 * and every node but the root either holds a value or has at least two children. The key of a node is the
 * concatenation of the labels from the root to it. The empty key is stored on the root.
 *
 * <p>The tree is not thread safe. Iterators fail fast with a {@link java.util.ConcurrentModificationException}
 * when a key is added or removed after their creation, on a best-effort basis.
 */
public final class RadixTree<V> {

    private final RadixNode<V> root = new RadixNode<>(ByteStrings.EMPTY, null);
    private int size = 0;
    private int modifications = 0;

    public int size() {
        return this.size;
    }

    public @Nullable V put(final byte[] key, final V value) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");

        var node = this.root;
        int offset = 0;

        while (offset < key.length) {
            final var index = node.indexOf(key[offset]);
            if (index < 0) {
                node.insertChild(-index - 1, new RadixNode<>(Arrays.copyOfRange(key, offset, key.length), value));
                this.added();
                return null;
            }

            final var child = node.childAt(index);
            final var common = ByteStrings.commonPrefixLength(child.label(), key, offset);
            if (common == child.label().length) {
                node = child;
                offset += common;
                continue;
            }

            node.replaceChild(index, this.split(child, key, offset, common, value));
            this.added();
            return null;
        }

        final var previous = node.value();
        node.value(value);
        if (previous == null) {
            this.added();
        }
        return previous;
    }

    /**
     * Creates the branch node replacing {@code child}, whose label diverges from {@code key[offset:]}
     * after {@code common} bytes. Every allocation happens before {@code child} is touched.
     */
    private RadixNode<V> split(
            final RadixNode<V> child, final byte[] key, final int offset, final int common, final V value) {
        final var end = offset + common;
        final var suffix = Arrays.copyOfRange(child.label(), common, child.label().length);
        final var branch = new RadixNode<V>(Arrays.copyOfRange(key, offset, end), null);
        final var leaf = end == key.length ? null : new RadixNode<>(Arrays.copyOfRange(key, end, key.length), value);
        final RadixNode<V>[] children = RadixNode.allocate(leaf == null ? 1 : 2);

        child.label(suffix);
        if (leaf == null) {
            children[0] = child;
            branch.value(value);
        } else if (Byte.toUnsignedInt(leaf.first()) < Byte.toUnsignedInt(child.first())) {
            children[0] = leaf;
            children[1] = child;
        } else {
            children[0] = child;
            children[1] = leaf;
        }
        branch.children(children);
        return branch;
    }

    public @Nullable V get(final byte[] key) {
        Preconditions.checkNotNull(key, "key");
        final var node = this.find(key);
        return node == null ? null : node.value();
    }

    public boolean contains(final byte[] key) {
        return this.get(key) != null;
    }

    private @Nullable RadixNode<V> find(final byte[] key) {
        var node = this.root;
        int offset = 0;
        while (offset < key.length) {
            final var child = node.child(key[offset]);
            if (child == null || !ByteStrings.startsWith(key, offset, child.label())) {
                return null;
            }
            node = child;
            offset += child.label().length;
        }
        return node;
    }

    public @Nullable V remove(final byte[] key) {
        Preconditions.checkNotNull(key, "key");

        // Only the two closest ancestors can be affected by a removal
        @Nullable RadixNode<V> grandparent = null;
        @Nullable RadixNode<V> parent = null;
        var node = this.root;
        int parentIndex = -1;
        int nodeIndex = -1;
        int offset = 0;

        while (offset < key.length) {
            final var index = node.indexOf(key[offset]);
            if (index < 0) {
                return null;
            }
            final var child = node.childAt(index);
            if (!ByteStrings.startsWith(key, offset, child.label())) {
                return null;
            }
            grandparent = parent;
            parent = node;
            parentIndex = nodeIndex;
            nodeIndex = index;
            node = child;
            offset += child.label().length;
        }

        final var removed = node.value();
        if (removed == null) {
            return null;
        }
        node.value(null);
        this.size--;
        this.modifications++;

        if (parent == null) {
            return removed;
        }

        if (node.childCount() == 0) {
            parent.removeChild(nodeIndex);
            if (grandparent != null && !parent.hasValue() && parent.childCount() == 1) {
                merge(grandparent, parentIndex, parent);
            }
        } else if (node.childCount() == 1) {
            merge(parent, nodeIndex, node);
        }

        return removed;
    }

    /**
     * Replaces {@code node}, a valueless node with a single child, by that child.
     */
    private static <V> void merge(final RadixNode<V> parent, final int index, final RadixNode<V> node) {
        final var child = node.childAt(0);
        child.prepend(node.label());
        parent.replaceChild(index, child);
    }

    /**
     * Returns whether at least one key starts with {@code prefix}.
     */
    public boolean hasPrefix(final byte[] prefix) {
        Preconditions.checkNotNull(prefix, "prefix");
        final var match = this.locate(prefix);
        return match != null && (match.node().hasValue() || match.node().childCount() > 0);
    }

    /**
     * Finds the highest node whose key starts with {@code prefix}. The prefix can end inside the label
     * of that node, in which case its key is longer than the prefix.
     */
    private @Nullable PrefixMatch<V> locate(final byte[] prefix) {
        var node = this.root;
        int offset = 0;
        while (offset < prefix.length) {
            final var child = node.child(prefix[offset]);
            if (child == null) {
                return null;
            }
            final var label = child.label();
            final var common = ByteStrings.commonPrefixLength(label, prefix, offset);
            if (common == label.length) {
                node = child;
                offset += common;
            } else if (offset + common == prefix.length) {
                return new PrefixMatch<>(child, Bytes.concat(Arrays.copyOfRange(prefix, 0, offset), label));
            } else {
                return null;
            }
        }
        return new PrefixMatch<>(node, prefix.clone());
    }

    /**
     * Lazily maps every entry whose key starts with {@code prefix}, in ascending key order.
     * The mapper receives a fresh copy of the key.
     */
    public <T> Iterator<T> iterator(final byte[] prefix, final BiFunction<byte[], V, T> mapper) {
        Preconditions.checkNotNull(mapper, "mapper");
        return this.traverse(prefix, (path, node) -> mapper.apply(path.toArray(), node.value()));
    }

    /**
     * Lazily returns the values of the keys starting with {@code prefix}, in ascending key order.
     */
    public Iterator<V> values(final byte[] prefix) {
        return this.traverse(prefix, (path, node) -> node.value());
    }

    private <T> Iterator<T> traverse(final byte[] prefix, final RadixTraversal.Projection<V, T> projection) {
        Preconditions.checkNotNull(prefix, "prefix");
        final var match = this.locate(prefix);
        if (match == null) {
            return Collections.emptyIterator();
        }
        return new RadixTraversal<>(this, match.node(), match.key(), projection);
    }

    /**
     * Replaces the value of every key starting with {@code prefix} by the result of {@code function},
     * in ascending key order.
     */
    public void replaceAll(final byte[] prefix, final BiFunction<? super byte[], ? super V, ? extends V> function) {
        Preconditions.checkNotNull(function, "function");
        final Iterator<V> traversal = this.traverse(prefix, (path, node) -> {
            final V replaced = function.apply(path.toArray(), node.value());
            Preconditions.checkNotNull(replaced, "replaced value");
            node.value(replaced);
            return replaced;
        });
        traversal.forEachRemaining(ignored -> {});
    }

    /**
     * Replaces the value of {@code key} by the result of {@code function} if the key is present.
     * A {@code null} result removes the key.
     *
     * @return the new value, or {@code null} if the key is absent or was removed
     */
    public @Nullable V computeIfPresent(
            final byte[] key, final BiFunction<? super byte[], ? super V, ? extends @Nullable V> function) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(function, "function");
        final var node = this.find(key);
        if (node == null) {
            return null;
        }
        final var previous = node.value();
        if (previous == null) {
            return null;
        }
        final V replaced = function.apply(key.clone(), previous);
        if (replaced == null) {
            this.remove(key);
            return null;
        }
        node.value(replaced);
        return replaced;
    }

    public void clear() {
        this.root.clear();
        this.size = 0;
        this.modifications++;
    }

    int modifications() {
        return this.modifications;
    }

    @VisibleForTesting
    RadixNode<V> root() {
        return this.root;
    }

    private void added() {
        this.size++;
        this.modifications++;
    }

    private record PrefixMatch<V>(RadixNode<V> node, byte[] key) {}
}
