package com.xpdustry.radixt.common.tree;

import com.google.common.collect.AbstractIterator;
import gnu.trove.list.array.TByteArrayList;
import gnu.trove.list.array.TIntArrayList;
import java.util.ArrayDeque;
import java.util.ConcurrentModificationException;
import java.util.Deque;

/**
 * Depth-first, pre-order walk over the valued nodes of a subtree, children in ascending first byte.
 * The key of the current node is rebuilt in a path buffer: each frame remembers the path length of
 * its parent, so backtracking is a truncation of the buffer.
 */
final class RadixTraversal<V, T> extends AbstractIterator<T> {

    private final RadixTree<V> tree;
    private final int expected;
    private final Projection<V, T> projection;
    private final Deque<RadixNode<V>> nodes = new ArrayDeque<>();
    private final TIntArrayList depths = new TIntArrayList();
    private final TByteArrayList path;

    /**
     * @param start the root of the walked subtree
     * @param key   the full key of {@code start}, its label included
     */
    RadixTraversal(
            final RadixTree<V> tree, final RadixNode<V> start, final byte[] key, final Projection<V, T> projection) {
        this.tree = tree;
        this.expected = tree.modifications();
        this.projection = projection;
        final var depth = key.length - start.label().length;
        this.path = new TByteArrayList(Math.max(key.length, 16));
        this.path.add(key, 0, depth);
        this.nodes.push(start);
        this.depths.add(depth);
    }

    @Override
    protected T computeNext() {
        if (this.tree.modifications() != this.expected) {
            throw new ConcurrentModificationException();
        }
        while (!this.nodes.isEmpty()) {
            final var node = this.nodes.pop();
            final var depth = this.depths.removeAt(this.depths.size() - 1);
            if (this.path.size() > depth) {
                this.path.remove(depth, this.path.size() - depth);
            }
            this.path.add(node.label());
            for (int i = node.childCount() - 1; i >= 0; i--) {
                this.nodes.push(node.childAt(i));
                this.depths.add(this.path.size());
            }
            if (node.hasValue()) {
                return this.projection.project(this.path, node);
            }
        }
        return this.endOfData();
    }

    @FunctionalInterface
    interface Projection<V, T> {

        /**
         * Maps a valued node to the emitted element. {@code path} holds the key of the node and is
         * reused by the next steps of the walk.
         */
        T project(final TByteArrayList path, final RadixNode<V> node);
    }
}
