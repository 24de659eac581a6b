package com.xpdustry.radixt.common.tree;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RadixNodeTest {

    @Test
    void test_children_sorted_unsigned() {
        final var node = new RadixNode<Integer>(new byte[0], null);
        for (final var first : new byte[] {(byte) 0x80, 0x01, (byte) 0xFF, 0x7F, 0x00}) {
            final var index = node.indexOf(first);
            Assertions.assertTrue(index < 0);
            node.insertChild(-index - 1, new RadixNode<>(new byte[] {first}, (int) first));
        }
        Assertions.assertEquals(5, node.childCount());
        Assertions.assertEquals(0x00, node.childAt(0).first());
        Assertions.assertEquals(0x01, node.childAt(1).first());
        Assertions.assertEquals(0x7F, node.childAt(2).first());
        Assertions.assertEquals((byte) 0x80, node.childAt(3).first());
        Assertions.assertEquals((byte) 0xFF, node.childAt(4).first());
    }

    @Test
    void test_index_of() {
        final var node = new RadixNode<Integer>(new byte[0], null);
        Assertions.assertEquals(-1, node.indexOf((byte) 'a'));
        node.insertChild(0, new RadixNode<>("bar".getBytes(), 1));
        node.insertChild(1, new RadixNode<>("foo".getBytes(), 2));
        Assertions.assertEquals(0, node.indexOf((byte) 'b'));
        Assertions.assertEquals(1, node.indexOf((byte) 'f'));
        Assertions.assertEquals(-1, node.indexOf((byte) 'a'));
        Assertions.assertEquals(-2, node.indexOf((byte) 'c'));
        Assertions.assertEquals(-3, node.indexOf((byte) 'z'));
        Assertions.assertNull(node.child((byte) 'c'));
        Assertions.assertEquals(2, node.child((byte) 'f').value());
    }

    @Test
    void test_remove_child() {
        final var node = new RadixNode<Integer>(new byte[0], null);
        node.insertChild(0, new RadixNode<>("a".getBytes(), 1));
        node.insertChild(1, new RadixNode<>("b".getBytes(), 2));
        node.insertChild(2, new RadixNode<>("c".getBytes(), 3));

        node.removeChild(1);
        Assertions.assertEquals(2, node.childCount());
        Assertions.assertEquals((byte) 'a', node.childAt(0).first());
        Assertions.assertEquals((byte) 'c', node.childAt(1).first());

        node.removeChild(0);
        node.removeChild(0);
        Assertions.assertEquals(0, node.childCount());
        Assertions.assertEquals(-1, node.indexOf((byte) 'a'));
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> node.childAt(0));
    }

    @Test
    void test_label_rewrite() {
        final var node = new RadixNode<Integer>("abcdef".getBytes(), 1);
        node.label("cdef".getBytes());
        Assertions.assertArrayEquals("cdef".getBytes(), node.label());
        node.prepend("xy".getBytes());
        Assertions.assertArrayEquals("xycdef".getBytes(), node.label());
        Assertions.assertEquals((byte) 'x', node.first());
    }
}
