package com.xpdustry.radixt.common.collection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.xpdustry.radixt.common.string.ByteStrings;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RadixMapImplTest {

    @Test
    void test_simple() {
        final RadixMap.Mutable<Integer> map = RadixMap.create();
        Assertions.assertTrue(map.isEmpty());
        Assertions.assertNull(map.put("test", 0));
        Assertions.assertNull(map.put("tester", 1));
        Assertions.assertNull(map.put("team", 2));
        Assertions.assertEquals(3, map.size());
        Assertions.assertFalse(map.isEmpty());
        Assertions.assertEquals(0, map.get("test"));
        Assertions.assertEquals(1, map.get("tester"));
        Assertions.assertEquals(2, map.get("team"));
        Assertions.assertNull(map.get("te"));
        Assertions.assertTrue(map.containsKey("team"));
        Assertions.assertFalse(map.containsKey("tea"));
    }

    @Test
    void test_put_replaces() {
        final RadixMap.Mutable<String> map = RadixMap.create();
        Assertions.assertNull(map.put("key", "a"));
        Assertions.assertEquals("a", map.put("key", "b"));
        Assertions.assertEquals("b", map.get("key"));
        Assertions.assertEquals(1, map.size());
    }

    @Test
    void test_remove() {
        final RadixMap.Mutable<Integer> map = RadixMap.create();
        map.put("bar", 1);
        map.put("baz", 2);
        Assertions.assertEquals(1, map.remove("bar"));
        Assertions.assertNull(map.remove("bar"));
        Assertions.assertNull(map.remove("ba"));
        Assertions.assertEquals(1, map.size());
        Assertions.assertNull(map.get("bar"));
        Assertions.assertEquals(2, map.get("baz"));
    }

    @Test
    void test_iteration_order() {
        final var map = RadixMap.from(ImmutableMap.of("foo", 3, "bar", 1, "baz", 2, "", 0));
        assertThat(Iterables.transform(map, RadixMap.Entry::keyAsString)).containsExactly("", "bar", "baz", "foo");
        assertThat(map.values()).containsExactly(0, 1, 2, 3);
        assertThat(Iterables.transform(map.keys(), ByteStrings::decode)).containsExactly("", "bar", "baz", "foo");
    }

    @Test
    void test_utf8_order() {
        final RadixMap.Mutable<String> map = RadixMap.create();
        map.put("é", "e-acute");
        map.put("z", "z");
        map.put("a", "a");
        assertThat(map.values()).containsExactly("a", "z", "e-acute");
    }

    @Test
    void test_starting_with() {
        final RadixMap.Mutable<Integer> map = RadixMap.create();
        map.put("romane", 1);
        map.put("romanus", 2);
        map.put("romulus", 3);
        map.put("rubens", 4);

        assertThat(keys(map.startingWith("rom"))).containsExactly("romane", "romanus", "romulus");
        assertThat(keys(map.startingWith("roma"))).containsExactly("romane", "romanus");
        assertThat(keys(map.startingWith("rubens"))).containsExactly("rubens");
        assertThat(keys(map.startingWith("rubensx"))).isEmpty();
        assertThat(keys(map.startingWith("x"))).isEmpty();
        assertThat(keys(map.startingWith(""))).hasSize(4);
        assertThat(map.valuesStartingWith("rom")).containsExactly(1, 2, 3);
        assertThat(Iterables.transform(map.keysStartingWith("ru"), ByteStrings::decode))
                .containsExactly("rubens");
    }

    @Test
    void test_views_are_live() {
        final RadixMap.Mutable<Integer> map = RadixMap.create();
        final var view = map.valuesStartingWith("a");
        map.put("ab", 1);
        assertThat(view).containsExactly(1);
        map.put("aa", 0);
        assertThat(view).containsExactly(0, 1);
    }

    @Test
    void test_prefix_is_copied() {
        final RadixMap.Mutable<Integer> map = RadixMap.create();
        map.put("ab", 1);
        map.put("cd", 2);
        final var prefix = ByteStrings.encode("a");
        final var view = map.valuesStartingWith(prefix);
        prefix[0] = 'c';
        assertThat(view).containsExactly(1);
    }

    @Test
    void test_has_prefix() {
        final RadixMap.Mutable<Integer> map = RadixMap.create();
        Assertions.assertFalse(map.hasPrefix(""));
        map.put("hello", 0);
        Assertions.assertTrue(map.hasPrefix(""));
        Assertions.assertTrue(map.hasPrefix("hel"));
        Assertions.assertTrue(map.hasPrefix("hello"));
        Assertions.assertFalse(map.hasPrefix("help"));
    }

    @Test
    void test_replace_all() {
        final RadixMap.Mutable<String> map = RadixMap.create();
        map.put("a", "x");
        map.put("b", "y");
        map.replaceAll((key, value) -> ByteStrings.decode(key) + value);
        Assertions.assertEquals("ax", map.get("a"));
        Assertions.assertEquals("by", map.get("b"));
        assertThatThrownBy(() -> map.replaceAll((key, value) -> null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void test_replace_all_with_prefix() {
        final RadixMap.Mutable<Integer> map = RadixMap.create();
        map.put("team", 1);
        map.put("test", 2);
        map.put("toast", 3);
        map.replaceAll("te", (key, value) -> value + 10);
        Assertions.assertEquals(List.of(11, 12, 3), ImmutableList.copyOf(map.values()));
        map.replaceAll(ByteStrings.encode("tea"), (key, value) -> value * 2);
        Assertions.assertEquals(List.of(22, 12, 3), ImmutableList.copyOf(map.values()));
        map.replaceAll("x", (key, value) -> 0);
        Assertions.assertEquals(List.of(22, 12, 3), ImmutableList.copyOf(map.values()));
    }

    @Test
    void test_compute_if_present() {
        final RadixMap.Mutable<String> map = RadixMap.create();
        map.put("key", "a");
        Assertions.assertEquals(
                "key:a", map.computeIfPresent("key", (key, value) -> ByteStrings.decode(key) + ":" + value));
        Assertions.assertEquals("key:a", map.get("key"));
        Assertions.assertNull(map.computeIfPresent("missing", (key, value) -> "b"));
        Assertions.assertFalse(map.containsKey("missing"));
        Assertions.assertNull(map.computeIfPresent("key", (key, value) -> null));
        Assertions.assertTrue(map.isEmpty());
    }

    @Test
    void test_iterated_entries_own_their_key() {
        final RadixMap.Mutable<Integer> map = RadixMap.create();
        map.put("abc", 1);
        final var entry = map.iterator().next();
        entry.key()[0] = 'x';
        Assertions.assertEquals("abc", entry.keyAsString());
        Assertions.assertEquals(RadixMap.Entry.of("abc", 1), entry);
        Assertions.assertEquals(1, map.get("abc"));
    }

    @Test
    void test_null_values_rejected() {
        final RadixMap.Mutable<String> map = RadixMap.create();
        Assertions.assertThrows(NullPointerException.class, () -> map.put("a", null));
        Assertions.assertThrows(NullPointerException.class, () -> map.put((CharSequence) null, "a"));
        Assertions.assertThrows(NullPointerException.class, () -> map.get((byte[]) null));
        Assertions.assertEquals(0, map.size());
    }

    @Test
    void test_iterator_fail_fast() {
        final RadixMap.Mutable<Integer> map = RadixMap.create();
        map.put("a", 1);
        map.put("b", 2);
        final var iterator = map.iterator();
        iterator.next();
        map.remove("b");
        Assertions.assertThrows(ConcurrentModificationException.class, iterator::hasNext);
    }

    @Test
    void test_clear() {
        final var map = RadixMap.from(ImmutableMap.of("a", 1, "b", 2));
        map.clear();
        Assertions.assertTrue(map.isEmpty());
        Assertions.assertFalse(map.iterator().hasNext());
        map.put("c", 3);
        Assertions.assertEquals(3, map.get("c"));
    }

    @Test
    void test_from_entries() {
        final List<RadixMap.Entry<Integer>> entries = new ArrayList<>();
        entries.add(RadixMap.Entry.of("b", 2));
        entries.add(RadixMap.Entry.of("a", 1));
        entries.add(RadixMap.Entry.of("b", 3));
        final var map = RadixMap.from(entries);
        Assertions.assertEquals(2, map.size());
        Assertions.assertEquals(3, map.get("b"));
        Assertions.assertEquals(
                List.of(RadixMap.Entry.of("a", 1), RadixMap.Entry.of("b", 3)), ImmutableList.copyOf(map));
        Assertions.assertEquals("[a=1, b=3]", map.toString());
    }

    @Test
    void test_entry() {
        final var key = ByteStrings.encode("key");
        final var entry = RadixMap.Entry.of(key, 1);
        key[0] = 'x';
        Assertions.assertEquals("key", entry.keyAsString());
        entry.key()[0] = 'x';
        Assertions.assertEquals("key", entry.keyAsString());
        Assertions.assertEquals(RadixMap.Entry.of("key", 1), entry);
        Assertions.assertEquals(RadixMap.Entry.of("key", 1).hashCode(), entry.hashCode());
        Assertions.assertNotEquals(RadixMap.Entry.of("key", 2), entry);
        Assertions.assertEquals("key=1", entry.toString());
        Assertions.assertThrows(NullPointerException.class, () -> RadixMap.Entry.of("key", null));
    }

    private static List<String> keys(final Iterable<? extends RadixMap.Entry<?>> entries) {
        return ImmutableList.copyOf(Iterables.transform(entries, RadixMap.Entry::keyAsString));
    }
}
