package com.xpdustry.radixt.common.string;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ByteStringsTest {

    @Test
    void test_encode_decode() {
        Assertions.assertArrayEquals(new byte[] {'a', 'b'}, ByteStrings.encode("ab"));
        Assertions.assertArrayEquals(new byte[] {(byte) 0xC3, (byte) 0xA9}, ByteStrings.encode("é"));
        Assertions.assertEquals("é", ByteStrings.decode(new byte[] {(byte) 0xC3, (byte) 0xA9}));
        Assertions.assertEquals(0, ByteStrings.encode(new StringBuilder()).length);
        Assertions.assertThrows(NullPointerException.class, () -> ByteStrings.encode(null));
    }

    @Test
    void test_ordering_is_unsigned() {
        final List<byte[]> keys = new ArrayList<>();
        keys.add(new byte[] {(byte) 0xFF});
        keys.add(new byte[] {0x01, 0x00});
        keys.add(new byte[] {0x01});
        keys.add(new byte[0]);
        keys.add(new byte[] {(byte) 0x80});
        keys.sort(ByteStrings.ordering());
        assertThat(keys)
                .containsExactly(
                        new byte[0],
                        new byte[] {0x01},
                        new byte[] {0x01, 0x00},
                        new byte[] {(byte) 0x80},
                        new byte[] {(byte) 0xFF});
    }

    @Test
    void test_common_prefix_length() {
        final var label = ByteStrings.encode("team");
        Assertions.assertEquals(4, ByteStrings.commonPrefixLength(label, ByteStrings.encode("xteams"), 1));
        Assertions.assertEquals(4, ByteStrings.commonPrefixLength(label, ByteStrings.encode("team"), 0));
        Assertions.assertEquals(2, ByteStrings.commonPrefixLength(label, ByteStrings.encode("test"), 0));
        Assertions.assertEquals(3, ByteStrings.commonPrefixLength(label, ByteStrings.encode("tea"), 0));
        Assertions.assertEquals(0, ByteStrings.commonPrefixLength(label, ByteStrings.encode("abc"), 3));
    }

    @Test
    void test_starts_with() {
        final var key = ByteStrings.encode("hello");
        Assertions.assertTrue(ByteStrings.startsWith(key, 0, ByteStrings.encode("he")));
        Assertions.assertTrue(ByteStrings.startsWith(key, 2, ByteStrings.encode("llo")));
        Assertions.assertTrue(ByteStrings.startsWith(key, 5, ByteStrings.EMPTY));
        Assertions.assertFalse(ByteStrings.startsWith(key, 2, ByteStrings.encode("llos")));
        Assertions.assertFalse(ByteStrings.startsWith(key, 1, ByteStrings.encode("a")));
    }
}
