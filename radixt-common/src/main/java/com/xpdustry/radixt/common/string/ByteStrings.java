package com.xpdustry.radixt.common.string;

import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedBytes;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Helpers for the raw byte keys stored in the radix collections.
 * Keys compare byte by byte as unsigned values, strings are encoded as UTF-8.
 */
public final class ByteStrings {

    public static final byte[] EMPTY = new byte[0];

    private ByteStrings() {}

    public static byte[] encode(final CharSequence chars) {
        Preconditions.checkNotNull(chars, "chars");
        return chars.toString().getBytes(StandardCharsets.UTF_8);
    }

    public static String decode(final byte[] bytes) {
        Preconditions.checkNotNull(bytes, "bytes");
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * The lexicographic order of the radix collections, comparing bytes as unsigned values.
     */
    public static Comparator<byte[]> ordering() {
        return UnsignedBytes.lexicographicalComparator();
    }

    /**
     * Returns the length of the longest common prefix of {@code label} and {@code key[offset:]}.
     */
    public static int commonPrefixLength(final byte[] label, final byte[] key, final int offset) {
        final var mismatch = Arrays.mismatch(label, 0, label.length, key, offset, key.length);
        return mismatch == -1 ? label.length : mismatch;
    }

    /**
     * Returns whether {@code key[offset:]} starts with the whole {@code label}.
     */
    public static boolean startsWith(final byte[] key, final int offset, final byte[] label) {
        return key.length - offset >= label.length
                && Arrays.equals(key, offset, offset + label.length, label, 0, label.length);
    }
}
