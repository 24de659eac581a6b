package com.xpdustry.radixt.tools.line;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum ContainerKind {
    RADIX,
    HASH,
    BTREE,
    COUNT;

    public String id() {
        return this.name().toLowerCase(Locale.ROOT);
    }

    public static ContainerKind parse(final String id) {
        for (final var kind : values()) {
            if (kind.id().equals(id)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown container %s, expected one of %s"
                .formatted(
                        id, Arrays.stream(values()).map(ContainerKind::id).collect(Collectors.joining(", "))));
    }
}
