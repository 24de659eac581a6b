package com.xpdustry.radixt.tools.command;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;
import com.xpdustry.radixt.common.collection.RadixMap;
import com.xpdustry.radixt.tools.ToolConfig;
import jakarta.inject.Inject;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills a map with consecutive big-endian integer keys, the densest key set a radix tree can get.
 */
public final class DenseKeyCommand implements ToolCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(DenseKeyCommand.class);

    private final ToolConfig config;

    @Inject
    public DenseKeyCommand(final ToolConfig config) {
        this.config = config;
    }

    @Override
    public void run(final List<String> args) {
        Preconditions.checkArgument(args.size() <= 1, "Usage: DenseKeyLauncher [count]");
        final var count = args.isEmpty() ? this.config.denseKeys() : Integer.parseInt(args.get(0));
        Preconditions.checkArgument(count >= 0, "The key count must not be negative: %s", count);
        LOGGER.info("N: {}", this.fill(count).size());
    }

    public RadixMap<Integer> fill(final int count) {
        final RadixMap.Mutable<Integer> map = RadixMap.create();
        for (int i = 0; i < count; i++) {
            map.put(Ints.toByteArray(i), i);
        }
        return map;
    }
}
