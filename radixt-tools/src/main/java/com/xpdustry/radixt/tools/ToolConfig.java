package com.xpdustry.radixt.tools;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;
import org.jspecify.annotations.Nullable;

/**
 * Settings of the command line tools, read from {@code radixt.*} system properties.
 *
 * @param charset          charset of the lines read by the line count tool
 * @param denseKeys        default number of keys inserted by the dense key tool
 * @param timingSizes      map sizes measured by the timing tool
 * @param timingKeyLengths key lengths measured by the timing tool
 * @param seed             seed of the random keys of the timing tool
 */
public record ToolConfig(
        Charset charset, int denseKeys, List<Integer> timingSizes, List<Integer> timingKeyLengths, long seed) {

    public static final ToolConfig DEFAULT = new ToolConfig(
            StandardCharsets.UTF_8, 1_000_000, List.of(10_000, 100_000, 1_000_000), List.of(8, 32, 128), 42L);

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public ToolConfig {
        Preconditions.checkNotNull(charset, "charset");
        Preconditions.checkArgument(denseKeys >= 0, "denseKeys must not be negative: %s", denseKeys);
        timingSizes = List.copyOf(timingSizes);
        timingKeyLengths = List.copyOf(timingKeyLengths);
        Preconditions.checkArgument(
                timingSizes.stream().allMatch(size -> size > 0), "Timing sizes must be positive: %s", timingSizes);
        Preconditions.checkArgument(
                timingKeyLengths.stream().allMatch(length -> length > 0),
                "Timing key lengths must be positive: %s",
                timingKeyLengths);
    }

    public static ToolConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static ToolConfig fromProperties(final Properties properties) {
        return new ToolConfig(
                Charset.forName(properties.getProperty("radixt.charset", DEFAULT.charset.name())),
                Integer.parseInt(properties.getProperty("radixt.dense-keys", Integer.toString(DEFAULT.denseKeys))),
                parseList(properties.getProperty("radixt.timing.sizes"), DEFAULT.timingSizes),
                parseList(properties.getProperty("radixt.timing.key-lengths"), DEFAULT.timingKeyLengths),
                Long.parseLong(properties.getProperty("radixt.seed", Long.toString(DEFAULT.seed))));
    }

    private static List<Integer> parseList(final @Nullable String value, final List<Integer> fallback) {
        if (value == null) {
            return fallback;
        }
        return LIST_SPLITTER.splitToStream(value).map(Integer::valueOf).toList();
    }
}
