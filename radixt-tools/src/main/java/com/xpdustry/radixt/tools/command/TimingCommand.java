package com.xpdustry.radixt.tools.command;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.Iterables;
import com.xpdustry.radixt.common.collection.RadixMap;
import com.xpdustry.radixt.tools.ToolConfig;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Times insertions, lookups and full iterations of random keys, for each configured map size and key length.
 */
public final class TimingCommand implements ToolCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(TimingCommand.class);

    private final ToolConfig config;

    @Inject
    public TimingCommand(final ToolConfig config) {
        this.config = config;
    }

    @Override
    public void run(final List<String> args) {
        Preconditions.checkArgument(args.isEmpty(), "Usage: TimingLauncher");
        for (final var timing : this.measure()) {
            LOGGER.info(
                    "{} n={} key_len={}: {} ms ({} ns/op)",
                    timing.operation(),
                    timing.size(),
                    timing.keyLength(),
                    timing.elapsed().toMillis(),
                    timing.nanosPerOperation());
        }
    }

    public List<Timing> measure() {
        final var random = new Random(this.config.seed());
        final var maxKeyLength = Collections.max(this.config.timingKeyLengths());
        final List<Timing> timings = new ArrayList<>();

        for (final int size : this.config.timingSizes()) {
            final var keys = new byte[size][maxKeyLength];
            for (final var key : keys) {
                random.nextBytes(key);
            }

            for (final int keyLength : this.config.timingKeyLengths()) {
                final RadixMap.Mutable<Integer> map = RadixMap.create();

                var stopwatch = Stopwatch.createStarted();
                for (int i = 0; i < size; i++) {
                    map.put(Arrays.copyOf(keys[i], keyLength), i);
                }
                timings.add(new Timing(Operation.INSERT, size, keyLength, stopwatch.elapsed()));

                stopwatch = Stopwatch.createStarted();
                for (int i = 0; i < size; i++) {
                    if (map.get(Arrays.copyOf(keys[i], keyLength)) == null) {
                        throw new IllegalStateException("Lost key at index " + i);
                    }
                }
                timings.add(new Timing(Operation.GET, size, keyLength, stopwatch.elapsed()));

                stopwatch = Stopwatch.createStarted();
                final var iterated = Iterables.size(map.values());
                timings.add(new Timing(Operation.ITERATE, iterated, keyLength, stopwatch.elapsed()));
            }
        }

        return timings;
    }

    public enum Operation {
        INSERT,
        GET,
        ITERATE
    }

    public record Timing(Operation operation, int size, int keyLength, Duration elapsed) {

        public long nanosPerOperation() {
            return this.size == 0 ? 0 : this.elapsed.toNanos() / this.size;
        }
    }
}
