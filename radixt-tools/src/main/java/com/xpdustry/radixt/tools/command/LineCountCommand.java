package com.xpdustry.radixt.tools.command;

import com.google.common.base.Preconditions;
import com.xpdustry.radixt.common.factory.ObjectFactory;
import com.xpdustry.radixt.tools.ToolConfig;
import com.xpdustry.radixt.tools.line.ContainerKind;
import com.xpdustry.radixt.tools.line.LineCollector;
import jakarta.inject.Inject;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CodingErrorAction;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the lines of the standard input into a container, to compare the memory footprint of the radix set
 * with the hash and tree sets of the JDK.
 */
public final class LineCountCommand implements ToolCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineCountCommand.class);

    private final ObjectFactory factory;
    private final ToolConfig config;

    @Inject
    public LineCountCommand(final ObjectFactory factory, final ToolConfig config) {
        this.factory = factory;
        this.config = config;
    }

    @Override
    public void run(final List<String> args) throws IOException {
        Preconditions.checkArgument(args.size() == 1, "Usage: LineCountLauncher <radix|hash|btree|count>");
        final var kind = ContainerKind.parse(args.get(0));
        LOGGER.info("Container: {}", kind.id());
        final var lines = this.count(kind, this.decode(System.in));
        LOGGER.info("# LINES: {}", lines);
    }

    /**
     * Wraps {@code input} in a reader failing with a {@link java.nio.charset.MalformedInputException} on
     * bytes that are not valid in the configured charset.
     */
    Reader decode(final InputStream input) {
        final var decoder = this.config
                .charset()
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return new InputStreamReader(input, decoder);
    }

    /**
     * Reads every line of {@code reader} into a new collector of the given kind. The reader is not closed.
     */
    public int count(final ContainerKind kind, final Reader reader) throws IOException {
        final var collector = this.factory.get(LineCollector.class, kind.id());
        final var buffered = new BufferedReader(reader);
        String line;
        while ((line = buffered.readLine()) != null) {
            collector.accept(line);
        }
        return collector.count();
    }
}
