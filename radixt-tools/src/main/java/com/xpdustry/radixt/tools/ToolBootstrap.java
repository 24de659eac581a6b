package com.xpdustry.radixt.tools;

import com.xpdustry.radixt.common.factory.ObjectFactory;
import com.xpdustry.radixt.common.factory.ObjectFactoryInitializationException;
import com.xpdustry.radixt.tools.command.ToolCommand;
import com.xpdustry.radixt.tools.lifecycle.ExitService;
import com.xpdustry.radixt.tools.lifecycle.SystemExitService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ToolBootstrap {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolBootstrap.class);

    private ToolBootstrap() {}

    static void run(final Class<? extends ToolCommand> type, final String[] args) {
        final ObjectFactory factory;
        try {
            factory = ObjectFactory.create(new ToolsModule(ToolConfig.fromSystemProperties()));
            factory.initialize();
        } catch (final ObjectFactoryInitializationException | IllegalArgumentException e) {
            LOGGER.error("Failed to initialize radixt tools", e);
            new SystemExitService().exit(ExitService.Code.FAILURE);
            return;
        }

        final var exit = factory.get(ExitService.class);
        try {
            factory.get(type).run(List.of(args));
        } catch (final IllegalArgumentException e) {
            LOGGER.error(e.getMessage());
            exit.exit(ExitService.Code.FAILURE);
            return;
        } catch (final Exception e) {
            LOGGER.error("The {} command failed", type.getSimpleName(), e);
            exit.exit(ExitService.Code.FAILURE);
            return;
        }
        exit.exit(ExitService.Code.SUCCESS);
    }
}
