package com.xpdustry.radixt.tools.command;

import java.util.List;

public interface ToolCommand {

    /**
     * @throws IllegalArgumentException if the arguments are invalid
     */
    void run(final List<String> args) throws Exception;
}
