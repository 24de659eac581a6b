package com.xpdustry.radixt.tools;

import com.xpdustry.radixt.tools.command.LineCountCommand;

public final class LineCountLauncher {

    public static void main(final String[] args) {
        ToolBootstrap.run(LineCountCommand.class, args);
    }
}
