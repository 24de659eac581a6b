package com.xpdustry.radixt.tools;

import com.xpdustry.radixt.tools.command.TimingCommand;

public final class TimingLauncher {

    public static void main(final String[] args) {
        ToolBootstrap.run(TimingCommand.class, args);
    }
}
