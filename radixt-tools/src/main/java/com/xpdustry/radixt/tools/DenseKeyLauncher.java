package com.xpdustry.radixt.tools;

import com.xpdustry.radixt.tools.command.DenseKeyCommand;

public final class DenseKeyLauncher {

    public static void main(final String[] args) {
        ToolBootstrap.run(DenseKeyCommand.class, args);
    }
}
