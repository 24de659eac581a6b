package com.xpdustry.radixt.tools.lifecycle;

public final class SystemExitService implements ExitService {

    @Override
    public void exit(final Code code) {
        System.exit(code.ordinal());
    }
}
