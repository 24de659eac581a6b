package com.xpdustry.radixt.tools.lifecycle;

public interface ExitService {

    void exit(final Code code);

    enum Code {
        SUCCESS,
        FAILURE
    }
}
