package com.xpdustry.radixt.tools.line;

import java.util.HashSet;
import java.util.Set;

public final class HashLineCollector implements LineCollector {

    private final Set<String> lines = new HashSet<>();

    @Override
    public void accept(final String line) {
        this.lines.add(line);
    }

    @Override
    public int count() {
        return this.lines.size();
    }
}
