package com.xpdustry.radixt.tools.line;

import java.util.NavigableSet;
import java.util.TreeSet;

public final class TreeLineCollector implements LineCollector {

    private final NavigableSet<String> lines = new TreeSet<>();

    @Override
    public void accept(final String line) {
        this.lines.add(line);
    }

    @Override
    public int count() {
        return this.lines.size();
    }
}
