package com.xpdustry.radixt.tools.line;

import com.xpdustry.radixt.common.collection.RadixSet;

public final class RadixLineCollector implements LineCollector {

    private final RadixSet.Mutable lines = RadixSet.create();

    @Override
    public void accept(final String line) {
        this.lines.add(line);
    }

    @Override
    public int count() {
        return this.lines.size();
    }
}
