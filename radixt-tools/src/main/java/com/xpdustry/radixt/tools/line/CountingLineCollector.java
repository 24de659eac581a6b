package com.xpdustry.radixt.tools.line;

public final class CountingLineCollector implements LineCollector {

    private int count = 0;

    @Override
    public void accept(final String line) {
        this.count++;
    }

    @Override
    public int count() {
        return this.count;
    }
}
