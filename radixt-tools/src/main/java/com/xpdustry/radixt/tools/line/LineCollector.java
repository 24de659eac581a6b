package com.xpdustry.radixt.tools.line;

/**
 * Receives the lines read by the line count tool.
 */
public interface LineCollector {

    void accept(final String line);

    /**
     * @return the number of lines held, distinct lines for the set backed collectors
     */
    int count();
}
