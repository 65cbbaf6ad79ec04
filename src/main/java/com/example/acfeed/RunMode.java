package com.example.acfeed;

import java.util.Locale;

public enum RunMode {
    /** Save listing pages only. */
    CRAWL,
    /** Build export files from pages saved earlier. */
    EXTRACT,
    /** Crawl, then extract. */
    ALL;

    public boolean crawls() {
        return this == CRAWL || this == ALL;
    }

    public boolean extracts() {
        return this == EXTRACT || this == ALL;
    }

    public static RunMode parse(String s) throws ConfigurationException {
        if (s == null || s.isBlank()) return ALL;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown mode: " + s + " (use crawl, extract or all)", e);
        }
    }
}
