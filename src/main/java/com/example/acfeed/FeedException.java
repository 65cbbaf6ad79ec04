package com.example.acfeed;

/**
 * Base class for the failures the feed pipeline reports.
 */
public class FeedException extends Exception {

    public FeedException(String message) {
        super(message);
    }

    public FeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
