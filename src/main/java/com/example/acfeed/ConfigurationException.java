package com.example.acfeed;

/**
 * Bad start URL, unusable directories or unknown arguments. Raised before any work is done.
 */
public class ConfigurationException extends FeedException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
