package com.example.acfeed;

/**
 * The browser could not reach or render a page. Aborts the rest of the crawl.
 */
public class NavigationException extends FeedException {

    public NavigationException(String message, Throwable cause) {
        super(message, cause);
    }
}
