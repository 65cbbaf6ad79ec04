package com.example.acfeed;

import java.util.Optional;

/**
 * A single browser tab driven through the listing. Not thread safe; one crawl owns it at a time.
 */
public interface BrowserSession extends AutoCloseable {

    void navigate(String url) throws NavigationException;

    /** URL the session ended up on after the last navigation (redirects included). */
    String currentUrl();

    /** Rendered markup of the current document. */
    byte[] currentSource() throws NavigationException;

    /** First element matching the CSS selector, if any. */
    Optional<SessionElement> findSingle(String cssSelector);

    @Override
    void close();

    interface SessionElement {
        Optional<String> attribute(String name);
    }
}
