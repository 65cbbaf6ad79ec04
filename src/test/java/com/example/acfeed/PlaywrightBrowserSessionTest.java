package com.example.acfeed;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Drives a real Chromium, so it only runs with {@code AC_FEED_BROWSER_TESTS=true} and a Playwright
 * browser installed.
 */
@EnabledIfEnvironmentVariable(named = "AC_FEED_BROWSER_TESTS", matches = "true")
class PlaywrightBrowserSessionTest {

    private static final String LISTING = "data:text/html,"
            + "<title>Listing</title><link%20rel=next%20href=/ac?p=2><p>one</p>";

    @Test
    void findSingle_readsNextLinkOnEveryPage() throws Exception {
        try (PlaywrightBrowserSession session = PlaywrightBrowserSession.launch(true, 10_000)) {
            for (int i = 0; i < 20; i++) {
                session.navigate(LISTING);

                Optional<BrowserSession.SessionElement> next = session.findSingle(PageCrawler.NEXT_PAGE_SELECTOR);

                assertThat(next).isPresent();
                assertThat(next.get().attribute("href")).contains("/ac?p=2");
                assertThat(next.get().attribute("hreflang")).isEmpty();
            }
            assertThat(new String(session.currentSource(), StandardCharsets.UTF_8)).contains("one");
        }
    }

    @Test
    void findSingle_noMatch_isEmpty() throws Exception {
        try (PlaywrightBrowserSession session = PlaywrightBrowserSession.launch(true, 10_000)) {
            session.navigate(LISTING);

            assertThat(session.findSingle("head > link[rel=prev]")).isEmpty();
        }
    }
}
