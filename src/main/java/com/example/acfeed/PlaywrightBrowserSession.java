package com.example.acfeed;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Chromium tab driven by Playwright. Launching happens in {@link #launch}; {@link #close()} tears down
 * page, context, browser and driver, in that order.
 */
public class PlaywrightBrowserSession implements BrowserSession {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) " +
                                             "AppleWebKit/537.36 (KHTML, like Gecko) " +
                                             "Chrome/124.0.0.0 Safari/537.36";

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final double navigationTimeoutMs;

    private PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context,
                                     Page page, double navigationTimeoutMs) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
        this.navigationTimeoutMs = navigationTimeoutMs;
    }

    public static PlaywrightBrowserSession launch(boolean headless, long navigationTimeoutMs) {
        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().launch(
                    new BrowserType.LaunchOptions().setHeadless(headless)
            );
            BrowserContext context = browser.newContext(
                    new Browser.NewContextOptions()
                            .setUserAgent(USER_AGENT)
                            .setIgnoreHTTPSErrors(true)
            );
            Page page = context.newPage();
            log.info("Started Chromium session (headless={})", headless);
            return new PlaywrightBrowserSession(playwright, browser, context, page, navigationTimeoutMs);
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }

    /** Factory for crawls that should each get a fresh browser. */
    public static BrowserSessionFactory factory(boolean headless, long navigationTimeoutMs) {
        return () -> launch(headless, navigationTimeoutMs);
    }

    @Override
    public void navigate(String url) throws NavigationException {
        log.debug("Navigating to {}", url);
        try {
            page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(navigationTimeoutMs)
                    .setWaitUntil(WaitUntilState.LOAD));
        } catch (PlaywrightException e) {
            throw new NavigationException("Failed to navigate to " + url, e);
        }
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public byte[] currentSource() throws NavigationException {
        try {
            return page.content().getBytes(StandardCharsets.UTF_8);
        } catch (PlaywrightException e) {
            throw new NavigationException("Failed to read page source of " + page.url(), e);
        }
    }

    @Override
    public Optional<SessionElement> findSingle(String cssSelector) {
        // locators keep no remote handle alive between pages
        Locator match = page.locator(cssSelector).first();
        if (match.count() == 0) return Optional.empty();
        return Optional.of(name -> Optional.ofNullable(match.getAttribute(name)));
    }

    @Override
    public void close() {
        closeQuietly("page", page::close);
        closeQuietly("context", context::close);
        closeQuietly("browser", browser::close);
        closeQuietly("playwright", playwright::close);
        log.info("Closed Chromium session");
    }

    private static void closeQuietly(String what, Runnable closer) {
        try {
            closer.run();
        } catch (RuntimeException e) {
            log.warn("Failed to close {}: {}", what, e.getMessage());
        }
    }
}
