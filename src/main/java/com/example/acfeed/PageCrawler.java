package com.example.acfeed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks a product listing page by page, following {@code <link rel="next">} in the document head,
 * and saves the rendered source of every page to the {@link PageStore}.
 *
 * <p>Pages are visited strictly in order through one browser session. There is no page limit and no
 * cycle detection: a listing whose last page points back to an earlier one is crawled forever.
 */
public class PageCrawler {

    private static final Logger log = LoggerFactory.getLogger(PageCrawler.class);

    static final String NEXT_PAGE_SELECTOR = "head > link[rel=next]";

    private final BrowserSessionFactory sessionFactory;
    private final PageStore store;

    public PageCrawler(BrowserSessionFactory sessionFactory, PageStore store) {
        this.sessionFactory = sessionFactory;
        this.store = store;
    }

    /**
     * Saves every page of the listing starting at {@code startUrl}.
     *
     * @throws ConfigurationException if {@code startUrl} is not an absolute URL; nothing is opened then
     * @throws NavigationException    if a page cannot be loaded; pages saved so far stay on disk
     * @throws PaginationException    if a "next" link points at something that is not a URL
     * @throws IOException            if a capture cannot be written
     */
    public CrawlReport crawl(String startUrl) throws FeedException, IOException {
        URI pageUrl;
        try {
            pageUrl = UrlUtils.parseAbsolute(startUrl);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid start URL: " + startUrl, e);
        }

        log.info("Saving listing pages starting with {}", pageUrl);

        int visited = 0;
        List<Path> saved = new ArrayList<>();
        List<URI> skipped = new ArrayList<>();

        try (BrowserSession session = sessionFactory.open()) {
            while (true) {
                session.navigate(pageUrl.toString());
                visited++;
                URI documentUrl = landedUrl(session, pageUrl);

                Optional<Path> out = capture(session, pageUrl);
                if (out.isPresent()) {
                    saved.add(out.get());
                } else {
                    skipped.add(pageUrl);
                }

                Optional<URI> next = nextPage(session, documentUrl);
                if (next.isEmpty()) {
                    log.info("No more pages left after {} page(s).", visited);
                    break;
                }
                pageUrl = next.get();
            }
        } catch (NavigationException | PaginationException e) {
            log.error("Crawl aborted after {} page(s): {}", visited, e.getMessage());
            throw e;
        }

        return new CrawlReport(visited, saved, skipped);
    }

    private Optional<Path> capture(BrowserSession session, URI pageUrl)
            throws NavigationException, IOException {
        String fileName;
        try {
            fileName = PageNamer.nameFor(pageUrl);
        } catch (PageNamingException e) {
            log.warn("Could not determine file name to save page {}: {}", pageUrl, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(store.save(new PageCapture(pageUrl, fileName, session.currentSource())));
    }

    /**
     * The document's own URL after redirects; relative links resolve against it.
     * Falls back to the requested URL when the session reports nothing usable.
     */
    private static URI landedUrl(BrowserSession session, URI requested) {
        String landed = session.currentUrl();
        if (landed == null || landed.equals(requested.toString())) return requested;
        try {
            URI uri = UrlUtils.parseAbsolute(landed);
            log.debug("Requested {} but landed on {}", requested, uri);
            return uri;
        } catch (URISyntaxException e) {
            log.debug("Ignoring unparsable landing URL {} for {}", landed, requested);
            return requested;
        }
    }

    private Optional<URI> nextPage(BrowserSession session, URI current) throws PaginationException {
        Optional<BrowserSession.SessionElement> link = session.findSingle(NEXT_PAGE_SELECTOR);
        if (link.isEmpty()) return Optional.empty();

        String href = link.get().attribute("href").orElse(null);
        URI next;
        try {
            next = UrlUtils.resolve(current, href);
        } catch (URISyntaxException e) {
            throw new PaginationException("Next page link of " + current + " is not a URL: " + href, href, e);
        }
        if (!UrlUtils.isSameSite(current, next)) {
            log.warn("Next page {} leaves {}", next, current.getHost());
        }
        log.debug("Next page: {}", next);
        return Optional.of(next);
    }
}
