package com.example.acfeed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Crawl, extraction and export wired together for one storefront run.
 */
public class FeedPipeline {

    private static final Logger log = LoggerFactory.getLogger(FeedPipeline.class);

    private final FeedSettings settings;
    private final BrowserSessionFactory sessions;
    private final ProductExtractor extractor;
    private final TemplateMapper mapper;

    FeedPipeline(FeedSettings settings, BrowserSessionFactory sessions,
                 ProductExtractor extractor, TemplateMapper mapper) {
        this.settings = settings;
        this.sessions = sessions;
        this.extractor = extractor;
        this.mapper = mapper;
    }

    /**
     * Validates {@code settings} and builds a pipeline; nothing is touched on disk yet.
     */
    public static FeedPipeline create(FeedSettings settings, BrowserSessionFactory sessions)
            throws ConfigurationException {
        settings.validate();
        TemplateMapper mapper = new TemplateMapper(ProductTypeDetector.load(), settings.getFormat().newWriter());
        return new FeedPipeline(settings, sessions, new ProductExtractor(), mapper);
    }

    public void prepareDirectories() throws IOException {
        log.debug("Creating output directories {} and {}, if missing",
                settings.getSourcesDir(), settings.getExportDir());
        Files.createDirectories(settings.getSourcesDir());
        Files.createDirectories(settings.getExportDir());
    }

    public CrawlReport crawl() throws FeedException, IOException {
        PageCrawler crawler = new PageCrawler(sessions, new PageStore(settings.getSourcesDir()));
        return crawler.crawl(settings.getStartUrl());
    }

    /**
     * Extracts every saved page and writes one export file per product.
     *
     * @return number of export files written
     */
    public int export() throws FeedException, IOException {
        List<ProductRecord> products = extractor.extract(settings.getSourcesDir(), settings.getExportDir());

        int written = 0;
        Set<String> seenCodes = new HashSet<>();
        for (ProductRecord product : products) {
            if (!seenCodes.add(product.productCode)) {
                log.warn("Product code '{}' seen again; '{}' replaces the earlier export", product.productCode,
                        product.name);
            }
            try {
                mapper.toExport(product, settings.getExportDir());
                written++;
            } catch (IOException e) {
                log.warn("Could not write export for '{}' ({}): {}", product.name, product.productCode,
                        e.getMessage());
            }
        }
        log.info("Wrote {} export file(s) to {}", written, settings.getExportDir());
        return written;
    }
}
