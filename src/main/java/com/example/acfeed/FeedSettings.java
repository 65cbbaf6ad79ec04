package com.example.acfeed;

import java.net.URISyntaxException;
import java.nio.file.Path;

/**
 * Everything a run needs to know, resolved from the command line before anything starts.
 */
public final class FeedSettings {

    public static final String DEFAULT_START_URL = "https://www.climatico.ro/aer-conditionat/vrv";
    public static final Path DEFAULT_SOURCES_DIR = Path.of("./out/climatico/sources/");
    public static final Path DEFAULT_EXPORT_DIR = Path.of("./out/climatico/product_info/");
    public static final long DEFAULT_NAVIGATION_TIMEOUT_MS = 45_000;

    private final RunMode mode;
    private final String startUrl;
    private final Path sourcesDir;
    private final Path exportDir;
    private final ExportFormat format;
    private final boolean headless;
    private final long navigationTimeoutMs;

    public FeedSettings(RunMode mode, String startUrl, Path sourcesDir, Path exportDir, ExportFormat format,
                        boolean headless, long navigationTimeoutMs) {
        this.mode = mode;
        this.startUrl = startUrl;
        this.sourcesDir = sourcesDir;
        this.exportDir = exportDir;
        this.format = format;
        this.headless = headless;
        this.navigationTimeoutMs = navigationTimeoutMs;
    }

    public static FeedSettings defaults() {
        return new FeedSettings(RunMode.ALL, DEFAULT_START_URL, DEFAULT_SOURCES_DIR, DEFAULT_EXPORT_DIR,
                ExportFormat.CSV, true, DEFAULT_NAVIGATION_TIMEOUT_MS);
    }

    /**
     * Checks the settings before any directory is created or browser started.
     *
     * @throws ConfigurationException if both roots point at the same directory, the start URL of a
     *                                crawling run is not an absolute URL, or a value is missing
     */
    public void validate() throws ConfigurationException {
        if (mode == null || format == null || sourcesDir == null || exportDir == null) {
            throw new ConfigurationException("Incomplete settings: " + this);
        }
        if (mode.crawls()) {
            if (startUrl == null || startUrl.isBlank()) {
                throw new ConfigurationException("A start URL is required to crawl");
            }
            try {
                UrlUtils.parseAbsolute(startUrl);
            } catch (URISyntaxException e) {
                throw new ConfigurationException("Invalid start URL: " + startUrl, e);
            }
        }
        if (navigationTimeoutMs <= 0) {
            throw new ConfigurationException("Navigation timeout must be positive: " + navigationTimeoutMs);
        }
        if (ProductExtractor.sameDirectory(sourcesDir, exportDir)) {
            throw new ConfigurationException("Page sources and product exports must go to different directories: "
                                             + sourcesDir.toAbsolutePath().normalize());
        }
    }

    public RunMode getMode() {
        return mode;
    }

    public String getStartUrl() {
        return startUrl;
    }

    public Path getSourcesDir() {
        return sourcesDir;
    }

    public Path getExportDir() {
        return exportDir;
    }

    public ExportFormat getFormat() {
        return format;
    }

    public boolean isHeadless() {
        return headless;
    }

    public long getNavigationTimeoutMs() {
        return navigationTimeoutMs;
    }

    @Override
    public String toString() {
        return "FeedSettings{mode=" + mode
               + ", startUrl=" + startUrl
               + ", sourcesDir=" + sourcesDir
               + ", exportDir=" + exportDir
               + ", format=" + format
               + ", headless=" + headless
               + ", navigationTimeoutMs=" + navigationTimeoutMs + "}";
    }
}
