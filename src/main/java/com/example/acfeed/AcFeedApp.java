package com.example.acfeed;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;

/**
 * Command-line entry point.
 *
 * <pre>
 * AcFeedApp [crawl|extract|all] [startUrl] [sourcesDir] [exportDir] [csv|xlsx] [-v|-q] [--headed]
 * </pre>
 *
 * Without positional arguments the settings are asked for interactively; an empty answer keeps the default.
 */
public class AcFeedApp {

    private static final Logger log = LoggerFactory.getLogger(AcFeedApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIGURATION = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        List<String> positional = new ArrayList<>();
        boolean verbose = false;
        boolean quiet = false;
        boolean headed = false;
        for (String a : args) {
            switch (a) {
                case "-v", "--verbose" -> verbose = true;
                case "-q", "--quiet" -> quiet = true;
                case "--headed" -> headed = true;
                default -> positional.add(a);
            }
        }
        configureLogging(verbose, quiet);

        FeedSettings settings;
        try {
            settings = positional.isEmpty()
                    ? promptSettings(new Scanner(System.in), !headed)
                    : parseSettings(positional, !headed);
        } catch (ConfigurationException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_CONFIGURATION;
        }

        System.out.println("\n--- Configuration ---");
        System.out.println("Mode: " + settings.getMode());
        System.out.println("Start URL: " + settings.getStartUrl());
        System.out.println("Page sources: " + settings.getSourcesDir());
        System.out.println("Product exports: " + settings.getExportDir() + " (" + settings.getFormat() + ")");
        System.out.println("----------------------\n");

        try {
            FeedPipeline pipeline = FeedPipeline.create(settings,
                    PlaywrightBrowserSession.factory(settings.isHeadless(), settings.getNavigationTimeoutMs()));
            pipeline.prepareDirectories();

            long start = System.currentTimeMillis();
            if (settings.getMode().crawls()) {
                CrawlReport report = pipeline.crawl();
                System.out.printf("Saved %d of %d page(s) to %s%n",
                        report.getSavedCaptures().size(), report.getVisitedPages(), settings.getSourcesDir());
            }
            if (settings.getMode().extracts()) {
                int written = pipeline.export();
                System.out.printf("Wrote %d product file(s) to %s%n", written, settings.getExportDir());
            }
            long elapsed = (System.currentTimeMillis() - start) / 1000;
            System.out.printf("Done in %d seconds.%n", elapsed);
            return EXIT_OK;

        } catch (ConfigurationException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_CONFIGURATION;
        } catch (Exception e) {
            log.error("Run failed", e);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    // -----------------------------
    // Settings
    // -----------------------------

    static FeedSettings parseSettings(List<String> positional, boolean headless) throws ConfigurationException {
        if (positional.size() > 5) {
            throw new ConfigurationException("Too many arguments: " + positional);
        }
        FeedSettings d = FeedSettings.defaults();
        RunMode mode = RunMode.parse(arg(positional, 0));
        String startUrl = orDefault(arg(positional, 1), d.getStartUrl());
        Path sources = Path.of(orDefault(arg(positional, 2), d.getSourcesDir().toString()));
        Path exports = Path.of(orDefault(arg(positional, 3), d.getExportDir().toString()));
        ExportFormat format = ExportFormat.parse(arg(positional, 4));
        return new FeedSettings(mode, startUrl, sources, exports, format, headless, d.getNavigationTimeoutMs());
    }

    private static FeedSettings promptSettings(Scanner scanner, boolean headless) throws ConfigurationException {
        FeedSettings d = FeedSettings.defaults();
        System.out.println("=================================");
        System.out.println(" AC Feed Extractor");
        System.out.println("=================================\n");

        List<String> answers = new ArrayList<>();
        answers.add(prompt(scanner, "Mode (crawl, extract, all)", "all"));
        answers.add(prompt(scanner, "Start URL", d.getStartUrl()));
        answers.add(prompt(scanner, "Page sources directory", d.getSourcesDir().toString()));
        answers.add(prompt(scanner, "Product export directory", d.getExportDir().toString()));
        answers.add(prompt(scanner, "Export format (csv, xlsx)", "csv"));
        return parseSettings(answers, headless);
    }

    // -----------------------------
    // Helpers
    // -----------------------------

    private static String prompt(Scanner sc, String msg, String defaultValue) {
        System.out.print(msg + " [" + defaultValue + "]\n> ");
        if (!sc.hasNextLine()) return defaultValue;
        String val = sc.nextLine().trim();
        return val.isEmpty() ? defaultValue : val;
    }

    private static String arg(List<String> args, int i) {
        return i < args.size() ? args.get(i) : null;
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static void configureLogging(boolean verbose, boolean quiet) {
        ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        }
    }
}
