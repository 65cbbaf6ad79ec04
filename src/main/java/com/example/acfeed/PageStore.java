package com.example.acfeed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps raw page captures under one root directory so pages don't have to be fetched again
 * every time products are re-extracted.
 */
public class PageStore {

    private static final Logger log = LoggerFactory.getLogger(PageStore.class);

    private final Path root;

    public PageStore(Path root) {
        this.root = root;
    }

    /**
     * Writes the capture under its file name, replacing an older capture of the same URL.
     */
    public Path save(PageCapture capture) throws IOException {
        Path out = root.resolve(capture.getFileName());
        Files.write(out, capture.getRawBytes(),
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        log.info("Saved page {} to {}", capture.getSourceUrl(), out);
        return out;
    }

    /**
     * All regular files under the root, sorted by file name.
     */
    public List<Path> list() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        try (Stream<Path> entries = Files.list(root)) {
            return entries
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    public byte[] read(Path capture) throws IOException {
        return Files.readAllBytes(capture);
    }
}
