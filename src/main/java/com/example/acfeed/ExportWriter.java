package com.example.acfeed;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serializes one export record as a complete file: header row plus one data row.
 */
public interface ExportWriter {

    /** File name extension, without the dot. */
    String extension();

    /** Creates or replaces {@code out}. */
    void write(ExportRecord record, Path out) throws IOException;
}
