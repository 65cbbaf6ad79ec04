package com.example.acfeed;

import java.util.Locale;
import java.util.function.Supplier;

public enum ExportFormat {
    CSV(CsvExportWriter::new),
    XLSX(ExcelExportWriter::new);

    private final Supplier<ExportWriter> writer;

    ExportFormat(Supplier<ExportWriter> writer) {
        this.writer = writer;
    }

    public ExportWriter newWriter() {
        return writer.get();
    }

    public static ExportFormat parse(String s) throws ConfigurationException {
        if (s == null || s.isBlank()) return CSV;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown export format: " + s + " (use csv or xlsx)", e);
        }
    }
}
