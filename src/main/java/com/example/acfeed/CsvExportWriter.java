package com.example.acfeed;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * UTF-8 CSV, comma separated, {@code \n} line ends. Fields are quoted only when they contain a
 * separator, quote or line break; {@code null} becomes an empty field.
 */
public class CsvExportWriter implements ExportWriter {

    @Override
    public String extension() {
        return "csv";
    }

    @Override
    public void write(ExportRecord record, Path out) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            w.write(line(ExportRecord.headers()));
            w.write('\n');
            w.write(line(record.values()));
            w.write('\n');
        }
    }

    static String line(List<String> fields) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(csv(fields.get(i)));
        }
        return sb.toString();
    }

    static String csv(String v) {
        if (v == null) return "";
        boolean needsQuotes = v.indexOf(',') >= 0 || v.indexOf('"') >= 0
                              || v.indexOf('\n') >= 0 || v.indexOf('\r') >= 0;
        if (!needsQuotes) return v;
        return "\"" + v.replace("\"", "\"\"") + "\"";
    }
}
