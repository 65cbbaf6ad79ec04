package com.example.acfeed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One row of the catalog import file. Every {@link ExportColumn} is always part of the row; columns
 * nobody set are {@code null} and written as empty cells.
 */
public class ExportRecord {

    private final Map<ExportColumn, String> values = new EnumMap<>(ExportColumn.class);

    public ExportRecord set(ExportColumn column, String value) {
        values.put(column, value);
        return this;
    }

    public String get(ExportColumn column) {
        return values.get(column);
    }

    /** Cell values in column order, nulls included. */
    public List<String> values() {
        List<String> row = new ArrayList<>(ExportColumn.values().length);
        for (ExportColumn column : ExportColumn.values()) {
            row.add(values.get(column));
        }
        return Collections.unmodifiableList(row);
    }

    public static List<String> headers() {
        List<String> headers = new ArrayList<>(ExportColumn.values().length);
        for (ExportColumn column : ExportColumn.values()) {
            headers.add(column.getHeader());
        }
        return Collections.unmodifiableList(headers);
    }

    @Override
    public String toString() {
        return "ExportRecord" + values;
    }
}
