package com.fxledger.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Untyped tabular input as handed over by the spreadsheet and PDF readers: header names plus one
 * header-to-text map per row.
 *
 * <p>Header names are matched after trimming, since broker exports pad them with whitespace.
 * When no header list is given, the columns are the union of the row keys in encounter order.
 */
@Getter
public final class RawTable {

    private final List<String> columns;
    private final List<Map<String, String>> rows;
    @Getter(AccessLevel.NONE)
    private final Map<String, String> headersByTrimmedName;

    private RawTable(List<String> columns, List<Map<String, String>> rows) {
        this.rows = rows != null ? List.copyOf(rows) : List.of();
        this.columns = List.copyOf(resolveColumns(columns, this.rows));
        Map<String, String> headers = new LinkedHashMap<>();
        for (String column : this.columns) {
            headers.putIfAbsent(column.trim(), column);
        }
        this.headersByTrimmedName = Collections.unmodifiableMap(headers);
    }

    public static RawTable of(List<String> columns, List<Map<String, String>> rows) {
        return new RawTable(columns, rows);
    }

    public static RawTable of(List<Map<String, String>> rows) {
        return new RawTable(null, rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /** Returns the actual header key of the first candidate name present in this table. */
    public Optional<String> findColumn(List<String> candidates) {
        for (String candidate : candidates) {
            String header = headersByTrimmedName.get(candidate.trim());
            if (header != null) {
                return Optional.of(header);
            }
        }
        return Optional.empty();
    }

    /** Raw cell text, or null when the row has no value under {@code header}. */
    public static String cell(Map<String, String> row, String header) {
        if (header == null) {
            return null;
        }
        return row.get(header);
    }

    private static List<String> resolveColumns(List<String> columns, List<Map<String, String>> rows) {
        if (columns != null && !columns.isEmpty()) {
            return new ArrayList<>(columns);
        }
        Set<String> union = new LinkedHashSet<>();
        for (Map<String, String> row : rows) {
            union.addAll(row.keySet());
        }
        return new ArrayList<>(union);
    }
}
