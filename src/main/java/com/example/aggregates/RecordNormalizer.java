package com.example.aggregates;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw microdata rows into canonical {@link Record}s.
 */
public class RecordNormalizer {

    /** The value treated as absent unless its column is a sensitive zero. */
    public static final String ZERO = "0";

    /**
     * Converts one row to its canonical record. Empty values are dropped, and so is
     * {@code "0"} unless the column is listed in {@code sensitiveZeros}.
     *
     * @param row            column name to cell value; missing or null cells count as empty
     * @param columns        the columns to read from {@code row}
     * @param sensitiveZeros columns for which {@code "0"} is a reportable value
     * @return the record, possibly empty
     */
    public static Record normalize(Map<String, ?> row, List<String> columns, Set<String> sensitiveZeros) {
        List<AttributeValuePair> pairs = new ArrayList<>();
        for (String column : columns) {
            Object cell = row.get(column);
            String value = cell == null ? "" : String.valueOf(cell);
            if (isReportable(column, value, sensitiveZeros)) {
                pairs.add(new AttributeValuePair(column, value));
            }
        }
        return Record.of(pairs);
    }

    /**
     * Normalizes every row of {@code df}, preserving row order so that list positions
     * are row ids.
     */
    public static List<Record> normalizeAll(SimpleDataFrame df, Set<String> sensitiveZeros) {
        List<String> columns = df.getColumnHeaders();
        List<Record> records = new ArrayList<>(df.getRowCount());
        for (int i = 0; i < df.getRowCount(); i++) {
            records.add(normalize(df.getRow(i), columns, sensitiveZeros));
        }
        return records;
    }

    /**
     * Converts a positional row (such as a synthetic record) to a combo of all its
     * non-empty cells. Unlike {@link #normalize} this keeps {@code "0"} values.
     *
     * @throws IllegalArgumentException if {@code row} and {@code columns} differ in length
     */
    public static Combo rowToCombo(String[] row, List<String> columns) {
        if (row.length != columns.size()) {
            throw new IllegalArgumentException("Row has " + row.length + " cells but " + columns.size() + " columns were given");
        }
        List<AttributeValuePair> pairs = new ArrayList<>();
        for (int i = 0; i < row.length; i++) {
            if (row[i] != null && !row[i].isEmpty()) {
                pairs.add(new AttributeValuePair(columns.get(i), row[i]));
            }
        }
        return Combo.of(pairs);
    }

    static boolean isReportable(String column, String value, Set<String> sensitiveZeros) {
        if (value.isEmpty()) {
            return false;
        }
        return !ZERO.equals(value) || sensitiveZeros.contains(column);
    }
}
