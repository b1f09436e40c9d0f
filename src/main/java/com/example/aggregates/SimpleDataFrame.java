package com.example.aggregates;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-memory microdata table. Every cell is a string; the empty string marks an
 * absent value.
 */
public class SimpleDataFrame {
    private final List<String> headers;
    private final List<Map<String, String>> data;

    public SimpleDataFrame(List<String> headers) {
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
        this.data = new ArrayList<>();
    }

    /**
     * Appends a row. Columns missing from {@code row} are stored as empty strings,
     * keys that are not headers are ignored.
     */
    public void addRow(Map<String, String> row) {
        Map<String, String> newRow = new LinkedHashMap<>();
        for (String header : headers) {
            String value = row.get(header);
            newRow.put(header, value == null ? "" : value);
        }
        data.add(newRow);
    }

    /**
     * Appends a row given in header order.
     */
    public void addRow(List<String> values) {
        if (values.size() != headers.size()) {
            throw new IllegalArgumentException("Expected " + headers.size() + " values but got " + values.size());
        }
        Map<String, String> newRow = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String value = values.get(i);
            newRow.put(headers.get(i), value == null ? "" : value);
        }
        data.add(newRow);
    }

    public List<String> getColumnHeaders() {
        return headers;
    }

    public int getRowCount() {
        return data.size();
    }

    public int getColumnCount() {
        return headers.size();
    }

    public Map<String, String> getRow(int rowIndex) {
        if (rowIndex < 0 || rowIndex >= data.size()) {
            throw new IndexOutOfBoundsException("Row index out of bounds: " + rowIndex);
        }
        return Collections.unmodifiableMap(data.get(rowIndex));
    }

    public List<String> getColumnData(String columnName) {
        if (!headers.contains(columnName)) {
            throw new IllegalArgumentException("Column not found: " + columnName);
        }
        return data.stream()
                .map(row -> row.get(columnName))
                .collect(Collectors.toList());
    }

    /**
     * @return a new frame with only {@code columnsToKeep}, in that order
     * @throws IllegalArgumentException if a column is not present
     */
    public SimpleDataFrame subset(List<String> columnsToKeep) {
        for (String col : columnsToKeep) {
            if (!headers.contains(col)) {
                throw new IllegalArgumentException("Column not found: " + col);
            }
        }
        SimpleDataFrame newDf = new SimpleDataFrame(columnsToKeep);
        for (Map<String, String> oldRow : data) {
            newDf.addRow(oldRow);
        }
        return newDf;
    }

    /**
     * @return a new frame holding the first {@code limit} rows
     */
    public SimpleDataFrame head(int limit) {
        SimpleDataFrame newDf = new SimpleDataFrame(headers);
        for (int i = 0; i < Math.min(limit, data.size()); i++) {
            newDf.data.add(new LinkedHashMap<>(data.get(i)));
        }
        return newDf;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join("\t|\t", headers)).append("\n");
        sb.append(headers.stream().map(h -> "----").collect(Collectors.joining("\t|\t"))).append("\n");

        int rowsToPrint = Math.min(5, data.size());
        for (int i = 0; i < rowsToPrint; i++) {
            Map<String, String> row = data.get(i);
            List<String> rowValues = new ArrayList<>();
            for (String header : headers) {
                rowValues.add(row.get(header));
            }
            sb.append(String.join("\t|\t", rowValues)).append("\n");
        }
        if (data.size() > 5) {
            sb.append("... (").append(data.size() - 5).append(" more rows)\n");
        }
        return sb.toString();
    }
}
