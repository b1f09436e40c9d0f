package com.example.aggregates;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the row-id indices handed to synthesis and navigation.
 */
public class IndexBuilder {

    /**
     * @param df             the cleaned microdata; row ids are row positions
     * @param records        {@code df}'s rows normalized with the same {@code sensitiveZeros}
     * @param sensitiveZeros columns for which {@code "0"} is a reportable value
     */
    public static RecordIndex buildIndices(SimpleDataFrame df, List<Record> records, Set<String> sensitiveZeros) {
        if (df.getRowCount() != records.size()) {
            throw new IllegalArgumentException("Expected one record per row: " + df.getRowCount()
                    + " rows but " + records.size() + " records");
        }
        return new RecordIndex(attributeToRowIds(records), columnValueToRowIds(df, sensitiveZeros));
    }

    /**
     * Maps every pair that occurs in {@code records} to the positions of the records
     * containing it.
     */
    public static Map<AttributeValuePair, Set<Integer>> attributeToRowIds(List<Record> records) {
        Map<AttributeValuePair, Set<Integer>> index = new TreeMap<>(AttributeValuePair.CANONICAL_ORDER);
        for (int rowId = 0; rowId < records.size(); rowId++) {
            for (AttributeValuePair pair : records.get(rowId).getPairs()) {
                Set<Integer> ids = index.get(pair);
                if (ids == null) {
                    ids = new TreeSet<>();
                    index.put(pair, ids);
                }
                ids.add(rowId);
            }
        }
        Map<AttributeValuePair, Set<Integer>> readOnly = new TreeMap<>(AttributeValuePair.CANONICAL_ORDER);
        for (Map.Entry<AttributeValuePair, Set<Integer>> entry : index.entrySet()) {
            readOnly.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
        }
        return Collections.unmodifiableMap(readOnly);
    }

    /**
     * Maps every column to each of its raw values and the rows holding that value. A
     * {@code "0"} in a column that is not a sensitive zero is filed under {@code ""}.
     */
    public static Map<String, Map<String, List<Integer>>> columnValueToRowIds(SimpleDataFrame df,
                                                                             Set<String> sensitiveZeros) {
        Map<String, Map<String, List<Integer>>> index = new LinkedHashMap<>();
        for (String column : df.getColumnHeaders()) {
            index.put(column, new TreeMap<>());
        }
        for (int rowId = 0; rowId < df.getRowCount(); rowId++) {
            for (Map.Entry<String, String> cell : df.getRow(rowId).entrySet()) {
                String column = cell.getKey();
                String value = cell.getValue();
                if (RecordNormalizer.ZERO.equals(value) && !sensitiveZeros.contains(column)) {
                    value = "";
                }
                Map<String, List<Integer>> valueToIds = index.get(column);
                List<Integer> ids = valueToIds.get(value);
                if (ids == null) {
                    ids = new ArrayList<>();
                    valueToIds.put(value, ids);
                }
                ids.add(rowId);
            }
        }

        Map<String, Map<String, List<Integer>>> readOnly = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, List<Integer>>> column : index.entrySet()) {
            Map<String, List<Integer>> values = new TreeMap<>();
            for (Map.Entry<String, List<Integer>> value : column.getValue().entrySet()) {
                values.put(value.getKey(), Collections.unmodifiableList(value.getValue()));
            }
            readOnly.put(column.getKey(), Collections.unmodifiableMap(values));
        }
        return Collections.unmodifiableMap(readOnly);
    }
}
