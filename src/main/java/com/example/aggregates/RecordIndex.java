package com.example.aggregates;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Row-id lookups over one microdata table, built by {@link IndexBuilder}. All views are
 * read-only.
 */
public class RecordIndex {
    private final Map<AttributeValuePair, Set<Integer>> attributeToRowIds;
    private final Map<String, Map<String, List<Integer>>> columnValueToRowIds;

    RecordIndex(Map<AttributeValuePair, Set<Integer>> attributeToRowIds,
                Map<String, Map<String, List<Integer>>> columnValueToRowIds) {
        this.attributeToRowIds = attributeToRowIds;
        this.columnValueToRowIds = columnValueToRowIds;
    }

    /**
     * @return reportable pair to the ids of the rows containing it
     */
    public Map<AttributeValuePair, Set<Integer>> getAttributeToRowIds() {
        return attributeToRowIds;
    }

    /**
     * @return column to cell value to ascending row ids. Non-reportable zeros are filed
     *         under the empty string.
     */
    public Map<String, Map<String, List<Integer>>> getColumnValueToRowIds() {
        return columnValueToRowIds;
    }

    public Set<Integer> getRowIds(AttributeValuePair pair) {
        Set<Integer> ids = attributeToRowIds.get(pair);
        return ids == null ? Collections.emptySet() : ids;
    }

    public List<Integer> getRowIds(String column, String value) {
        Map<String, List<Integer>> valueToIds = columnValueToRowIds.get(column);
        if (valueToIds == null) {
            return Collections.emptyList();
        }
        List<Integer> ids = valueToIds.get(value);
        return ids == null ? Collections.emptyList() : ids;
    }

    /**
     * @return ids of the rows containing every pair of {@code combo}, ascending
     */
    public Set<Integer> getRowIds(Combo combo) {
        Set<Integer> result = null;
        for (AttributeValuePair pair : combo.getPairs()) {
            Set<Integer> ids = getRowIds(pair);
            if (result == null) {
                result = new TreeSet<>(ids);
            } else {
                result.retainAll(ids);
            }
            if (result.isEmpty()) {
                break;
            }
        }
        return result == null ? Collections.emptySet() : Collections.unmodifiableSet(result);
    }
}
