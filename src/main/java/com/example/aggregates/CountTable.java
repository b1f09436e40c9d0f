package com.example.aggregates;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;

/**
 * Combination counts keyed by combo length, then by combo. Lengths iterate in
 * ascending order and combos in the order they were first inserted.
 * <p>
 * Not thread-safe; a table is filled by a single thread and read afterwards.
 */
public class CountTable {

    private final TreeMap<Integer, Map<Combo, Integer>> lengthToComboToCount = new TreeMap<>();

    /**
     * Adds {@code delta} to the count of {@code combo}, creating entries as needed.
     *
     * @throws IllegalArgumentException if {@code delta} is negative
     */
    public void increment(Combo combo, int delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("Count delta must be non-negative: " + delta);
        }
        Map<Combo, Integer> counts = countsForLength(combo.length());
        Integer current = counts.get(combo);
        if (current == null) {
            counts.put(combo, delta);
        } else {
            counts.put(combo, Math.addExact(current, delta));
        }
    }

    /**
     * Sets the count of {@code combo} under its own length.
     */
    public void put(Combo combo, int count) {
        put(combo.length(), combo, count);
    }

    /**
     * Sets the count of {@code combo} under an explicit length. Reloaded aggregate files
     * may declare a length that differs from the number of well-formed pairs.
     *
     * @throws IllegalArgumentException if {@code count} is negative
     */
    public void put(int length, Combo combo, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must be non-negative: " + count);
        }
        countsForLength(length).put(combo, count);
    }

    /**
     * Ensures {@code length} is present even if no combo of that length was seen.
     */
    public void addLength(int length) {
        countsForLength(length);
    }

    private Map<Combo, Integer> countsForLength(int length) {
        Map<Combo, Integer> counts = lengthToComboToCount.get(length);
        if (counts == null) {
            counts = new LinkedHashMap<>();
            lengthToComboToCount.put(length, counts);
        }
        return counts;
    }

    /**
     * @return the count of {@code combo}, or 0 if it never occurred
     */
    public int getCount(Combo combo) {
        return getCount(combo.length(), combo);
    }

    public int getCount(int length, Combo combo) {
        Map<Combo, Integer> counts = lengthToComboToCount.get(length);
        if (counts == null) {
            return 0;
        }
        Integer count = counts.get(combo);
        return count == null ? 0 : count;
    }

    public NavigableSet<Integer> getLengths() {
        return Collections.unmodifiableNavigableSet(lengthToComboToCount.navigableKeySet());
    }

    /**
     * @return an unmodifiable view of the counts for {@code length}; empty if absent
     */
    public Map<Combo, Integer> getCounts(int length) {
        Map<Combo, Integer> counts = lengthToComboToCount.get(length);
        return counts == null ? Collections.emptyMap() : Collections.unmodifiableMap(counts);
    }

    public int getMaxLength() {
        return lengthToComboToCount.isEmpty() ? 0 : lengthToComboToCount.lastKey();
    }

    /**
     * @return the number of distinct combos over all lengths
     */
    public int size() {
        int size = 0;
        for (Map<Combo, Integer> counts : lengthToComboToCount.values()) {
            size += counts.size();
        }
        return size;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CountTable
                && lengthToComboToCount.equals(((CountTable) o).lengthToComboToCount);
    }

    @Override
    public int hashCode() {
        return lengthToComboToCount.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CountTable{");
        for (Map.Entry<Integer, Map<Combo, Integer>> entry : lengthToComboToCount.entrySet()) {
            sb.append(entry.getKey()).append('=').append(entry.getValue().size()).append(" combos, ");
        }
        if (!lengthToComboToCount.isEmpty()) {
            sb.setLength(sb.length() - 2);
        }
        return sb.append('}').toString();
    }
}
