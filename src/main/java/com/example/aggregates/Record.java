package com.example.aggregates;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The canonical form of one microdata row: its reportable pairs sorted by
 * {@link AttributeValuePair#CANONICAL_ORDER}, at most one pair per attribute.
 */
public final class Record {

    private static final Record EMPTY = new Record(List.of());

    private final List<AttributeValuePair> pairs;

    private Record(List<AttributeValuePair> sortedPairs) {
        this.pairs = sortedPairs;
    }

    /**
     * Builds a record from pairs in any order.
     *
     * @throws IllegalArgumentException if two pairs share an attribute
     */
    public static Record of(List<AttributeValuePair> pairs) {
        if (pairs.isEmpty()) {
            return EMPTY;
        }
        Set<String> attributes = new HashSet<>();
        for (AttributeValuePair pair : pairs) {
            if (!attributes.add(pair.getAttribute())) {
                throw new IllegalArgumentException("Duplicate attribute in record: " + pair.getAttribute());
            }
        }
        List<AttributeValuePair> sorted = new ArrayList<>(pairs);
        sorted.sort(AttributeValuePair.CANONICAL_ORDER);
        return new Record(Collections.unmodifiableList(sorted));
    }

    public static Record empty() {
        return EMPTY;
    }

    public List<AttributeValuePair> getPairs() {
        return pairs;
    }

    public AttributeValuePair get(int index) {
        return pairs.get(index);
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    /**
     * @return the whole record as a single combination of length {@link #size()}
     */
    public Combo toCombo() {
        return Combo.ofSorted(pairs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Record && pairs.equals(((Record) o).pairs);
    }

    @Override
    public int hashCode() {
        return pairs.hashCode();
    }

    @Override
    public String toString() {
        return "Record" + pairs;
    }
}
