package com.example.aggregates;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A canonically ordered combination of attribute-value pairs drawn from a single
 * record. Equality is structural over the pairs, so combos can key hash maps
 * directly; {@link #toString()} is the encoded form written to aggregate files.
 */
public final class Combo {

    private final List<AttributeValuePair> pairs;
    private final int hash;

    private Combo(List<AttributeValuePair> pairs) {
        this.pairs = pairs;
        this.hash = pairs.hashCode();
    }

    /**
     * Builds a combo from pairs in any order.
     */
    public static Combo of(List<AttributeValuePair> pairs) {
        List<AttributeValuePair> sorted = new ArrayList<>(pairs);
        sorted.sort(AttributeValuePair.CANONICAL_ORDER);
        return new Combo(Collections.unmodifiableList(sorted));
    }

    public static Combo of(AttributeValuePair... pairs) {
        return of(List.of(pairs));
    }

    // caller guarantees canonical order and immutability
    static Combo ofSorted(List<AttributeValuePair> sortedPairs) {
        return new Combo(sortedPairs);
    }

    public List<AttributeValuePair> getPairs() {
        return pairs;
    }

    public int length() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    /**
     * @return true if every pair of this combo also occurs in {@code other}
     */
    boolean isSubsetOf(Combo other) {
        return other.pairs.containsAll(pairs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Combo)) {
            return false;
        }
        Combo other = (Combo) o;
        return hash == other.hash && pairs.equals(other.pairs);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return AggregateCodec.encode(this);
    }
}
