package com.example.aggregates;

import org.apache.commons.math3.util.CombinatoricsUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Enumerates the fixed-length combinations of a single record.
 * <p>
 * A record of {@code n} pairs yields {@code C(n, length)} combos, so work and memory
 * grow exponentially with row width. Callers counting many rows should bound the total
 * with {@link ComboCounter#estimateComboCount}.
 */
public class ComboEnumerator {

    /**
     * @return every {@code length}-sized combo of {@code record}'s pairs, in a fixed order
     *         for a given record; empty if {@code length} is not in {@code [1, record.size()]}
     */
    public static Set<Combo> enumerate(Record record, int length) {
        int n = record.size();
        if (length <= 0 || length > n) {
            return Collections.emptySet();
        }
        if (length == n) {
            return Collections.singleton(record.toCombo());
        }

        Set<Combo> combos = new LinkedHashSet<>();
        Iterator<int[]> indices = CombinatoricsUtils.combinationsIterator(n, length);
        while (indices.hasNext()) {
            combos.add(select(record, indices.next()));
        }
        return combos;
    }

    // sorted indices over a sorted record give a canonical selection
    private static Combo select(Record record, int[] indices) {
        Arrays.sort(indices);
        AttributeValuePair[] pairs = new AttributeValuePair[indices.length];
        for (int i = 0; i < indices.length; i++) {
            pairs[i] = record.get(indices[i]);
        }
        return Combo.ofSorted(Collections.unmodifiableList(Arrays.asList(pairs)));
    }
}
