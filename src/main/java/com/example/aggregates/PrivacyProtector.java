package com.example.aggregates;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Rounds and thresholds combination counts before they are reported.
 * <p>
 * A count is rounded to the nearest multiple of the precision, ties going to the even
 * multiple (so with precision 10, 15 and 25 both round to 20). The rounded count is
 * reported if it reaches the threshold, otherwise it is suppressed to 0.
 */
public class PrivacyProtector {

    /**
     * @param rawCount  the count to protect
     * @param threshold the smallest reportable rounded count
     * @param precision the rounding granularity; values below 1 disable rounding
     * @return 0, or a multiple of {@code precision} that is at least {@code threshold}
     */
    public static int protect(int rawCount, int threshold, int precision) {
        int step = Math.max(precision, 1);
        long rounded = BigDecimal.valueOf(rawCount)
                .divide(BigDecimal.valueOf(step), 0, RoundingMode.HALF_EVEN)
                .longValueExact() * step;
        if (rounded > Integer.MAX_VALUE) {
            rounded -= step;
        }
        return rounded >= threshold ? (int) rounded : 0;
    }

    /**
     * @return a new table with every count of {@code raw} protected; suppressed combos
     *         stay in the table with a count of 0
     */
    public static CountTable protectAll(CountTable raw, int threshold, int precision) {
        CountTable protectedTable = new CountTable();
        for (int length : raw.getLengths()) {
            protectedTable.addLength(length);
            for (Map.Entry<Combo, Integer> entry : raw.getCounts(length).entrySet()) {
                protectedTable.put(length, entry.getKey(), protect(entry.getValue(), threshold, precision));
            }
        }
        return protectedTable;
    }
}
