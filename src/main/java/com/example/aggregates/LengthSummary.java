package com.example.aggregates;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * How many combos of one length were found and how many survived protection.
 */
public class LengthSummary {
    private final int length;
    private final int distinctCombos;
    private final int reportedCombos;
    private final long totalCount;

    public LengthSummary(int length, int distinctCombos, int reportedCombos, long totalCount) {
        this.length = length;
        this.distinctCombos = distinctCombos;
        this.reportedCombos = reportedCombos;
        this.totalCount = totalCount;
    }

    /**
     * Summarizes each length of {@code raw} against its protected counterpart.
     */
    public static List<LengthSummary> summarize(CountTable raw, CountTable protectedTable) {
        List<LengthSummary> summaries = new ArrayList<>();
        for (int length : raw.getLengths()) {
            Map<Combo, Integer> counts = raw.getCounts(length);
            long total = 0;
            for (int count : counts.values()) {
                total += count;
            }
            int reported = 0;
            for (int count : protectedTable.getCounts(length).values()) {
                if (count > 0) {
                    reported++;
                }
            }
            summaries.add(new LengthSummary(length, counts.size(), reported, total));
        }
        return summaries;
    }

    public int getLength() {
        return length;
    }

    public int getDistinctCombos() {
        return distinctCombos;
    }

    public int getReportedCombos() {
        return reportedCombos;
    }

    public int getSuppressedCombos() {
        return distinctCombos - reportedCombos;
    }

    /** Sum of the raw counts, i.e. combo occurrences over all records. */
    public long getTotalCount() {
        return totalCount;
    }

    public double getSuppressedFraction() {
        return distinctCombos == 0 ? 0.0 : (double) getSuppressedCombos() / distinctCombos;
    }

    @Override
    public String toString() {
        return String.format("length %d: %d combos, %d reported, %.4f suppressed",
                length, distinctCombos, reportedCombos, getSuppressedFraction());
    }
}
