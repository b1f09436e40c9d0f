package com.example.aggregates;

import java.util.List;

public class AggregationResult {
    private final List<Record> records;
    private final CountTable rawCounts;
    private final CountTable protectedCounts;
    private final RecordIndex index;
    private final List<LengthSummary> summaries;

    public AggregationResult(List<Record> records, CountTable rawCounts, CountTable protectedCounts,
                             RecordIndex index, List<LengthSummary> summaries) {
        this.records = List.copyOf(records);
        this.rawCounts = rawCounts;
        this.protectedCounts = protectedCounts;
        this.index = index;
        this.summaries = List.copyOf(summaries);
    }

    public List<Record> getRecords() {
        return records;
    }

    public CountTable getRawCounts() {
        return rawCounts;
    }

    public CountTable getProtectedCounts() {
        return protectedCounts;
    }

    public RecordIndex getIndex() {
        return index;
    }

    public List<LengthSummary> getSummaries() {
        return summaries;
    }
}
