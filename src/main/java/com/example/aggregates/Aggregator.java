package com.example.aggregates;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs the aggregation steps over a cleaned microdata table: normalize, count, protect,
 * and index.
 */
public class Aggregator {

    private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

    /**
     * @throws CombinatorialExplosionException if a length pass exceeds the configured combo budget
     */
    public static AggregationResult aggregate(SimpleDataFrame df, AggregationConfig config) {
        LOG.info("Aggregating {} rows with {}", df.getRowCount(), config);

        List<Record> records = RecordNormalizer.normalizeAll(df, config.getSensitiveZeros());
        CountTable raw = ComboCounter.countAll(records, config.getReportingLength(),
                config.getParallelJobs(), config.getMaxCombosPerLength());
        CountTable protectedCounts = PrivacyProtector.protectAll(raw,
                config.getReportingThreshold(), config.getReportingPrecision());
        RecordIndex index = IndexBuilder.buildIndices(df, records, config.getSensitiveZeros());

        List<LengthSummary> summaries = LengthSummary.summarize(raw, protectedCounts);
        for (LengthSummary summary : summaries) {
            LOG.info("{}", summary);
        }
        return new AggregationResult(records, raw, protectedCounts, index, summaries);
    }

    /**
     * Aggregates {@code df} and writes the protected counts to {@code output}.
     */
    public static AggregationResult aggregateToFile(SimpleDataFrame df, AggregationConfig config, Path output)
            throws IOException {
        AggregationResult result = aggregate(df, config);
        AggregateStore.write(output, result.getProtectedCounts());
        return result;
    }

    /**
     * Returns the protected counts stored at {@code path}, aggregating {@code df} and
     * writing the file first if it does not exist yet.
     */
    public static CountTable loadOrAggregate(Path path, SimpleDataFrame df, AggregationConfig config)
            throws IOException {
        if (!Files.exists(path)) {
            LOG.info("Missing protected aggregates at {}; aggregating", path);
            aggregateToFile(df, config, path);
        }
        return AggregateStore.load(path);
    }
}
