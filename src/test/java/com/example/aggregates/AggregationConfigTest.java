package com.example.aggregates;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class AggregationConfigTest {

    @Test
    public void testDefaults() {
        AggregationConfig config = AggregationConfig.builder().build();
        assertEquals(3, config.getReportingLength());
        assertEquals(10, config.getReportingThreshold());
        assertEquals(10, config.getReportingPrecision());
        assertEquals(1, config.getParallelJobs());
        assertTrue(config.getSensitiveZeros().isEmpty());
        assertEquals(AggregationConfig.DEFAULT_MAX_COMBOS_PER_LENGTH, config.getMaxCombosPerLength());
    }

    @Test
    public void testEmptyMapUsesProtectiveDefaults() {
        AggregationConfig config = AggregationConfig.fromMap(Map.of());
        assertEquals(AggregationConfig.DEFAULT_REPORTING_LENGTH, config.getReportingLength());
        assertEquals(AggregationConfig.DEFAULT_REPORTING_THRESHOLD, config.getReportingThreshold());
        assertEquals(AggregationConfig.DEFAULT_REPORTING_PRECISION, config.getReportingPrecision());

        SimpleDataFrame single = TestData.frame(List.of("a", "b"), new String[]{"1", "x"});
        AggregationResult result = Aggregator.aggregate(single, config);
        // a unique record is counted but never published
        assertEquals(1, result.getRawCounts().getCount(TestData.combo("a", "1", "b", "x")));
        assertEquals(0, result.getProtectedCounts().getCount(TestData.combo("a", "1", "b", "x")));
        assertEquals(0, result.getProtectedCounts().getCount(TestData.combo("a", "1")));
    }

    @Test
    public void testFromMap() {
        Map<String, Object> options = new HashMap<>();
        options.put("reporting_length", 3);
        options.put("reporting_threshold", "10");
        options.put("reporting_precision", 5L);
        options.put("parallel_jobs", -1);
        options.put("sensitive_zeros", List.of("income", "children"));
        options.put("max_combos_per_length", 0);
        options.put("synthetic_microdata_path", "out/synthetic.tsv");

        AggregationConfig config = AggregationConfig.fromMap(options);
        assertEquals(3, config.getReportingLength());
        assertEquals(10, config.getReportingThreshold());
        assertEquals(5, config.getReportingPrecision());
        assertEquals(-1, config.getParallelJobs());
        assertEquals(Set.of("income", "children"), config.getSensitiveZeros());
        assertEquals(0, config.getMaxCombosPerLength());
    }

    @Test
    public void testSensitiveZerosAsString() {
        AggregationConfig config = AggregationConfig.fromMap(Map.of("sensitive_zeros", "income, children,"));
        assertEquals(Set.of("income", "children"), config.getSensitiveZeros());
    }

    @Test
    public void testInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> AggregationConfig.builder().reportingLength(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> AggregationConfig.builder().reportingLength(-2).build());
        assertThrows(IllegalArgumentException.class,
                () -> AggregationConfig.builder().reportingThreshold(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> AggregationConfig.builder().reportingPrecision(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> AggregationConfig.fromMap(Map.of("reporting_length", "three")));
        assertThrows(IllegalArgumentException.class,
                () -> AggregationConfig.fromMap(Map.of("reporting_threshold", 1L << 40)));
        assertThrows(IllegalArgumentException.class,
                () -> AggregationConfig.fromMap(Map.of("sensitive_zeros", 7)));
    }

    @Test
    public void testSensitiveZerosImmutable() {
        AggregationConfig config = AggregationConfig.builder().sensitiveZero("income").build();
        assertThrows(UnsupportedOperationException.class, () -> config.getSensitiveZeros().add("age"));
    }
}
