package com.example.aggregates;

import static com.example.aggregates.TestData.combo;
import static com.example.aggregates.TestData.frame;
import static com.example.aggregates.TestData.pair;
import static com.example.aggregates.TestData.record;
import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class RecordNormalizerTest {

    @Test
    public void testZeroDroppedUnlessSensitive() {
        Map<String, String> row = Map.of("A", "1", "B", "0");
        List<String> columns = List.of("A", "B");

        Record plain = RecordNormalizer.normalize(row, columns, Set.of());
        assertEquals(record("A", "1"), plain);
        assertFalse(plain.getPairs().contains(pair("B", "0")));

        Record sensitive = RecordNormalizer.normalize(row, columns, Set.of("B"));
        assertEquals(2, sensitive.size());
        assertTrue(sensitive.getPairs().contains(pair("B", "0")));
    }

    @Test
    public void testEmptyValuesDropped() {
        Map<String, Object> row = new HashMap<>();
        row.put("A", "");
        row.put("B", null);
        row.put("C", "x");
        Record normalized = RecordNormalizer.normalize(row, List.of("A", "B", "C", "D"), Set.of());
        assertEquals(record("C", "x"), normalized);
    }

    @Test
    public void testAllAbsentRowIsEmpty() {
        Record normalized = RecordNormalizer.normalize(Map.of("A", "", "B", "0"), List.of("A", "B"), Set.of());
        assertTrue(normalized.isEmpty());
        assertTrue(ComboEnumerator.enumerate(normalized, 1).isEmpty());
    }

    @Test
    public void testCanonicalOrderIgnoresColumnOrder() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("zip", "12345");
        row.put("Age", "42");
        row.put("sex", "F");

        Record forward = RecordNormalizer.normalize(row, List.of("zip", "Age", "sex"), Set.of());
        Record backward = RecordNormalizer.normalize(row, List.of("sex", "Age", "zip"), Set.of());
        assertEquals(forward, backward);
        // sorted by lowercase "attribute:value"
        assertEquals(List.of(pair("Age", "42"), pair("sex", "F"), pair("zip", "12345")), forward.getPairs());
    }

    @Test
    public void testSortKeyIsCaseInsensitive() {
        Record normalized = RecordNormalizer.normalize(Map.of("b", "1", "A", "2", "C", "3"),
                List.of("b", "A", "C"), Set.of());
        assertEquals(List.of(pair("A", "2"), pair("b", "1"), pair("C", "3")), normalized.getPairs());
    }

    @Test
    public void testNonStringCells() {
        Map<String, Object> row = new HashMap<>();
        row.put("n", 7);
        row.put("z", 0);
        Record normalized = RecordNormalizer.normalize(row, List.of("n", "z"), Set.of());
        assertEquals(record("n", "7"), normalized);
    }

    @Test
    public void testNormalizeAllKeepsRowOrder() {
        SimpleDataFrame df = frame(List.of("A", "B"),
                new String[]{"1", "x"},
                new String[]{"", "0"},
                new String[]{"2", "0"});
        List<Record> records = RecordNormalizer.normalizeAll(df, Set.of("B"));
        assertEquals(3, records.size());
        assertEquals(record("A", "1", "B", "x"), records.get(0));
        assertEquals(record("B", "0"), records.get(1));
        assertEquals(record("A", "2", "B", "0"), records.get(2));
    }

    @Test
    public void testDuplicateColumnRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> RecordNormalizer.normalize(Map.of("A", "1"), List.of("A", "A"), Set.of()));
    }

    @Test
    public void testRowToComboKeepsZeros() {
        Combo combo = RecordNormalizer.rowToCombo(new String[]{"0", "", "x"}, List.of("b", "c", "a"));
        assertEquals(combo("a", "x", "b", "0"), combo);
        assertEquals("a:x;b:0", combo.toString());
    }

    @Test
    public void testRowToComboWidthMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> RecordNormalizer.rowToCombo(new String[]{"1"}, List.of("a", "b")));
    }
}
