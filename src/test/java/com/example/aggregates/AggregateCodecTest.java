package com.example.aggregates;

import static com.example.aggregates.TestData.combo;
import static com.example.aggregates.TestData.record;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class AggregateCodecTest {

    @Test
    public void testEncode() {
        assertEquals("age:42;sex:F", AggregateCodec.encode(combo("sex", "F", "age", "42")));
        assertEquals("age:42", AggregateCodec.encode(combo("age", "42")));
        assertEquals("", AggregateCodec.encode(Combo.of(List.of())));
    }

    @Test
    public void testDecode() {
        DecodedCombo decoded = AggregateCodec.decode("age:42;sex:F");
        assertEquals(2, decoded.getLength());
        assertEquals(combo("age", "42", "sex", "F"), decoded.getCombo());
        assertFalse(decoded.isLossy());
    }

    @Test
    public void testRoundTrip() {
        Record record = record("zip", "12345", "Age", "42", "sex", "F", "income", "0", "city", "Lyon");
        for (int length = 1; length <= record.size(); length++) {
            for (Combo combo : ComboEnumerator.enumerate(record, length)) {
                assertEquals(new DecodedCombo(length, combo), AggregateCodec.decode(AggregateCodec.encode(combo)));
            }
        }
    }

    @Test
    public void testMalformedSegmentsDropped() {
        DecodedCombo decoded = AggregateCodec.decode("age:42;junk;a:b:c;sex:F");
        assertEquals(4, decoded.getLength());
        assertEquals(combo("age", "42", "sex", "F"), decoded.getCombo());
        assertTrue(decoded.isLossy());
    }

    @Test
    public void testTrailingSeparatorCountsAsSegment() {
        DecodedCombo decoded = AggregateCodec.decode("age:42;");
        assertEquals(2, decoded.getLength());
        assertEquals(combo("age", "42"), decoded.getCombo());
    }

    @Test
    public void testEmptyValueAllowedInSegment() {
        DecodedCombo decoded = AggregateCodec.decode("age:");
        assertEquals(1, decoded.getLength());
        assertEquals(combo("age", ""), decoded.getCombo());
    }

    @Test
    public void testComboToStringIsEncoding() {
        Combo combo = combo("b", "2", "a", "1");
        assertEquals(AggregateCodec.encode(combo), combo.toString());
    }
}
