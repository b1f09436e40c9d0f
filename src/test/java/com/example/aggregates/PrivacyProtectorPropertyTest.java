package com.example.aggregates;

import static org.junit.jupiter.api.Assertions.*;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

class PrivacyProtectorPropertyTest {

    @Property
    void protectedCountIsMultipleOfPrecision(
            @ForAll @IntRange(min = 0, max = 1_000_000) int count,
            @ForAll @IntRange(min = 0, max = 1000) int threshold,
            @ForAll @IntRange(min = 1, max = 100) int precision) {
        assertEquals(0, PrivacyProtector.protect(count, threshold, precision) % precision);
    }

    @Property
    void protectedCountIsZeroOrAtLeastThreshold(
            @ForAll @IntRange(min = 0, max = 1_000_000) int count,
            @ForAll @IntRange(min = 0, max = 1000) int threshold,
            @ForAll @IntRange(min = 1, max = 100) int precision) {
        int protectedCount = PrivacyProtector.protect(count, threshold, precision);
        assertTrue(protectedCount == 0 || protectedCount >= threshold,
                "protect(" + count + ", " + threshold + ", " + precision + ") = " + protectedCount);
    }

    @Property
    void protectedCountIsNearestMultiple(
            @ForAll @IntRange(min = 0, max = 1_000_000) int count,
            @ForAll @IntRange(min = 1, max = 100) int precision) {
        int protectedCount = PrivacyProtector.protect(count, 0, precision);
        assertTrue(2L * Math.abs(protectedCount - count) <= precision,
                "protect(" + count + ", 0, " + precision + ") = " + protectedCount);
    }

    @Property
    void protectionIsMonotone(
            @ForAll @IntRange(min = 0, max = 100_000) int count,
            @ForAll @IntRange(min = 0, max = 1000) int threshold,
            @ForAll @IntRange(min = 1, max = 100) int precision) {
        assertTrue(PrivacyProtector.protect(count, threshold, precision)
                <= PrivacyProtector.protect(count + 1, threshold, precision));
    }
}
