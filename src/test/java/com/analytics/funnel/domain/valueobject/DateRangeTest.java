package com.analytics.funnel.domain.valueobject;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class DateRangeTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T22:00:00Z"), ZoneOffset.UTC);

    @Test
    void bothDatesAreHonored() {
        DateRange range = DateRange.resolve("2024-01-01", "2024-01-31", CLOCK, 30);

        assertEquals(LocalDate.of(2024, 1, 1), range.getStartDate());
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), range.getFrom());
        assertEquals(LocalDateTime.of(2024, 1, 31, 23, 59, 59), range.getTo());
    }

    @Test
    void missingDateFallsBackToDefaultWindow() {
        DateRange expected = new DateRange(LocalDate.of(2024, 3, 8), LocalDate.of(2024, 3, 15));

        assertEquals(expected, DateRange.resolve(null, null, CLOCK, 7));
        assertEquals(expected, DateRange.resolve("2024-01-01", " ", CLOCK, 7));
        assertEquals(expected, DateRange.resolve(null, "2024-01-31", CLOCK, 7));
    }

    @Test
    void malformedDateIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DateRange.resolve("03/01/2024", "2024-03-02", CLOCK, 30));
    }

    @Test
    void startAfterEndIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DateRange.resolve("2024-03-02", "2024-03-01", CLOCK, 30));
    }

    @Test
    void singleDayRangeCoversWholeDay() {
        DateRange range = DateRange.resolve("2024-03-01", "2024-03-01", CLOCK, 30);

        assertEquals(LocalDateTime.of(2024, 3, 1, 0, 0), range.getFrom());
        assertEquals(LocalDateTime.of(2024, 3, 1, 23, 59, 59), range.getTo());
    }

    @Test
    void clampStartNeverWidens() {
        DateRange range = new DateRange(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 15));

        assertSame(range, range.clampStart(LocalDate.of(2024, 2, 1)));
        assertSame(range, range.clampStart(null));
        DateRange clamped = range.clampStart(LocalDate.of(2024, 3, 10));
        assertEquals(LocalDate.of(2024, 3, 10), clamped.getStartDate());
        assertFalse(clamped.isEmpty());
        assertFalse(range.clampStart(LocalDate.of(2024, 3, 15)).isEmpty());
    }

    @Test
    void clampStartAfterEndDateCoversNoDay() {
        DateRange range = new DateRange(LocalDate.of(2026, 9, 1), LocalDate.of(2026, 9, 30));

        DateRange clamped = range.clampStart(LocalDate.of(2026, 10, 10));

        assertTrue(clamped.isEmpty());
        assertEquals(LocalDate.of(2026, 10, 10), clamped.getStartDate());
        assertEquals(LocalDate.of(2026, 9, 30), clamped.getEndDate());
        assertTrue(clamped.getFrom().isAfter(clamped.getTo()));
        assertTrue(EventScope.of("site-1", clamped).isEmpty());
    }
}
