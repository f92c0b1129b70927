package com.analytics.funnel.domain.valueobject;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Inclusive calendar date range of an analysis.
 * <p>
 * The range covers {@code startDate 00:00:00} through {@code endDate 23:59:59}.
 * </p>
 */
public final class DateRange {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private final LocalDate startDate;
    private final LocalDate endDate;

    public DateRange(LocalDate startDate, LocalDate endDate) {
        this(startDate, endDate, false);
    }

    private DateRange(LocalDate startDate, LocalDate endDate, boolean allowEmpty) {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("startDate and endDate cannot be null");
        }
        if (!allowEmpty && startDate.isAfter(endDate)) {
            throw new IllegalArgumentException(
                    "startDate " + startDate + " is after endDate " + endDate);
        }
        this.startDate = startDate;
        this.endDate = endDate;
    }

    /**
     * Resolves a requested range. Both dates must be given for the request to be
     * honored; otherwise the default trailing window ending today is used.
     *
     * @param startDate   requested start (YYYY-MM-DD), may be null
     * @param endDate     requested end (YYYY-MM-DD), may be null
     * @param clock       clock defining "today"
     * @param defaultDays length of the default window in days
     * @return resolved range
     * @throws IllegalArgumentException if a date is malformed or start is after end
     */
    public static DateRange resolve(String startDate, String endDate, Clock clock, int defaultDays) {
        if (isPresent(startDate) && isPresent(endDate)) {
            return new DateRange(parse(startDate), parse(endDate));
        }
        LocalDate today = LocalDate.now(clock);
        return new DateRange(today.minusDays(defaultDays), today);
    }

    /**
     * Returns a range whose start is no earlier than the given date. Used for
     * definitions that ignore data recorded before they were created.
     * <p>
     * When {@code earliest} falls after the end date the result is
     * {@linkplain #isEmpty() empty}: it starts at {@code earliest} and covers no
     * day at all.
     * </p>
     *
     * @param earliest earliest allowed start date
     * @return this range, or a range starting at {@code earliest}
     */
    public DateRange clampStart(LocalDate earliest) {
        if (earliest == null || !earliest.isAfter(startDate)) {
            return this;
        }
        return new DateRange(earliest, endDate, true);
    }

    /** @return true if the range covers no day */
    public boolean isEmpty() {
        return startDate.isAfter(endDate);
    }

    public LocalDateTime getFrom() {
        return startDate.atStartOfDay();
    }

    public LocalDateTime getTo() {
        return endDate.atTime(END_OF_DAY);
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private static LocalDate parse(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date (expected YYYY-MM-DD): " + value, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        DateRange that = (DateRange) o;
        return startDate.equals(that.startDate) && endDate.equals(that.endDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startDate, endDate);
    }

    @Override
    public String toString() {
        return startDate + ".." + endDate;
    }
}
