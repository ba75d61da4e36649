package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Declared sampling frequency of a series. Never inferred from the data.
 * <p>
 * Steps are computed from an anchor ({@code anchor + k steps}) rather than by
 * repeated increments, so month-end anchors stay on month ends.
 */
public enum Frequency {
    MINUTELY(ChronoUnit.MINUTES, 1, 60),
    HOURLY(ChronoUnit.HOURS, 1, 24),
    DAILY(ChronoUnit.DAYS, 1, 7),
    WEEKLY(ChronoUnit.WEEKS, 1, 52),
    MONTHLY(ChronoUnit.MONTHS, 1, 12),
    QUARTERLY(ChronoUnit.MONTHS, 3, 4),
    YEARLY(ChronoUnit.YEARS, 1, 0);

    private final ChronoUnit unit;
    private final long amount;
    private final int seasonLength;

    Frequency(ChronoUnit unit, long amount, int seasonLength) {
        this.unit = unit;
        this.amount = amount;
        this.seasonLength = seasonLength;
    }

    /** Timestamp {@code steps} periods after {@code anchor}, computed in UTC. */
    public Instant plus(Instant anchor, long steps) {
        return anchor.atZone(ZoneOffset.UTC).plus(amount * steps, unit).toInstant();
    }

    /** Number of periods in one seasonal cycle, 0 when the frequency has none. */
    public int seasonLength() {
        return seasonLength;
    }

    @JsonCreator
    public static Frequency fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("frequency must be declared");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown frequency '" + value + "'");
        }
    }
}
