package com.e2eq.insights.model.usage;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Quota accounting period. Period boundaries are computed in UTC; a new period starts a
 * fresh consumption counter.
 */
@RegisterForReflection
public enum QuotaPeriod {

    /** Calendar day in UTC. */
    DAILY(ChronoUnit.DAYS, "daily"),

    /** Calendar month in UTC, starting on the 1st. */
    MONTHLY(ChronoUnit.MONTHS, "monthly");

    private final ChronoUnit unit;
    private final String label;

    QuotaPeriod(ChronoUnit unit, String label) {
        this.unit = unit;
        this.label = label;
    }

    public ChronoUnit getUnit() {
        return unit;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Start of the period containing the given instant.
     */
    public Instant periodStart(Instant at) {
        ZonedDateTime day = at.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS);
        if (this == MONTHLY) {
            day = day.withDayOfMonth(1);
        }
        return day.toInstant();
    }

    /**
     * Exclusive end of the period containing the given instant, which is also when it resets.
     */
    public Instant periodEnd(Instant at) {
        return periodStart(at).atZone(ZoneOffset.UTC).plus(1, unit).toInstant();
    }
}
