package com.carescore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * Bucket size used when turning timestamped observations into an ordered series.
 * Buckets are computed in UTC.
 */
public enum TrendPeriod {
    DAY("day"),
    WEEK("week"),
    MONTH("month");

    private final String value;

    TrendPeriod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * First day of the bucket containing the given instant. Weeks start on Monday.
     */
    public LocalDate bucketStart(Instant instant) {
        LocalDate date = instant.atZone(ZoneOffset.UTC).toLocalDate();
        return switch (this) {
            case DAY -> date;
            case WEEK -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> date.withDayOfMonth(1);
        };
    }

    public static TrendPeriod fromValue(String value) {
        if (value == null) {
            return DAY;
        }
        for (TrendPeriod period : values()) {
            if (period.value.equalsIgnoreCase(value) || period.name().equalsIgnoreCase(value)) {
                return period;
            }
        }
        throw new IllegalArgumentException("Unknown TrendPeriod: " + value);
    }
}
