package com.carescore.service.analytics;

import java.time.Instant;

/**
 * One point of an ordered series. {@code periodStart} is informational and may be null.
 */
public record SeriesPoint(int index, double value, Instant periodStart) {

    public static SeriesPoint of(int index, double value) {
        return new SeriesPoint(index, value, null);
    }
}
