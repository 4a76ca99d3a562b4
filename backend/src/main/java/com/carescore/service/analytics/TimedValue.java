package com.carescore.service.analytics;

import java.time.Instant;

public record TimedValue(Instant timestamp, double value) {}
