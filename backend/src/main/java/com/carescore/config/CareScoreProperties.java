package com.carescore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime tuning bound from {@code carescore.*} in application.yml.
 * Scoring bands live separately in {@link com.carescore.service.scoring.ScoringBands}.
 */
@Data
@ConfigurationProperties(prefix = "carescore")
public class CareScoreProperties {

    private RateLimit rateLimit = new RateLimit();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Cache cache = new Cache();
    private Retry retry = new Retry();
    private Timeouts timeouts = new Timeouts();
    private Trend trend = new Trend();
    private Prediction prediction = new Prediction();
    private Progress progress = new Progress();
    private Events events = new Events();
    private Executor executor = new Executor();

    @Data
    public static class RateLimit {
        private long windowMs = 60_000;
        private int maxRequests = 100;
        /** Bucket map size above which idle buckets are purged. */
        private int maxBuckets = 10_000;
    }

    @Data
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private long openTimeoutMs = 60_000;
    }

    @Data
    public static class Cache {
        private long ttlMs = 300_000;
        private int maxEntries = 1_000;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 1_000;
        private long maxDelayMs = 30_000;
        private long jitterMs = 1_000;
    }

    @Data
    public static class Timeouts {
        private long repositoryMs = 5_000;
        private long insightsMs = 10_000;
    }

    @Data
    public static class Trend {
        private double significanceThreshold = 0.5;
        private double highConfidenceThreshold = 0.8;
        private double epsilon = 1e-9;
        private int projectionHorizon = 7;
        /** Minimum absolute change between consecutive points to report it. */
        private double changeThreshold = 10.0;
    }

    @Data
    public static class Prediction {
        private double improvingDamping = 0.5;
        private double decliningDamping = 0.3;
    }

    @Data
    public static class Progress {
        private int defaultTimeBoundDays = 30;
        private int stallWindowDays = 7;
        private double onTrackRatio = 0.8;
    }

    @Data
    public static class Events {
        /** "local" (Spring application events) or "kafka". */
        private String transport = "local";
        private String topicPrefix = "carescore.";
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 200;
    }
}
