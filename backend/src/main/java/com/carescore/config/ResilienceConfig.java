package com.carescore.config;

import com.carescore.resilience.CircuitBreakerRegistry;
import com.carescore.resilience.InMemoryCircuitBreakerRegistry;
import com.carescore.resilience.InMemoryRateLimiter;
import com.carescore.resilience.InMemoryResultCacheFactory;
import com.carescore.resilience.RateLimiter;
import com.carescore.resilience.ResilientExecutor;
import com.carescore.resilience.ResultCacheFactory;
import com.carescore.resilience.RetryPolicy;
import com.carescore.resilience.Sleeper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Resilience layer wiring. The in-memory implementations keep state per process; a shared
 * store can replace any of them by declaring its own bean.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for repository and insight calls. The request thread waits on the result.
     */
    @Bean(name = "carescoreIoExecutor")
    public ThreadPoolTaskExecutor carescoreIoExecutor(CareScoreProperties properties) {
        CareScoreProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("carescore-io-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter rateLimiter(CareScoreProperties properties, Clock clock) {
        CareScoreProperties.RateLimit settings = properties.getRateLimit();
        return new InMemoryRateLimiter(clock, settings.getWindowMs(), settings.getMaxRequests(), settings.getMaxBuckets());
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry circuitBreakerRegistry(CareScoreProperties properties, Clock clock) {
        CareScoreProperties.CircuitBreaker settings = properties.getCircuitBreaker();
        return new InMemoryCircuitBreakerRegistry(clock, settings.getFailureThreshold(), settings.getOpenTimeoutMs());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultCacheFactory resultCacheFactory(CareScoreProperties properties, Clock clock) {
        CareScoreProperties.Cache settings = properties.getCache();
        return new InMemoryResultCacheFactory(clock, settings.getTtlMs(), settings.getMaxEntries());
    }

    @Bean
    public RetryPolicy retryPolicy(CareScoreProperties properties) {
        CareScoreProperties.Retry settings = properties.getRetry();
        return new RetryPolicy(settings.getMaxAttempts(), settings.getBaseDelayMs(), settings.getMaxDelayMs(), settings.getJitterMs());
    }

    @Bean
    public ResilientExecutor resilientExecutor(
            CircuitBreakerRegistry circuitBreakerRegistry,
            RetryPolicy retryPolicy,
            @Qualifier("carescoreIoExecutor") ThreadPoolTaskExecutor ioExecutor,
            CareScoreProperties properties) {
        return new ResilientExecutor(
            circuitBreakerRegistry,
            retryPolicy,
            ioExecutor,
            Sleeper.THREAD,
            properties.getTimeouts().getRepositoryMs(),
            properties.getTimeouts().getInsightsMs());
    }
}
