package com.carescore.resilience;

import com.carescore.exception.ClinicalServiceException;
import com.carescore.exception.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.NonTransientDataAccessException;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls to external collaborators behind a circuit breaker and a timeout.
 * <p>
 * Repository calls are retried with backoff; a timed-out attempt counts as a failure and is
 * retried too. Insight calls are never retried and never fail the caller.
 */
@Slf4j
public class ResilientExecutor {

    private final CircuitBreakerRegistry breakers;
    private final RetryPolicy retryPolicy;
    private final Executor ioExecutor;
    private final Sleeper sleeper;
    private final long repositoryTimeoutMs;
    private final long insightsTimeoutMs;

    public ResilientExecutor(
            CircuitBreakerRegistry breakers,
            RetryPolicy retryPolicy,
            Executor ioExecutor,
            Sleeper sleeper,
            long repositoryTimeoutMs,
            long insightsTimeoutMs) {
        this.breakers = breakers;
        this.retryPolicy = retryPolicy;
        this.ioExecutor = ioExecutor;
        this.sleeper = sleeper;
        this.repositoryTimeoutMs = repositoryTimeoutMs;
        this.insightsTimeoutMs = insightsTimeoutMs;
    }

    // ========================================================================
    // Repository
    // ========================================================================

    /**
     * Calls the repository with breaker, timeout and bounded retries.
     *
     * @throws ServiceUnavailableException when the circuit is open, the failure is not transient,
     *         or every attempt failed
     */
    public <T> T callRepository(String operation, Supplier<T> call) {
        CircuitBreaker breaker = breakers.forDependency(CircuitBreakerRegistry.REPOSITORY);
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                return breaker.execute(() -> withTimeout(CircuitBreakerRegistry.REPOSITORY, call, repositoryTimeoutMs));
            } catch (ServiceUnavailableException e) {
                if (!ServiceUnavailableException.TIMEOUT.equals(e.getReason())) {
                    throw e;
                }
                lastFailure = e;
            } catch (ClinicalServiceException e) {
                throw e;
            } catch (NonTransientDataAccessException e) {
                log.error("Repository operation {} failed permanently", operation, e);
                throw new ServiceUnavailableException(
                    CircuitBreakerRegistry.REPOSITORY, ServiceUnavailableException.NON_TRANSIENT, e);
            } catch (RuntimeException e) {
                lastFailure = e;
            }

            if (attempt < retryPolicy.maxAttempts()) {
                long delay = retryPolicy.delayAfterAttempt(attempt);
                log.warn("Repository operation {} failed (attempt {}/{}), retrying in {} ms: {}",
                    operation, attempt, retryPolicy.maxAttempts(), delay, lastFailure.getMessage());
                pause(delay);
            }
        }

        log.error("Repository operation {} failed after {} attempts", operation, retryPolicy.maxAttempts(), lastFailure);
        throw new ServiceUnavailableException(
            CircuitBreakerRegistry.REPOSITORY, ServiceUnavailableException.RETRIES_EXHAUSTED, lastFailure);
    }

    /**
     * Convenience for repository calls with no result.
     */
    public void runRepository(String operation, Runnable call) {
        callRepository(operation, () -> {
            call.run();
            return null;
        });
    }

    // ========================================================================
    // AI insights
    // ========================================================================

    /**
     * Calls the insight generator once. Any failure is logged and yields an empty result.
     */
    public <T> Optional<T> callInsights(Supplier<T> call) {
        CircuitBreaker breaker = breakers.forDependency(CircuitBreakerRegistry.AI);
        try {
            return Optional.ofNullable(
                breaker.execute(() -> withTimeout(CircuitBreakerRegistry.AI, call, insightsTimeoutMs)));
        } catch (RuntimeException e) {
            log.warn("Insight generation skipped: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private <T> T withTimeout(String dependency, Supplier<T> call, long timeoutMs) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, ioExecutor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ServiceUnavailableException(dependency, ServiceUnavailableException.TIMEOUT, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(dependency + " call failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ServiceUnavailableException(dependency, "interrupted", e);
        }
    }

    private void pause(long delayMs) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException(CircuitBreakerRegistry.REPOSITORY, "interrupted", e);
        }
    }
}
