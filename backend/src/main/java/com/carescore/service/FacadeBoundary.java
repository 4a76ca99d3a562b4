package com.carescore.service;

import com.carescore.exception.ClinicalServiceException;
import com.carescore.exception.ErrorSeverity;
import com.carescore.exception.RateLimitException;
import com.carescore.exception.ServiceUnavailableException;
import com.carescore.exception.StaleVersionException;
import com.carescore.exception.ValidationException;
import com.carescore.resilience.RateLimiter;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Common entry point of every facade operation: assigns a request id, validates input,
 * applies the caller's rate limit, runs the action and turns any exception into a
 * {@link ServiceResult} failure. Nothing thrown inside escapes to the caller.
 */
@Slf4j
@Component
public class FacadeBoundary {

    public static final String REQUEST_ID = "requestId";
    public static final String NOT_FOUND = "NOT_FOUND";
    static final String INTERNAL_MESSAGE = "An internal error occurred";

    private final RateLimiter rateLimiter;
    private final Clock clock;

    public FacadeBoundary(RateLimiter rateLimiter, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    public <T> ServiceResult<T> execute(String operation, String callerId, Runnable validator, Supplier<T> action) {
        String caller = callerId == null || callerId.isBlank() ? "anonymous" : callerId;
        String requestId = newRequestId();
        MDC.put(REQUEST_ID, requestId);
        try {
            if (validator != null) {
                validator.run();
            }
            rateLimiter.checkLimit(caller);
            T data = action.get();
            log.debug("{} completed for caller {}", operation, caller);
            return ServiceResult.ok(data);
        } catch (ValidationException e) {
            log.info("{} rejected for caller {}: {}", operation, caller, e.getMessage());
            return ServiceResult.failure(new ServiceError(e.getCode(), e.getMessage(), e.getField(), null));
        } catch (RateLimitException e) {
            return ServiceResult.failure(new ServiceError(e.getCode(), e.getMessage(), null, e.getRetryAfterSeconds()));
        } catch (StaleVersionException e) {
            log.info("{} rejected for caller {}: {}", operation, caller, e.getMessage());
            return ServiceResult.failure(ServiceError.of(e.getCode(), e.getMessage()));
        } catch (ServiceUnavailableException e) {
            log.warn("{} failed for caller {}: {}", operation, caller, e.getMessage());
            return ServiceResult.failure(ServiceError.of(e.getCode(), e.getMessage()));
        } catch (EntityNotFoundException e) {
            return ServiceResult.failure(ServiceError.of(NOT_FOUND, e.getMessage()));
        } catch (ClinicalServiceException e) {
            if (e.getSeverity() == ErrorSeverity.CRITICAL) {
                log.error("{} failed for caller {} [{}] with {}", operation, caller, requestId, e.getCode(), e);
            } else {
                log.warn("{} failed for caller {} with {}: {}", operation, caller, e.getCode(), e.getMessage());
            }
            return ServiceResult.failure(ServiceError.of(e.getCode(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {} for caller {} [{}]", operation, caller, requestId, e);
            return ServiceResult.failure(ServiceError.of(ClinicalServiceException.INTERNAL_ERROR, INTERNAL_MESSAGE));
        } finally {
            MDC.remove(REQUEST_ID);
        }
    }

    private String newRequestId() {
        return "req-" + clock.millis() + "-" + String.format("%08x", ThreadLocalRandom.current().nextInt());
    }
}
