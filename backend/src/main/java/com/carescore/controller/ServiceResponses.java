package com.carescore.controller;

import com.carescore.dto.response.ErrorResponse;
import com.carescore.exception.RateLimitException;
import com.carescore.exception.ServiceUnavailableException;
import com.carescore.exception.StaleVersionException;
import com.carescore.exception.ValidationException;
import com.carescore.service.FacadeBoundary;
import com.carescore.service.ServiceError;
import com.carescore.service.ServiceResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.function.Function;

/**
 * Turns facade results into HTTP responses.
 */
final class ServiceResponses {

    static final String USER_HEADER = "X-User-Id";

    private ServiceResponses() {
    }

    static <T, D> ResponseEntity<?> respond(ServiceResult<T> result, Function<T, D> converter) {
        return respond(result, converter, HttpStatus.OK);
    }

    static <T, D> ResponseEntity<?> respond(ServiceResult<T> result, Function<T, D> converter, HttpStatus successStatus) {
        if (result.success()) {
            return ResponseEntity.status(successStatus).body(converter.apply(result.data()));
        }
        return error(result.error());
    }

    static ResponseEntity<ErrorResponse> error(ServiceError error) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(statusFor(error.code()));
        if (error.retryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(error.retryAfterSeconds()));
        }
        return builder.body(new ErrorResponse(error.code(), error.message(), error.field(), error.retryAfterSeconds()));
    }

    static HttpStatus statusFor(String code) {
        if (code == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (code) {
            case ValidationException.CODE -> HttpStatus.BAD_REQUEST;
            case FacadeBoundary.NOT_FOUND -> HttpStatus.NOT_FOUND;
            case StaleVersionException.CODE -> HttpStatus.CONFLICT;
            case RateLimitException.CODE -> HttpStatus.TOO_MANY_REQUESTS;
            case ServiceUnavailableException.CODE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    /**
     * First bean-validation failure of a request body, reported like a facade validation error.
     */
    static ResponseEntity<ErrorResponse> invalid(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        if (fieldError == null) {
            return badRequest("Invalid request");
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse(ValidationException.CODE, fieldError.getDefaultMessage(), fieldError.getField(), null));
    }

    static ResponseEntity<ErrorResponse> badRequest(String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse(ValidationException.CODE, message, null, null));
    }
}
