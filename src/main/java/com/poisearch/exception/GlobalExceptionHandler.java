package com.poisearch.exception;

import com.poisearch.model.result.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler mapping application errors to {@link ApiResponse} bodies.
 * <p>
 * Every failure reaching a client names its kind through a short code; nothing
 * partial is ever returned next to an error.
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public static final String INTERNAL = "internal";
    public static final String REJECTED = "rejected";

    /**
     * Handles {@link PoiValidationException} with a HTTP 400 Bad Request.
     */
    @ExceptionHandler(PoiValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(PoiValidationException e) {
        log.debug("Rejected request [{}]: {}", e.getCode(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getCode(), e.getMessage());
    }

    /**
     * Handles {@link PoiNotFoundException} with a HTTP 404 Not Found.
     */
    @ExceptionHandler(PoiNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(PoiNotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e.getCode(), e.getMessage());
    }

    /**
     * Handles {@link IndexBuildException}: HTTP 503 when the caller may retry, HTTP 500 otherwise.
     */
    @ExceptionHandler(IndexBuildException.class)
    public ResponseEntity<ApiResponse<Void>> handleIndexBuild(IndexBuildException e) {
        HttpStatus status = e.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
        return respond(status, e.getCode(), e.getMessage());
    }

    /**
     * Handles unreadable JSON bodies, including unknown category codes, with a HTTP 400.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        Throwable cause = e.getMostSpecificCause();
        String detail = cause != null ? cause.getMessage() : e.getMessage();
        return respond(HttpStatus.BAD_REQUEST, PoiValidationException.BAD_PAYLOAD, "Malformed payload: " + detail);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return respond(HttpStatus.BAD_REQUEST, PoiValidationException.BAD_PAYLOAD,
                "Invalid value for '" + e.getName() + "': " + e.getValue());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        // Framework errors (unknown path, wrong method, ...) carry their own status
        if (e instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
            log.debug("Request failed with {}: {}", status, e.getMessage());
            return respond(status, status.is4xxClientError() ? REJECTED : INTERNAL, e.getMessage());
        }
        log.error("Unhandled error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL, e.getMessage());
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatusCode status, String code, String message) {
        return new ResponseEntity<>(ApiResponse.error(code, message), status);
    }
}
