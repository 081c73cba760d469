package com.wpanther.multisigcoordinator.exception;

import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.wpanther.multisigcoordinator.dto.ErrorResponse;

import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.PessimisticLockException;
import jakarta.persistence.QueryTimeoutException;
import lombok.extern.slf4j.Slf4j;

@ControllerAdvice
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GlobalExceptionHandler {

    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    public static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";
    public static final String STORAGE_UNAVAILABLE = "STORAGE_UNAVAILABLE";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    // Causes that mean the store is contended or unreachable, not that the request is wrong.
    // A failed commit or rollback lands here too: on a lock timeout it may replace the original error.
    private static final List<Class<? extends Throwable>> TRANSIENT_STORAGE_CAUSES = List.of(
            TransientDataAccessException.class,
            DataAccessResourceFailureException.class,
            CannotCreateTransactionException.class,
            TransactionTimedOutException.class,
            PessimisticLockException.class,
            LockTimeoutException.class,
            QueryTimeoutException.class,
            org.hibernate.PessimisticLockException.class,
            org.hibernate.exception.LockAcquisitionException.class,
            org.hibernate.TransactionException.class,
            SQLTransientException.class,
            SQLRecoverableException.class);

    /**
     * Renders coordinator failures with the status declared on the exception type
     */
    @ExceptionHandler(MultisigException.class)
    public ResponseEntity<ErrorResponse> handleMultisigException(MultisigException ex, WebRequest request) {
        HttpStatus status = resolveStatus(ex);
        log.warn("Request rejected: code={}, message={}", ex.getErrorCode(), ex.getMessage());
        return createErrorResponse(ex.getErrorCode(), ex.getMessage(), status, request, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex,
            WebRequest request) {
        log.warn("Validation error: {}", ex.getMessage());

        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        return createErrorResponse(VALIDATION_FAILED, "Validation failed", HttpStatus.BAD_REQUEST, request, errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, WebRequest request) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return createErrorResponse(MALFORMED_REQUEST, "Request body is missing or malformed",
                HttpStatus.BAD_REQUEST, request, null);
    }

    @ExceptionHandler({
            TransientDataAccessException.class,
            DataAccessResourceFailureException.class,
            CannotCreateTransactionException.class,
            TransactionTimedOutException.class
    })
    public ResponseEntity<ErrorResponse> handleStorageUnavailable(Exception ex, WebRequest request) {
        log.error("Storage unavailable", ex);
        return createErrorResponse(STORAGE_UNAVAILABLE, "Storage is temporarily unavailable, retry later",
                HttpStatus.SERVICE_UNAVAILABLE, request, null);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex, WebRequest request) {
        return createErrorResponse(NOT_FOUND, ex.getMessage(), HttpStatus.NOT_FOUND, request, null);
    }

    /**
     * Last resort. Storage failures that arrive wrapped in another exception,
     * such as a lock timeout surfacing as a failed rollback, are still reported as 503.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception ex, WebRequest request) {
        if (isTransientStorageFailure(ex)) {
            return handleStorageUnavailable(ex, request);
        }
        log.error("Unexpected error", ex);
        return createErrorResponse(INTERNAL_ERROR, "An unexpected error occurred: " + ex.getMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR, request, null);
    }

    static boolean isTransientStorageFailure(Throwable ex) {
        Throwable current = ex;
        int depth = 0;
        while (current != null && depth++ < 32) {
            for (Class<? extends Throwable> type : TRANSIENT_STORAGE_CAUSES) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private HttpStatus resolveStatus(MultisigException ex) {
        ResponseStatus annotation = AnnotatedElementUtils.findMergedAnnotation(ex.getClass(), ResponseStatus.class);
        return annotation != null ? annotation.code() : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ResponseEntity<ErrorResponse> createErrorResponse(String error, String message, HttpStatus status,
            WebRequest request, Map<String, String> errors) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .error(error)
                .message(message)
                .status(status.value())
                .path(requestPath(request))
                .timestamp(Instant.now().toEpochMilli())
                .errors(errors)
                .build();
        return new ResponseEntity<>(errorResponse, status);
    }

    private String requestPath(WebRequest request) {
        if (request instanceof ServletWebRequest servletWebRequest) {
            return servletWebRequest.getRequest().getRequestURI();
        }
        return null;
    }
}
