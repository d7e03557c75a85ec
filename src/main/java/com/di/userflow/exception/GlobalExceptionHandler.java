package com.di.userflow.exception;

import com.di.userflow.error.ErrorCategory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST layer to a structured {@link ErrorResponse}.
 *
 * <p>Pipeline failures never reach this handler: a failed run is a {@code RunOutcome}, not an
 * exception. What arrives here is a rejected request (busy, bad input) or a bug.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(PipelineBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(PipelineBusyException e, WebRequest request) {
        ErrorResponse body = buildErrorResponse(ErrorCategory.APPLICATION_ERROR, e, HttpStatus.CONFLICT, request);
        body.addDetail("activeRunId", e.getActiveRunId());
        log.warn("[API] {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    /**
     * Bad request input (unparseable timestamp, invalid run id).
     */
    @ExceptionHandler({IllegalArgumentException.class,
                       MethodArgumentTypeMismatchException.class,
                       MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e, WebRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("[API] rejected request: {} [{}]", e.getMessage(), category.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildErrorResponse(category, e, HttpStatus.BAD_REQUEST, request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, WebRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.error("[API] unhandled exception: {} [{}]", e.getClass().getSimpleName(), category.getName(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR, request));
    }

    private static ErrorResponse buildErrorResponse(ErrorCategory category, Throwable e,
                                                    HttpStatus status, WebRequest request) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(request instanceof ServletWebRequest
                ? ((ServletWebRequest) request).getRequest().getRequestURI()
                : null);
        response.addDetail("exceptionType", e.getClass().getName());
        return response;
    }

    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int    status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            details.put(key, value);
        }
    }
}
