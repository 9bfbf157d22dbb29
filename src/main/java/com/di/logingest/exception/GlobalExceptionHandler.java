package com.di.logingest.exception;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for the REST endpoints.
 *
 * <p>Every failure is categorized with {@link ErrorCategory}, logged once and returned
 * as an {@link ErrorResponse}:
 * <ul>
 *   <li>{@link LoadFailedException} → 502, one detail entry per failing source or destination</li>
 *   <li>configuration and validation errors → 400</li>
 *   <li>other pipeline errors → 502</li>
 *   <li>anything else → 500</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LoadFailedException.class)
    public ResponseEntity<ErrorResponse> handleLoadFailed(LoadFailedException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("LOAD_FAILED", category, e);

        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.BAD_GATEWAY);
        List<Map<String, String>> failures = new ArrayList<>();
        for (LoadFailedException.Failure f : e.getFailures()) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("target", f.target());
            entry.put("category", ErrorCategory.categorize(f.cause()).name());
            entry.put("message", f.message());
            failures.add(entry);
        }
        body.addDetail("failures", failures);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler({UnsupportedSourceException.class, InvalidPartitionException.class,
                       InvalidLogException.class, IllegalArgumentException.class,
                       MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("BAD_REQUEST", category, e);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildErrorResponse(category, e, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(LogIngestException.class)
    public ResponseEntity<ErrorResponse> handlePipelineException(LogIngestException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("PIPELINE_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(buildErrorResponse(category, e, HttpStatus.BAD_GATEWAY));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        log.error("[HTTP] {} {} [{}] requestId={}: {}",
                eventType,
                exception.getClass().getSimpleName(),
                category.getName(),
                MDC.get("requestId"),
                exception.getMessage(),
                exception);
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryDescription(category.getDescription());
        response.setRequestId(MDC.get("requestId"));
        response.setPath(requestPath());

        response.addDetail("exceptionType", exception.getClass().getName());
        Throwable rootCause = rootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return rootCause(cause);
    }

    private static String requestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryDescription;
        private String requestId;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
