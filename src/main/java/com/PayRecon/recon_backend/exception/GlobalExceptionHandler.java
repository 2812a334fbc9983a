package com.PayRecon.recon_backend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Every domain exception carries its own status and code. Lock contention and
     * missing source data are expected during normal operation and logged at info.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiException(ApiException ex, WebRequest request) {
        if (ex instanceof PeriodLockedException || ex instanceof DataUnavailableException) {
            log.info("{}: {}", ex.getErrorCode(), ex.getMessage());
        } else if (ex.getStatus().is5xxServerError()) {
            log.error("API Exception: {}", ex.getMessage(), ex);
        } else {
            log.warn("API Exception: {}", ex.getMessage());
        }

        Map<String, String> errors = ex instanceof ValidationException
                ? fieldErrors(((ValidationException) ex).getFieldErrors())
                : null;
        return respond(ex.getStatus(), ex.getMessage(), ex.getErrorCode(), errors, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex, WebRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", "VALIDATION_ERROR",
                fieldErrors(ex.getBindingResult().getFieldErrors()), request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception ex, WebRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Malformed request: " + ex.getMessage(), "MALFORMED_REQUEST",
                null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "INTERNAL_SERVER_ERROR",
                null, request);
    }

    private static Map<String, String> fieldErrors(List<FieldError> fieldErrors) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (fieldErrors != null) {
            // First message wins when a field fails several constraints
            fieldErrors.forEach(fieldError -> errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage()));
        }
        return errors;
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, String errorCode,
                                                         Map<String, String> errors, WebRequest request) {
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .errorCode(errorCode)
                .errors(errors)
                .path(request.getDescription(false))
                .build();
        return new ResponseEntity<>(error, status);
    }

    @lombok.Data
    @lombok.Builder
    @lombok.NoArgsConstructor
    @lombok.AllArgsConstructor
    public static class ErrorResponse {
        private LocalDateTime timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCode;
        private Map<String, String> errors;
        private String path;
    }
}
