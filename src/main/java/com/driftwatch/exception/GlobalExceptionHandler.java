package com.driftwatch.exception;

import com.driftwatch.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, null, fieldErrors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, null, null);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiError.FieldError> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(v -> ApiError.FieldError.builder()
                .field(v.getPropertyPath().toString())
                .rejectedValue(v.getInvalidValue())
                .message(v.getMessage())
                .build())
            .toList();
        return build(HttpStatus.BAD_REQUEST, "Constraint Violation",
                     "One or more parameters failed validation", request, null, fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request",
                     "Request body could not be parsed", request, null, null);
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(
            ReportNotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(BatchSizeExceededException.class)
    public ResponseEntity<ApiError> handleBatchTooLarge(
            BatchSizeExceededException ex, HttpServletRequest request) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "Batch Too Large", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({WindowShapeMismatchException.class,
                       UnsupportedTaskTypeException.class,
                       InvalidIngestionException.class})
    public ResponseEntity<ApiError> handleUnprocessable(
            DriftWatchException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Input", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(BaselineConflictException.class)
    public ResponseEntity<ApiError> handleBaselineConflict(
            BaselineConflictException ex, HttpServletRequest request) {
        log.error("Baseline conflict: {}", ex.getMessage(), ex);
        return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiError> handleStaleWindow(
            ObjectOptimisticLockingFailureException ex, HttpServletRequest request) {
        log.warn("Concurrent window update rejected: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Conflict",
                     "Window state was modified concurrently, retry the request",
                     request, "WINDOW_VERSION_CONFLICT", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR", null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String errorCode,
            List<ApiError.FieldError> fieldErrors) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .code(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(request.getHeader("X-Request-ID"))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
