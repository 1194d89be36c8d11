package com.warehouseledger.exception;

import com.warehouseledger.config.RequestIdFilter;
import com.warehouseledger.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.Violation> violations = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.Violation.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return respond(error(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, "VALIDATION_FAILED")
            .violations(violations));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        return respond(error(HttpStatus.BAD_REQUEST, "Invalid Parameter", ex.getMessage(),
                     request, "VALIDATION_FAILED"));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(
            HandlerMethodValidationException ex, HttpServletRequest request) {
        String msg = ex.getAllValidationResults().stream()
            .flatMap(r -> r.getResolvableErrors().stream()
                .map(e -> r.getMethodParameter().getParameterName() + ": " + e.getDefaultMessage()))
            .collect(Collectors.joining("; "));
        return respond(error(HttpStatus.BAD_REQUEST, "Invalid Parameter", msg, request, "VALIDATION_FAILED"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return respond(error(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, "TYPE_MISMATCH"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return respond(error(HttpStatus.BAD_REQUEST, "Malformed Request",
                     "Request body could not be parsed", request, "MALFORMED_REQUEST"));
    }

    @ExceptionHandler(UnknownLocationException.class)
    public ResponseEntity<ApiError> handleUnknownLocation(
            UnknownLocationException ex, HttpServletRequest request) {
        log.error("Run aborted, reference data mismatch | locationId={} | path={}",
                  ex.getLocationId(), request.getRequestURI());
        return respond(error(HttpStatus.UNPROCESSABLE_ENTITY, "Unknown Location", ex.getMessage(),
                     request, ex.getErrorCode())
            .locationId(ex.getLocationId()));
    }

    @ExceptionHandler(AnalysisInputException.class)
    public ResponseEntity<ApiError> handleInput(
            AnalysisInputException ex, HttpServletRequest request) {
        return respond(error(HttpStatus.BAD_REQUEST, "Invalid Analysis Input", ex.getMessage(),
                     request, ex.getErrorCode()));
    }

    @ExceptionHandler(BatchSizeExceededException.class)
    public ResponseEntity<ApiError> handleBatchTooLarge(
            BatchSizeExceededException ex, HttpServletRequest request) {
        return respond(error(HttpStatus.PAYLOAD_TOO_LARGE, "Batch Too Large", ex.getMessage(),
                     request, ex.getErrorCode()));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiError> handleJobNotFound(
            JobNotFoundException ex, HttpServletRequest request) {
        return respond(error(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                     request, ex.getErrorCode()));
    }

    @ExceptionHandler(LedgerConsistencyException.class)
    public ResponseEntity<ApiError> handleInconsistent(
            LedgerConsistencyException ex, HttpServletRequest request) {
        log.error("Ledger consistency check failed: {}", ex.getMessage());
        return respond(error(HttpStatus.INTERNAL_SERVER_ERROR, "Ledger Inconsistent", ex.getMessage(),
                     request, ex.getErrorCode()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR"));
    }

    private ApiError.ApiErrorBuilder error(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String errorCode) {
        return ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(RequestIdFilter.requestId(request))
            .timestamp(Instant.now());
    }

    private static ResponseEntity<ApiError> respond(ApiError.ApiErrorBuilder builder) {
        ApiError body = builder.build();
        return ResponseEntity.status(body.getStatus()).body(body);
    }
}
