package com.al.shopsync.exception;

import com.al.shopsync.dto.ErrorResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.List;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(JsonProcessingException.class)
    public ResponseEntity<ErrorResponse> handleJsonError(JsonProcessingException e, HttpServletRequest request) {
        log.error("JSON Processing Error: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "JSON Processing Error", e.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e,
            HttpServletRequest request) {
        log.warn("Unreadable Request Body: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Input Error", "Malformed request body", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e,
            HttpServletRequest request) {
        String details = e.getName() + ": invalid value '" + e.getValue() + "'";
        log.warn("Invalid Input: {}", details);
        return buildResponse(HttpStatus.BAD_REQUEST, "Input Error", details, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException e, HttpServletRequest request) {
        log.warn("Invalid Input: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Input Error", e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException e,
            HttpServletRequest request) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        log.warn("Validation Error: {}", details);
        return buildResponse(HttpStatus.BAD_REQUEST, "Validation Error", details, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException e,
            HttpServletRequest request) {
        log.warn("Validation Error: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Validation Error", e.getMessage(), request);
    }

    @ExceptionHandler(MappingValidationException.class)
    public ResponseEntity<ErrorResponse> handleMappingValidation(MappingValidationException e,
            HttpServletRequest request) {
        log.warn("Mapping Validation Error: {} {}", e.getMessage(), e.getErrors());
        return buildResponse(HttpStatus.BAD_REQUEST, "Mapping Validation Error", e.getMessage(), request,
                e.getErrors());
    }

    @ExceptionHandler(UnsupportedSyncModeException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedMode(UnsupportedSyncModeException e,
            HttpServletRequest request) {
        log.warn("Unsupported Sync Mode: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Unsupported Sync Mode", e.getMessage(), request);
    }

    @ExceptionHandler(TransformationException.class)
    public ResponseEntity<ErrorResponse> handleTransformation(TransformationException e,
            HttpServletRequest request) {
        log.warn("Transformation Error: {}", e.getMessage());
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, "Transformation Error", e.getMessage(), request);
    }

    @ExceptionHandler({ NotFoundException.class, SyncJobNotFoundException.class })
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e, HttpServletRequest request) {
        log.warn("Not Found: {}", e.getMessage());
        return buildResponse(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), request);
    }

    @ExceptionHandler(VersionMismatchException.class)
    public ResponseEntity<ErrorResponse> handleVersionMismatch(VersionMismatchException e,
            HttpServletRequest request) {
        log.warn("Version Mismatch: {}", e.getMessage());
        return buildResponse(HttpStatus.CONFLICT, "Version Mismatch", e.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException e, HttpServletRequest request) {
        log.warn("Conflict: {}", e.getMessage());
        return buildResponse(HttpStatus.CONFLICT, "Conflict", e.getMessage(), request);
    }

    @ExceptionHandler(SyncJobRejectedException.class)
    public ResponseEntity<ErrorResponse> handleJobRejected(SyncJobRejectedException e, HttpServletRequest request) {
        log.warn("Sync Job Rejected: {}", e.getMessage());
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", e.getMessage(), request);
    }

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<ErrorResponse> handleTransport(TransportException e, HttpServletRequest request) {
        log.error("{} Unavailable: {}", e.getSystem(), e.getMessage());
        return buildResponse(HttpStatus.BAD_GATEWAY, "Upstream Error", e.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralError(Exception e, HttpServletRequest request) {
        log.error("Internal Server Error: ", e);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred",
                request);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
            HttpServletRequest request) {
        return buildResponse(status, error, message, request, null);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
            HttpServletRequest request, List<String> errors) {
        ErrorResponse response = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                error,
                message,
                request.getRequestURI(),
                errors);
        return new ResponseEntity<>(response, status);
    }
}
