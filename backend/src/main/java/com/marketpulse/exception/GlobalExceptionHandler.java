package com.marketpulse.exception;

import com.marketpulse.dto.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(DatasetNotFoundException.class)
    public ResponseEntity<ApiError> handleDatasetNotFound(DatasetNotFoundException ex) {
        log.warn("Dataset not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(NoDatasetLoadedException.class)
    public ResponseEntity<ApiError> handleNoDataset(NoDatasetLoadedException ex) {
        log.warn("No dataset loaded: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(UnsupportedDatasetException.class)
    public ResponseEntity<ApiError> handleUnsupported(UnsupportedDatasetException ex) {
        log.warn("Unsupported dataset: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(DatasetLoadException.class)
    public ResponseEntity<ApiError> handleLoadFailure(DatasetLoadException ex) {
        log.warn("Dataset load failed: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        String errorMessage = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((error1, error2) -> error1 + ", " + error2)
                .orElse("Validation failed");

        log.warn("Validation error: {}", errorMessage);
        return ResponseEntity.badRequest().body(new ApiError("ERR-VAL-001", errorMessage));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request payload: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ApiError("ERR-REQ-001", "Malformed request payload"));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ApiError> handleMissingParameter(Exception ex) {
        log.warn("Missing request parameter: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ApiError("ERR-REQ-002", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleArgumentTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Type mismatch for parameter {}: {}", ex.getName(), ex.getMessage());
        return ResponseEntity.badRequest()
                .body(new ApiError("ERR-REQ-003", "Invalid value for parameter: " + ex.getName()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        log.warn("Upload rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(new ApiError("ERR-REQ-004", "Uploaded file is too large"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ApiError("ERR-VAL-002", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("ERR-SYS-001", "An unexpected error occurred: " + ex.getMessage()));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, MarketPulseException ex) {
        return ResponseEntity.status(status).body(new ApiError(ex.getErrorCode(), ex.getMessage()));
    }
}
