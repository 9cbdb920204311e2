package com.resumevault.controller;

import com.resumevault.exception.BlobNotFoundException;
import com.resumevault.exception.DatabaseException;
import com.resumevault.exception.IngestionException;
import com.resumevault.exception.PermissionDeniedException;
import com.resumevault.exception.ResumeNotFoundException;
import com.resumevault.exception.StorageException;
import com.resumevault.exception.ValidationException;
import com.resumevault.ingestion.UploadProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final UploadProperties uploadProperties;

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), "VALIDATION_ERROR", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getDefaultMessage())
            .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, message, "VALIDATION_ERROR", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body.", "VALIDATION_ERROR", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        String message = String.format("Parameter '%s' is missing", ex.getParameterName());
        return error(HttpStatus.BAD_REQUEST, message, "VALIDATION_ERROR", null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        return error(HttpStatus.BAD_REQUEST, uploadProperties.tooLargeMessage(), "VALIDATION_ERROR", null);
    }

    @ExceptionHandler(ResumeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResumeNotFound(ResumeNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage(), "RESOURCE_NOT_FOUND", null);
    }

    @ExceptionHandler(BlobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleBlobNotFound(BlobNotFoundException ex) {
        log.warn("Active resume references missing blob {}", ex.getBlobId());
        return error(HttpStatus.NOT_FOUND, "Resume or file not found.", "FILE_NOT_FOUND", null);
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handlePermissionDenied(PermissionDeniedException ex) {
        return error(HttpStatus.FORBIDDEN, ex.getMessage(), "PERMISSION_DENIED", null);
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<ErrorResponse> handleIngestion(IngestionException ex) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.userMessage(), ex.getCategory().name() + "_ERROR",
            ex.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException ex) {
        log.error("Blob store failure", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error retrieving file.", "STORAGE_ERROR", ex.getMessage());
    }

    @ExceptionHandler(DatabaseException.class)
    public ResponseEntity<ErrorResponse> handleDatabase(DatabaseException ex) {
        log.error("Metadata store failure", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "A database error occurred.", "DATABASE_ERROR", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "INTERNAL_ERROR", null);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message, String code, String details) {
        ErrorResponse error = new ErrorResponse(
            true,
            message,
            code,
            details,
            status.value(),
            Instant.now().toEpochMilli()
        );
        return new ResponseEntity<>(error, status);
    }
}
