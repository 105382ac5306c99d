package com.demo.coordination.controller;

import com.demo.coordination.exception.LockConflictException;
import com.demo.coordination.exception.NotFoundException;
import com.demo.coordination.exception.StoreFailureException;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @Data
    @Builder
    public static class ErrorResponse {
        private String code;
        private String message;
        private OffsetDateTime timestamp;
        private Map<String, Object> details;
    }

    @ExceptionHandler(LockConflictException.class)
    public ResponseEntity<ErrorResponse> handleLockConflict(LockConflictException e) {
        Map<String, Object> details = new HashMap<>();
        details.put("thread_id", e.getThreadId());
        details.put("holder_id", e.getHolderId());
        details.put("lock_type", e.getKind());
        details.put("retry_after", e.getRetryAfterSeconds());

        ErrorResponse error = ErrorResponse.builder()
            .code("THREAD_LOCKED")
            .message(e.getMessage())
            .timestamp(OffsetDateTime.now())
            .details(details)
            .build();
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
            .body(error);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        ErrorResponse error = ErrorResponse.builder()
            .code("NOT_FOUND")
            .message(e.getMessage())
            .timestamp(OffsetDateTime.now())
            .build();
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        ErrorResponse error = ErrorResponse.builder()
            .code("INVALID_ARGUMENT")
            .message(e.getMessage())
            .timestamp(OffsetDateTime.now())
            .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        ErrorResponse error = ErrorResponse.builder()
            .code("INVALID_BODY")
            .message("Request body is missing or malformed")
            .timestamp(OffsetDateTime.now())
            .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejected(TaskRejectedException e) {
        log.warn("Run rejected: {}", e.getMessage());
        ErrorResponse error = ErrorResponse.builder()
            .code("BUSY")
            .message("Too many responses in progress, try again later")
            .timestamp(OffsetDateTime.now())
            .build();
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(StoreFailureException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(StoreFailureException e) {
        log.error("Store failure", e);
        ErrorResponse error = ErrorResponse.builder()
            .code("STORE_UNAVAILABLE")
            .message(e.getMessage())
            .timestamp(OffsetDateTime.now())
            .details(createDetailsMap(e))
            .build();
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unhandled exception", e);
        ErrorResponse error = ErrorResponse.builder()
            .code("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(OffsetDateTime.now())
            .details(createDetailsMap(e))
            .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private Map<String, Object> createDetailsMap(Exception e) {
        Map<String, Object> details = new HashMap<>();
        details.put("exception", e.getClass().getSimpleName());
        details.put("message", e.getMessage());
        if (e.getCause() != null) {
            details.put("cause", e.getCause().getMessage());
        }
        return details;
    }
}
