package com.example.chronotrace.web;

import com.example.chronotrace.anomaly.AnomalyNotFoundException;
import com.example.chronotrace.anomaly.IllegalStatusTransitionException;
import com.example.chronotrace.error.ChronoTraceException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;

/**
 * Maps failures to {@code {code, kind, subjectId, message}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ChronoTraceException.class)
    public ResponseEntity<ErrorResponse> handleCore(ChronoTraceException e) {
        HttpStatus status;
        switch (e.getKind()) {
            case TRANSIENT_EXTERNAL:
                status = HttpStatus.SERVICE_UNAVAILABLE;
                break;
            case PERMANENT_EXTERNAL:
                status = HttpStatus.UNPROCESSABLE_ENTITY;
                break;
            case CACHE_INCONSISTENCY:
                status = HttpStatus.CONFLICT;
                break;
            case INDEX_CAPACITY:
                status = HttpStatus.INSUFFICIENT_STORAGE;
                break;
            case FILTER_VALIDATION:
                status = HttpStatus.BAD_REQUEST;
                break;
            case SEARCH_TIMEOUT:
                status = HttpStatus.GATEWAY_TIMEOUT;
                break;
            default:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (status.is5xxServerError()) {
            log.error("{} failure for {}: {}", e.getKind(), e.getSubjectId(), e.getMessage());
        } else {
            log.warn("{} failure for {}: {}", e.getKind(), e.getSubjectId(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getKind().name(), e.getKind().name(), e.getSubjectId(), e.getMessage()));
    }

    @ExceptionHandler(AnomalyNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(AnomalyNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NOT_FOUND", null, e.getAnomalyId(), e.getMessage()));
    }

    @ExceptionHandler(IllegalStatusTransitionException.class)
    public ResponseEntity<ErrorResponse> handleTransition(IllegalStatusTransitionException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("ILLEGAL_TRANSITION", null, e.getAnomalyId(), e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class, UncheckedIOException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", null, null, e.getMessage()));
    }

    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(CancellationException e) {
        log.warn("Request cancelled: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("CANCELLED", null, null, e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", null, null, "internal server error"));
    }

    @Data
    @AllArgsConstructor
    public static class ErrorResponse {
        private String code;
        private String kind;
        private String subjectId;
        private String message;
    }
}
