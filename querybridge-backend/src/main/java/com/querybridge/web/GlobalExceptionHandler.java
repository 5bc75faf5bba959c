package com.querybridge.web;

import com.querybridge.api.ErrorResponse;
import com.querybridge.error.QueryExecutionException;
import com.querybridge.schema.NoSuchTableException;
import com.querybridge.service.DatabaseNotFoundException;
import com.querybridge.service.QueryNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String TRACE_ID = "trace_id";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        ErrorResponse error = ErrorResponse.builder()
                .code("VALIDATION_FAILED")
                .message("Input validation failed")
                .details(details)
                .traceId(MDC.get(TRACE_ID))
                .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorResponse> handleQueryExecutionException(QueryExecutionException ex) {
        log.error("Query execution failed: kind={}", ex.getKind(), ex);
        HttpStatus status;
        switch (ex.getKind()) {
            case CONNECTION_ERROR:
            case OPERATIONAL_ERROR:
                status = HttpStatus.BAD_GATEWAY;
                break;
            case PROGRAMMING_ERROR:
                status = HttpStatus.BAD_REQUEST;
                break;
            default:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        ErrorResponse error = ErrorResponse.builder()
                .code(ex.getKind().name())
                .message(ex.getMessage())
                .details(ex.getCause() != null ? ex.getCause().getClass().getName() : null)
                .retryable(ex.getKind().isRetryable())
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler({QueryNotFoundException.class, DatabaseNotFoundException.class, NoSuchTableException.class})
    public ResponseEntity<ErrorResponse> handleMissingEntity(RuntimeException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("NOT_FOUND")
                .message(ex.getMessage())
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(Exception ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("INVALID_ARGUMENT")
                .message(ex.getMessage())
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("NOT_FOUND")
                .message("Not found")
                .details(ex.getMessage())
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);

        ErrorResponse error = ErrorResponse.builder()
                .code("INTERNAL_SERVER_ERROR")
                .message("An unexpected error occurred")
                .details(ex.getMessage())
                .traceId(MDC.get(TRACE_ID))
                .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
