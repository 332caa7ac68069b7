package com.example.oncall.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ScheduleGenerationException.class)
    public ResponseEntity<ErrorResponse> handleScheduleGenerationException(ScheduleGenerationException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                ex.getErrorCode(),
                ex.getMessage(),
                parameterDetails(ex.getParameters()),
                LocalDateTime.now()
        );

        logger.warn("Schedule generation rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "INVALID_PARAMETER",
                "Invalid value for parameter '" + ex.getName() + "'",
                Map.of(ex.getName(), String.valueOf(ex.getValue())),
                LocalDateTime.now()
        );

        logger.warn("Invalid request parameter {}={}", ex.getName(), ex.getValue());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ErrorResponse> handleInputReadFailure(UncheckedIOException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "INPUT_READ_FAILED",
                ex.getMessage(),
                null,
                LocalDateTime.now()
        );

        logger.error("Failed to read schedule inputs", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "INTERNAL_ERROR",
                "Unexpected error",
                null,
                LocalDateTime.now()
        );

        logger.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private static Map<String, String> parameterDetails(Object[] parameters) {
        if (parameters == null || parameters.length == 0) {
            return null;
        }
        return Map.of("parameters", Arrays.stream(parameters)
                .map(String::valueOf)
                .collect(Collectors.joining(",")));
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {}
}
