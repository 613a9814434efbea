package com.example.changefeed.controller;

import com.example.changefeed.exception.ForbiddenException;
import com.example.changefeed.exception.NotFoundException;
import com.example.changefeed.exception.QueueUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException e) {
        return Map.of(
                "error", "NOT_FOUND",
                "message", e.getMessage()
        );
    }

    @ExceptionHandler(ForbiddenException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleForbidden(ForbiddenException e) {
        return Map.of(
                "error", "FORBIDDEN",
                "message", e.getMessage()
        );
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            MissingRequestHeaderException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception e) {
        return Map.of(
                "error", "BAD_REQUEST",
                "message", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler(QueueUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleQueueUnavailable(QueueUnavailableException e) {
        log.error("❌ Change event could not be enqueued: {}", e.getMessage());
        return Map.of(
                "error", "QUEUE_UNAVAILABLE",
                "message", e.getMessage()
        );
    }
}
