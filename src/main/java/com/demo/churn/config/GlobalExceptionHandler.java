package com.demo.churn.config;

import com.demo.churn.service.error.RefreshFailedException;
import com.demo.churn.service.error.SchemaException;
import com.demo.churn.service.error.TrainingException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({MethodArgumentNotValidException.class, IllegalArgumentException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception ex, HttpServletRequest req) {
        return body(400, "Bad Request", ex.getMessage(), req);
    }

    @ExceptionHandler({SchemaException.class, TrainingException.class})
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleScoring(RuntimeException ex, HttpServletRequest req) {
        log.error("Scoring run aborted: {}", ex.getMessage());
        return body(422, "Scoring Failed", ex.getMessage(), req);
    }

    @ExceptionHandler(RefreshFailedException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleRefresh(RefreshFailedException ex, HttpServletRequest req) {
        return body(502, "Refresh Failed", ex.getMessage(), req);
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleSql(DataAccessException ex, HttpServletRequest req) {
        log.error("Database error on {}", req.getRequestURI(), ex);
        return body(500, "Database Error",
                ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage(), req);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return body(500, "Internal Server Error", ex.getMessage(), req);
    }

    private static Map<String, Object> body(int status, String error, String message, HttpServletRequest req) {
        return Map.of(
                "timestamp", Instant.now(),
                "status", status,
                "error", error,
                "message", message == null ? "" : message,
                "path", req.getRequestURI()
        );
    }
}
