package com.feeguard.api;

import com.feeguard.config.PoolConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine failures onto {@code {error_code, message, timestamp}} bodies.
 *
 * A rejected pool configuration carries its own code ({@code INVALID_FEE_RANGE} and
 * friends). A body Jackson cannot bind (unknown model, bad coefficient precision,
 * non-numeric size) is {@code BAD_REQUEST}. Anything else means the engine or its store
 * broke and is reported as {@code INTERNAL_ERROR} without internals.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PoolConfigException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleConfigRejected(PoolConfigException ex) {
        return body(ex.getErrorCode().getValue(), ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return body("BAD_REQUEST", "request body cannot be bound: " + ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleEngineFailure(Exception ex) {
        log.error("Pool request failed", ex);
        return body("INTERNAL_ERROR", "fee engine failed to serve the request");
    }

    private static Map<String, Object> body(String errorCode, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error_code", errorCode);
        error.put("message", message);
        error.put("timestamp", Instant.now().toString());
        return error;
    }
}
