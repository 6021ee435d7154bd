package com.example.storeauth.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base of every failure that is reported to the caller as-is.
 * Rendered by {@link GlobalExceptionHandler} with {@link #getStatus()} and the message.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;

    protected ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected ApiException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
