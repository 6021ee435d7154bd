package com.example.storeauth.exception;

import org.springframework.http.HttpStatus;

public class InvalidOrExpiredTokenException extends ApiException {

    public InvalidOrExpiredTokenException() {
        super(HttpStatus.BAD_REQUEST, "Invalid or expired token");
    }

    public InvalidOrExpiredTokenException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
