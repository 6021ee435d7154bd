package com.example.storeauth.exception;

import org.springframework.http.HttpStatus;

public class ConflictException extends ApiException {

    public ConflictException() {
        super(HttpStatus.CONFLICT, "User already exists");
    }

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}
