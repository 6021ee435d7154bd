package com.example.storeauth.exception;

import org.springframework.http.HttpStatus;

public class AccountDisabledException extends ApiException {

    public AccountDisabledException() {
        super(HttpStatus.FORBIDDEN, "Account is disabled");
    }

    public AccountDisabledException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
