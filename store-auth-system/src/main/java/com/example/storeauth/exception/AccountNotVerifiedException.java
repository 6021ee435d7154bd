package com.example.storeauth.exception;

import org.springframework.http.HttpStatus;

public class AccountNotVerifiedException extends ApiException {

    public AccountNotVerifiedException() {
        super(HttpStatus.FORBIDDEN, "Please verify your email");
    }

    public AccountNotVerifiedException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
