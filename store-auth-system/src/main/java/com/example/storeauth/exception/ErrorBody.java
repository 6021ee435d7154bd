package com.example.storeauth.exception;

import org.springframework.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single error envelope shared by the MVC exception handler and the security layer.
 */
public final class ErrorBody {

    private ErrorBody() {
    }

    public static Map<String, Object> of(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return body;
    }
}
