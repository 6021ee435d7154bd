package com.example.storeauth.dto;

public final class ValidationPatterns {

    /** 2 to 15 letters, digits or underscores. */
    public static final String USERNAME = "^[a-zA-Z0-9_]{2,15}$";

    /** At least 8 characters with a lowercase and an uppercase letter, a digit and a special character. */
    public static final String STRONG_PASSWORD =
        "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d)(?=.*[!@#$%^&*()_+\\-=\\[\\]{};':\"\\\\|,.<>/?]).{8,}$";

    public static final String USERNAME_MESSAGE =
        "Username must be 2-15 characters and can only contain letters, numbers and underscores";

    public static final String PASSWORD_MESSAGE =
        "Password must be at least 8 characters, include uppercase, lowercase, number and special character";

    private ValidationPatterns() {
    }
}
