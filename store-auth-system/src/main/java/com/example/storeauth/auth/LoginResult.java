package com.example.storeauth.auth;

import com.example.storeauth.dto.SafeUser;
import lombok.Value;

@Value
public class LoginResult {
    SafeUser user;
    String accessToken;
    String refreshToken;
}
