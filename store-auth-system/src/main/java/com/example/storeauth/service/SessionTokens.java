package com.example.storeauth.service;

import lombok.Value;

@Value
public class SessionTokens {
    String accessToken;
    String refreshToken;
}
