package com.example.storeauth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Access token payload of login and refresh. The refresh token never appears here, it travels in the cookie.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "JWT access token response")
public class TokenResponse {

    @Schema(description = "Logged-in user, present on login only")
    private SafeUser user;

    @Schema(description = "Access token", example = "eyJhbGciOiJIUzUxMiJ9...")
    private String accessToken;

    @Schema(description = "Token type", example = "Bearer")
    private String tokenType;

    @Schema(description = "Access token lifetime in seconds", example = "900")
    private Long accessTokenExpiresIn;
}
