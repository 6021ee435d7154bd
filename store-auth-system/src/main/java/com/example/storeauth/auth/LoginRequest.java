package com.example.storeauth.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Login request")
public class LoginRequest {

    @NotBlank(message = "Identifier is required")
    @Schema(description = "Email or username", example = "john@example.com", requiredMode = Schema.RequiredMode.REQUIRED)
    private String identifier;

    @NotBlank(message = "Password is required")
    @Schema(description = "Password", example = "mySecurePass1!", requiredMode = Schema.RequiredMode.REQUIRED)
    private String password;
}
