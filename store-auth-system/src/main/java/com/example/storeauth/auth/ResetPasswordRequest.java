package com.example.storeauth.auth;

import com.example.storeauth.dto.ValidationPatterns;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Password reset request")
public class ResetPasswordRequest {

    @NotBlank(message = "Token is required")
    @Schema(description = "Token received by email", requiredMode = Schema.RequiredMode.REQUIRED)
    private String token;

    @NotBlank(message = "New password is required")
    @Pattern(regexp = ValidationPatterns.STRONG_PASSWORD, message = ValidationPatterns.PASSWORD_MESSAGE)
    @Schema(description = "New password", example = "NewStrongPass1!", requiredMode = Schema.RequiredMode.REQUIRED)
    private String newPassword;
}
