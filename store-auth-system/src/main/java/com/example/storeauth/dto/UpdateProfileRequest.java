package com.example.storeauth.dto;

import com.example.storeauth.user.Role;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Self-service profile update. {@code email}, {@code role} and {@code isActive} are accepted
 * only so that attempts to change them can be refused explicitly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Profile update request")
public class UpdateProfileRequest {

    @Pattern(regexp = ValidationPatterns.USERNAME, message = ValidationPatterns.USERNAME_MESSAGE)
    @Schema(description = "New username", example = "jane_doe")
    private String username;

    @Pattern(regexp = ValidationPatterns.STRONG_PASSWORD, message = ValidationPatterns.PASSWORD_MESSAGE)
    @Schema(description = "New password", example = "NewStrongPass1!")
    private String password;

    @Schema(hidden = true)
    private String email;

    @Schema(hidden = true)
    private Role role;

    @Schema(hidden = true)
    private Boolean isActive;
}
