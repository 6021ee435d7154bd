package com.example.storeauth.dto;

import com.example.storeauth.user.Role;
import com.example.storeauth.user.User;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "User profile")
public class UserResponse {

    private Long id;
    private String username;

    @Schema(description = "Email address, omitted from listings and views of other users")
    private String email;

    private Role role;
    private Boolean isVerified;
    private Boolean isActive;
    private LocalDateTime createdAt;

    /**
     * Full profile, for the account owner.
     */
    public static UserResponse from(User user) {
        return publicView(user).toBuilder()
            .email(user.getEmail())
            .isVerified(user.getVerified())
            .build();
    }

    /**
     * Profile without contact details.
     */
    public static UserResponse publicView(User user) {
        return UserResponse.builder()
            .id(user.getId())
            .username(user.getUsername())
            .role(user.getRole())
            .isActive(user.getActive())
            .createdAt(user.getCreatedAt())
            .build();
    }
}
