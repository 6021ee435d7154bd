package com.example.storeauth.dto;

import com.example.storeauth.user.Role;
import com.example.storeauth.user.User;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Minimal identity returned on login")
public class SafeUser {

    @Schema(description = "User id", example = "1")
    private Long id;

    @Schema(description = "Username", example = "john_doe")
    private String username;

    @Schema(description = "Role", example = "user")
    private Role role;

    public static SafeUser from(User user) {
        return new SafeUser(user.getId(), user.getUsername(), user.getRole());
    }
}
