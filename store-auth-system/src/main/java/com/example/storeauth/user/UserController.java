package com.example.storeauth.user;

import com.example.storeauth.dto.AdminUpdateRequest;
import com.example.storeauth.dto.PageResponse;
import com.example.storeauth.dto.UpdateProfileRequest;
import com.example.storeauth.dto.UserResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@SecurityRequirement(name = "bearerAuth")
@Tag(name = "Users", description = "User profile and administration API")
public class UserController {

    private final UserService userService;

    @Operation(summary = "Current user", description = "Profile of the user the access token belongs to.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Profile",
            content = @Content(mediaType = "application/json",
                examples = @ExampleObject(value = "{\"success\":true,\"message\":\"User profile fetched successfully\",\"data\":{\"id\":1,\"username\":\"john_doe\",\"email\":\"john@example.com\",\"role\":\"user\",\"isVerified\":true,\"isActive\":true,\"createdAt\":\"2025-01-01T00:00:00\"}}"))),
        @ApiResponse(responseCode = "401", description = "No token provided"),
        @ApiResponse(responseCode = "403", description = "Invalid or expired token")
    })
    @GetMapping("/me")
    public ResponseEntity<Map<String, Object>> getCurrentUser(Authentication authentication) {
        UserResponse user = userService.getCurrentUser(userId(authentication));
        return ResponseEntity.ok(success("User profile fetched successfully", user));
    }

    @Operation(summary = "List users (admin only)", description = "Paginated listing without email addresses.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Page of users"),
        @ApiResponse(responseCode = "403", description = "Not an admin")
    })
    @GetMapping
    public ResponseEntity<Map<String, Object>> getAllUsers(
        @Parameter(description = "Page number, from 1") @RequestParam(required = false) Integer page,
        @Parameter(description = "Page size, at most 100") @RequestParam(required = false) Integer limit,
        @Parameter(description = "newest, asc or desc") @RequestParam(required = false) String sort) {
        PageResponse<UserResponse> result = userService.getAllUsers(page, limit, sort);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", result.getData().isEmpty() ? "No users found" : "Users fetched successfully");
        body.put("pagination", result.getPagination());
        body.put("data", result.getData());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Get user", description = "Allowed for the user themselves and for admins.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "User found"),
        @ApiResponse(responseCode = "403", description = "Neither self nor admin"),
        @ApiResponse(responseCode = "404", description = "User not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getUserById(@PathVariable Long id, Authentication authentication) {
        UserResponse user = userService.getUserById(id, userId(authentication), isAdmin(authentication));
        return ResponseEntity.ok(success("User " + user.getUsername() + " found successfully", user));
    }

    @Operation(summary = "Update own profile", description = "Changes username and/or password of the caller.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Profile updated"),
        @ApiResponse(responseCode = "400", description = "Email cannot be changed, or validation failed"),
        @ApiResponse(responseCode = "403", description = "Role or activity change, or another user's profile"),
        @ApiResponse(responseCode = "409", description = "Username already taken")
    })
    @PatchMapping("/{id}")
    public ResponseEntity<Map<String, Object>> updateProfile(
        @PathVariable Long id,
        @Valid @RequestBody UpdateProfileRequest request,
        Authentication authentication) {
        UserResponse user = userService.updateProfile(id, userId(authentication), request);
        return ResponseEntity.ok(success("User " + user.getUsername() + " updated successfully", user));
    }

    @Operation(summary = "Change role or activity (admin only)")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "User updated"),
        @ApiResponse(responseCode = "400", description = "Field not updatable, or admin demoting themselves"),
        @ApiResponse(responseCode = "403", description = "Not an admin"),
        @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PatchMapping("/{id}/admin")
    public ResponseEntity<Map<String, Object>> adminUpdateUser(
        @PathVariable Long id,
        @RequestBody AdminUpdateRequest request,
        Authentication authentication) {
        UserResponse user = userService.adminUpdateUser(id, userId(authentication), request);
        return ResponseEntity.ok(success("User " + user.getUsername() + " status/role updated successfully", user));
    }

    @Operation(summary = "Delete user", description = "Allowed for the user themselves and for admins.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "User deleted"),
        @ApiResponse(responseCode = "403", description = "Neither self nor admin"),
        @ApiResponse(responseCode = "404", description = "User not found")
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> deleteUser(@PathVariable Long id, Authentication authentication) {
        UserResponse user = userService.deleteUser(id, userId(authentication), isAdmin(authentication));
        return ResponseEntity.ok(success("User " + user.getUsername() + " deleted successfully", user));
    }

    private static Long userId(Authentication authentication) {
        return Long.valueOf(authentication.getName());
    }

    private static boolean isAdmin(Authentication authentication) {
        return authentication.getAuthorities().stream()
            .anyMatch(authority -> Role.ADMIN.authority().equals(authority.getAuthority()));
    }

    private static Map<String, Object> success(String message, Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", message);
        body.put("data", data);
        return body;
    }
}
