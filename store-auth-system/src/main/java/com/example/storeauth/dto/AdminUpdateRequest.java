package com.example.storeauth.dto;

import com.example.storeauth.user.Role;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admin update of role and activity. Any other field is collected into {@code unknownFields} and refused.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Admin update request")
public class AdminUpdateRequest {

    @Schema(description = "New role", example = "admin")
    private Role role;

    @Schema(description = "Enable or disable the account", example = "false")
    private Boolean isActive;

    @JsonIgnore
    @Builder.Default
    @Schema(hidden = true)
    private Map<String, Object> unknownFields = new LinkedHashMap<>();

    @JsonAnySetter
    public void addUnknownField(String name, Object value) {
        unknownFields.put(name, value);
    }
}
