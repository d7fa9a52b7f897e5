package com.lusta.auth.dto;

import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @NotBlank(message = "missing_username")
        String username,
        @NotBlank(message = "missing_password")
        String password
) {
}
