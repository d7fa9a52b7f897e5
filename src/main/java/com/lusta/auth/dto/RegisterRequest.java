package com.lusta.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "missing_username")
        @Size(max = 50, message = "username_too_long")
        String username,
        @NotBlank(message = "missing_password")
        @Size(max = 128, message = "password_too_long")
        String password
) {
}
