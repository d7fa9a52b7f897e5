package com.lusta.auth.dto;

public record RegisterResponse(
        long userId,
        String username
) {
}
