package com.lusta.auth.dto;

public record LoginResponse(
        long userId,
        String username,
        String accessToken,
        long accessTokenExpiresInSeconds
) {
}
