package com.lusta.domain.dto;

public record UserBasicDto(
        Long id,
        String username
) {
}
