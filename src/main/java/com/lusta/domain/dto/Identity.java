package com.lusta.domain.dto;

/**
 * 已认证的身份：不可变的 userId + 唯一显示名。
 */
public record Identity(
        long userId,
        String username
) {
}
