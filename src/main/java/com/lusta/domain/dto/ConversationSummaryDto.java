package com.lusta.domain.dto;

import java.time.LocalDateTime;

public record ConversationSummaryDto(
        Long partnerId,
        String partnerUsername,
        String lastMessage,
        LocalDateTime lastMessageTime,
        long unreadCount
) {
}
