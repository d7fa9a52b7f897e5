package com.lusta.domain.dto;

import java.time.LocalDateTime;

/**
 * 历史消息条目。read 保留给只认布尔已读标记的旧客户端，等价于 deliveryState == "read"。
 */
public record HistoryMessageDto(
        Long id,
        Long senderId,
        String senderUsername,
        Long receiverId,
        String content,
        LocalDateTime timestamp,
        String deliveryState,
        boolean read
) {
}
