package com.lusta.domain.service;

import com.lusta.common.api.NotFoundException;
import com.lusta.domain.dto.ConversationSummaryDto;
import com.lusta.domain.dto.HistoryMessageDto;
import com.lusta.domain.entity.MessageEntity;
import com.lusta.domain.entity.UserEntity;
import com.lusta.domain.enums.DeliveryState;
import com.lusta.domain.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 会话列表与历史消息：只读聚合，外加“拉历史即已读”这一条副作用。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatSummaryService {

    /**
     * 会话列表排序：最后一条消息时间倒序；时间相同按对端 id 升序，保证结果稳定。
     */
    static final Comparator<ConversationSummaryDto> CONVERSATION_ORDER = Comparator
            .comparing(ConversationSummaryDto::lastMessageTime, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(ConversationSummaryDto::partnerId);

    private final MessageStore messageStore;

    /**
     * userId 的会话列表：对端 = 我发给过的人 ∪ 发给过我的人，
     * 每个对端各取最新一条消息与未读数（对端发给我且未读）。
     */
    public List<ConversationSummaryDto> conversationsFor(long userId) {
        Set<Long> partnerIds = new LinkedHashSet<>(messageStore.findPartnerIds(userId));
        if (partnerIds.isEmpty()) {
            return List.of();
        }

        Map<Long, UserEntity> partners = new HashMap<>();
        for (UserEntity u : messageStore.findUsersByIds(partnerIds)) {
            partners.put(u.getId(), u);
        }

        List<ConversationSummaryDto> out = new ArrayList<>(partnerIds.size());
        for (Long partnerId : partnerIds) {
            UserEntity partner = partners.get(partnerId);
            if (partner == null) {
                log.warn("conversation partner missing from directory: userId={}, partnerId={}", userId, partnerId);
                continue;
            }
            MessageEntity last = messageStore.findLastMessageBetween(userId, partnerId);
            long unread = messageStore.countUnreadFrom(userId, partnerId);
            out.add(new ConversationSummaryDto(
                    partner.getId(),
                    partner.getUsername(),
                    last == null ? "" : last.getContent(),
                    last == null ? null : last.getCreatedAt(),
                    unread
            ));
        }
        out.sort(CONVERSATION_ORDER);
        return out;
    }

    /**
     * requester 与 partner 之间的完整历史（双向，按时间升序）。
     *
     * <p>副作用：partner 发给 requester 的未读消息先被推进为 READ，再读取返回；
     * 只影响 requester 收到的那一侧，requester 作为发送方的消息状态不变。</p>
     */
    @Transactional
    public List<HistoryMessageDto> history(long requesterId, long partnerId) {
        UserEntity requester = messageStore.findUserById(requesterId);
        if (requester == null) {
            throw new NotFoundException("user_not_found");
        }
        UserEntity partner = messageStore.findUserById(partnerId);
        if (partner == null) {
            throw new NotFoundException("user_not_found");
        }

        markReceivedMessagesRead(requesterId, partnerId);

        List<MessageEntity> messages = messageStore.findConversation(requesterId, partnerId);
        List<HistoryMessageDto> out = new ArrayList<>(messages.size());
        for (MessageEntity m : messages) {
            String senderUsername = Objects.equals(m.getSenderId(), requester.getId())
                    ? requester.getUsername()
                    : partner.getUsername();
            out.add(toDto(m, senderUsername));
        }
        return out;
    }

    /**
     * 已读回执：把 sender 发给 receiver 的所有未读消息（SENT 或 DELIVERED）推进为 READ。
     *
     * @return 本次被推进的条数；重复调用返回 0
     */
    public int markReceivedMessagesRead(long receiverId, long senderId) {
        return messageStore.advanceDeliveryStateFrom(receiverId, senderId, DeliveryState.READ);
    }

    private static HistoryMessageDto toDto(MessageEntity m, String senderUsername) {
        DeliveryState state = m.getDeliveryState() == null ? DeliveryState.SENT : m.getDeliveryState();
        LocalDateTime ts = m.getCreatedAt();
        return new HistoryMessageDto(
                m.getId(),
                m.getSenderId(),
                senderUsername,
                m.getReceiverId(),
                m.getContent(),
                ts,
                state.getDesc(),
                state == DeliveryState.READ
        );
    }
}
