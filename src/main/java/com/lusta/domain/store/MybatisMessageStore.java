package com.lusta.domain.store;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.lusta.domain.entity.MessageEntity;
import com.lusta.domain.entity.UserEntity;
import com.lusta.domain.enums.DeliveryState;
import com.lusta.domain.mapper.MessageMapper;
import com.lusta.domain.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 基于 MyBatis-Plus 的 MessageStore。
 *
 * <p>状态推进统一写成 {@code update ... set delivery_state = ? where ... and delivery_state < ?}，
 * 并发推进（例如实时投递与拉历史同时发生）时不会出现 READ 被改回 DELIVERED。</p>
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MybatisMessageStore implements MessageStore {

    private final UserMapper userMapper;
    private final MessageMapper messageMapper;

    @Override
    public UserEntity createUser(String username, String passwordHash) {
        UserEntity user = UserEntity.builder()
                .username(username)
                .passwordHash(passwordHash)
                .createdAt(LocalDateTime.now())
                .build();
        // 重名时 uk_username 触发 DuplicateKeyException，由 AuthService 翻译为 ConflictException
        if (userMapper.insert(user) != 1) {
            throw new IllegalStateException("insert user failed");
        }
        return user;
    }

    @Override
    public UserEntity findUserById(long userId) {
        return userMapper.selectById(userId);
    }

    @Override
    public UserEntity findUserByUsername(String username) {
        if (username == null || username.isBlank()) {
            return null;
        }
        return userMapper.selectOne(new LambdaQueryWrapper<UserEntity>()
                .eq(UserEntity::getUsername, username)
                .last("LIMIT 1"));
    }

    @Override
    public List<UserEntity> listUsers() {
        return userMapper.selectList(new LambdaQueryWrapper<UserEntity>()
                .orderByAsc(UserEntity::getId));
    }

    @Override
    public List<UserEntity> findUsersByIds(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return List.of();
        }
        return userMapper.selectBatchIds(userIds);
    }

    @Override
    public MessageEntity createMessage(long senderId, long receiverId, String content, LocalDateTime createdAt) {
        MessageEntity entity = new MessageEntity();
        entity.setSenderId(senderId);
        entity.setReceiverId(receiverId);
        entity.setContent(content);
        entity.setDeliveryState(DeliveryState.SENT);
        entity.setCreatedAt(createdAt);
        if (messageMapper.insert(entity) != 1) {
            throw new IllegalStateException("insert message failed");
        }
        return entity;
    }

    @Override
    public boolean advanceDeliveryState(long messageId, DeliveryState target) {
        int rows = messageMapper.update(null, new LambdaUpdateWrapper<MessageEntity>()
                .eq(MessageEntity::getId, messageId)
                .lt(MessageEntity::getDeliveryState, target.getCode())
                .set(MessageEntity::getDeliveryState, target.getCode()));
        return rows > 0;
    }

    @Override
    public int advanceDeliveryStateFrom(long receiverId, long senderId, DeliveryState target) {
        int rows = messageMapper.update(null, new LambdaUpdateWrapper<MessageEntity>()
                .eq(MessageEntity::getReceiverId, receiverId)
                .eq(MessageEntity::getSenderId, senderId)
                .lt(MessageEntity::getDeliveryState, target.getCode())
                .set(MessageEntity::getDeliveryState, target.getCode()));
        if (rows > 0) {
            log.debug("advanced {} message(s) to {}: receiverId={}, senderId={}", rows, target, receiverId, senderId);
        }
        return rows;
    }

    @Override
    public List<Long> findPartnerIds(long userId) {
        return messageMapper.selectPartnerIds(userId);
    }

    @Override
    public MessageEntity findLastMessageBetween(long userA, long userB) {
        return messageMapper.selectOne(pairWrapper(userA, userB)
                .orderByDesc(MessageEntity::getCreatedAt)
                .orderByDesc(MessageEntity::getId)
                .last("LIMIT 1"));
    }

    @Override
    public long countUnreadFrom(long receiverId, long senderId) {
        Long count = messageMapper.selectCount(new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getReceiverId, receiverId)
                .eq(MessageEntity::getSenderId, senderId)
                .lt(MessageEntity::getDeliveryState, DeliveryState.READ.getCode()));
        return count == null ? 0L : count;
    }

    @Override
    public List<MessageEntity> findConversation(long userA, long userB) {
        return messageMapper.selectList(pairWrapper(userA, userB)
                .orderByAsc(MessageEntity::getCreatedAt)
                .orderByAsc(MessageEntity::getId));
    }

    @Override
    public long countMessages() {
        Long count = messageMapper.selectCount(null);
        return count == null ? 0L : count;
    }

    private static LambdaQueryWrapper<MessageEntity> pairWrapper(long userA, long userB) {
        LambdaQueryWrapper<MessageEntity> wrapper = new LambdaQueryWrapper<>();
        wrapper.nested(w -> w
                .nested(x -> x.eq(MessageEntity::getSenderId, userA).eq(MessageEntity::getReceiverId, userB))
                .or()
                .nested(x -> x.eq(MessageEntity::getSenderId, userB).eq(MessageEntity::getReceiverId, userA)));
        return wrapper;
    }
}
