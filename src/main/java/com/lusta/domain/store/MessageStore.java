package com.lusta.domain.store;

import com.lusta.domain.entity.MessageEntity;
import com.lusta.domain.entity.UserEntity;
import com.lusta.domain.enums.DeliveryState;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 持久层契约：用户目录 + 单聊消息。
 *
 * <p>实现必须保证：</p>
 * <ul>
 *   <li>createUser 对重名抛 {@link org.springframework.dao.DuplicateKeyException}，且不覆盖已有用户</li>
 *   <li>createMessage 返回时消息已提交，id 已分配</li>
 *   <li>投递状态只前进不后退：所有状态更新都是条件更新（当前状态 &lt; 目标状态）</li>
 * </ul>
 *
 * <p>所有方法都可能阻塞，调用方不能在 Netty eventLoop 上直接调用。</p>
 */
public interface MessageStore {

    UserEntity createUser(String username, String passwordHash);

    UserEntity findUserById(long userId);

    UserEntity findUserByUsername(String username);

    /** 全部用户，按 id 升序。 */
    List<UserEntity> listUsers();

    List<UserEntity> findUsersByIds(Collection<Long> userIds);

    MessageEntity createMessage(long senderId, long receiverId, String content, LocalDateTime createdAt);

    /**
     * 单条消息推进到 target。
     *
     * @return true 表示确实发生了推进；已处于 target 或更高状态时返回 false
     */
    boolean advanceDeliveryState(long messageId, DeliveryState target);

    /**
     * 把 sender 发给 receiver、且状态低于 target 的消息全部推进到 target。
     *
     * @return 受影响的消息条数
     */
    int advanceDeliveryStateFrom(long receiverId, long senderId, DeliveryState target);

    /** 与 userId 有过消息往来（任一方向）的对端 userId，不保证顺序。 */
    List<Long> findPartnerIds(long userId);

    /** 两人之间最新的一条消息（created_at 倒序、id 倒序取第一条），没有则返回 null。 */
    MessageEntity findLastMessageBetween(long userA, long userB);

    /** sender 发给 receiver 且尚未已读的条数。 */
    long countUnreadFrom(long receiverId, long senderId);

    /** 两人之间的全部消息（双向），按 created_at、id 升序。 */
    List<MessageEntity> findConversation(long userA, long userB);

    long countMessages();
}
