package com.lusta.gateway.ws;

import com.lusta.domain.cache.UserDirectoryCache;
import com.lusta.domain.config.MessagePolicyProperties;
import com.lusta.domain.dto.Identity;
import com.lusta.domain.entity.MessageEntity;
import com.lusta.domain.enums.DeliveryState;
import com.lusta.domain.store.MessageStore;
import com.lusta.gateway.config.WsPushProperties;
import com.lusta.gateway.session.ConnectionSession;
import com.lusta.gateway.session.PresenceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 单聊路由核心：连接上线/下线、send_message、get_online_users。
 *
 * <p>send_message 的顺序固定为：解析收件人 -> 落库 -> 在线则推送（成功才标 DELIVERED）-> 给发送方回 message_sent。
 * 落库成功之前不产生任何对外可见的副作用；落库成功后即使推送失败消息也不会丢，保持 SENT 等对方拉历史。</p>
 *
 * <p>所有阻塞调用（查用户、落库、改状态）都在 imDbExecutor 上执行，eventLoop 上只做编排与写出。</p>
 */
@Slf4j
@Component
public class MessageRouter {

    public static final String REASON_RECIPIENT_NOT_FOUND = "recipient not found";
    public static final String REASON_CANNOT_SEND_TO_SELF = "cannot_send_to_self";
    public static final String REASON_EMPTY_CONTENT = "empty_content";
    public static final String REASON_CONTENT_TOO_LONG = "content_too_long";
    public static final String REASON_PERSIST_FAILED = "persist_failed";
    public static final String REASON_SERVER_BUSY = "server_busy";
    public static final String REASON_INTERNAL_ERROR = "internal_error";

    private final PresenceRegistry presenceRegistry;
    private final MessageStore messageStore;
    private final UserDirectoryCache userDirectory;
    private final MessagePolicyProperties policy;
    private final WsPushProperties pushProps;
    private final Executor dbExecutor;

    public MessageRouter(PresenceRegistry presenceRegistry,
                         MessageStore messageStore,
                         UserDirectoryCache userDirectory,
                         MessagePolicyProperties policy,
                         WsPushProperties pushProps,
                         @Qualifier("imDbExecutor") Executor dbExecutor) {
        this.presenceRegistry = presenceRegistry;
        this.messageStore = messageStore;
        this.userDirectory = userDirectory;
        this.policy = policy;
        this.pushProps = pushProps;
        this.dbExecutor = dbExecutor;
    }

    /**
     * 握手完成后调用：登记为该用户的当前连接，旧连接（如果有）以 4001 replaced 关闭。
     */
    public void onConnect(ConnectionSession session) {
        session.activate();
        ConnectionSession evicted = presenceRegistry.register(session);
        if (evicted != null) {
            evicted.close(ConnectionSession.CLOSE_REPLACED, ConnectionSession.CLOSE_REASON_REPLACED);
        }
        log.info("ws online: uid={}, username={}, online={}",
                session.userId(), session.identity().username(), presenceRegistry.onlineCount());
    }

    /**
     * 连接断开后调用。只注销当前登记的就是它的情况，被顶掉的旧连接迟到的断开不影响新连接。
     */
    public void onDisconnect(ConnectionSession session) {
        session.markClosed();
        boolean removed = presenceRegistry.deregister(session.userId(), session);
        log.info("ws offline: uid={}, username={}, deregistered={}, online={}",
                session.userId(), session.identity().username(), removed, presenceRegistry.onlineCount());
    }

    /**
     * 处理一帧入站消息。返回的 stage 在本帧的全部副作用（包括给发送方的回执）都已发出后完成，
     * 调用方据此保证同一连接的帧串行处理。
     */
    public CompletionStage<Void> handle(ConnectionSession session, WsEnvelope frame) {
        if (!session.isActive()) {
            log.debug("drop frame on inactive session: {}", session);
            return CompletableFuture.completedFuture(null);
        }
        String action = frame.getAction();
        if (action == null) {
            log.debug("ignore frame without action: uid={}", session.userId());
            return CompletableFuture.completedFuture(null);
        }
        switch (action) {
            case WsEnvelope.ACTION_SEND_MESSAGE:
                return handleSendMessage(session, frame);
            case WsEnvelope.ACTION_GET_ONLINE_USERS:
                return handleGetOnlineUsers(session);
            default:
                log.debug("ignore unknown action: uid={}, action={}", session.userId(), action);
                return CompletableFuture.completedFuture(null);
        }
    }

    private CompletionStage<Void> handleGetOnlineUsers(ConnectionSession session) {
        List<String> users = new ArrayList<>();
        for (Identity identity : presenceRegistry.listOnline()) {
            users.add(identity.username());
        }
        Collections.sort(users);
        reply(session, WsEnvelope.onlineUsers(users));
        return CompletableFuture.completedFuture(null);
    }

    private CompletionStage<Void> handleSendMessage(ConnectionSession session, WsEnvelope frame) {
        Identity sender = session.identity();
        String to = frame.getTo();
        String content = frame.getMessage() == null ? "" : frame.getMessage();

        if (content.isBlank() && !policy.allowBlankContentEffective()) {
            reply(session, WsEnvelope.error(REASON_EMPTY_CONTENT, "message is empty"));
            return CompletableFuture.completedFuture(null);
        }
        if (content.length() > policy.maxContentLengthEffective()) {
            reply(session, WsEnvelope.error(REASON_CONTENT_TOO_LONG,
                    "message exceeds " + policy.maxContentLengthEffective() + " chars"));
            return CompletableFuture.completedFuture(null);
        }

        return supplyOnDb(() -> userDirectory.findByUsername(to))
                .thenCompose(recipient -> {
                    if (recipient == null) {
                        log.debug("recipient not found: from={}, to={}", sender.username(), to);
                        reply(session, WsEnvelope.error(REASON_RECIPIENT_NOT_FOUND, "user " + to + " not found"));
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    if (recipient.userId() == sender.userId() && !policy.allowSelfMessageEffective()) {
                        reply(session, WsEnvelope.error(REASON_CANNOT_SEND_TO_SELF, "cannot send message to yourself"));
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    return persistAndRoute(session, sender, recipient, content);
                })
                .exceptionally(e -> {
                    Throwable cause = unwrap(e);
                    if (cause instanceof RejectedExecutionException) {
                        log.warn("db executor rejected recipient lookup: from={}, to={}", sender.username(), to);
                        reply(session, WsEnvelope.error(REASON_SERVER_BUSY, "server busy, retry later"));
                    } else {
                        log.error("send_message failed: from={}, to={}", sender.username(), to, cause);
                        reply(session, WsEnvelope.error(REASON_INTERNAL_ERROR, "internal error"));
                    }
                    return null;
                });
    }

    private CompletableFuture<Void> persistAndRoute(ConnectionSession session, Identity sender, Identity recipient, String content) {
        LocalDateTime now = LocalDateTime.now().truncatedTo(ChronoUnit.MICROS);
        return supplyOnDb(() -> messageStore.createMessage(sender.userId(), recipient.userId(), content, now))
                .handle((saved, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        if (cause instanceof RejectedExecutionException) {
                            log.warn("db executor rejected message persist: from={}, to={}", sender.userId(), recipient.userId());
                            reply(session, WsEnvelope.error(REASON_SERVER_BUSY, "server busy, retry later"));
                        } else {
                            log.error("persist message failed: from={}, to={}", sender.userId(), recipient.userId(), cause);
                            reply(session, WsEnvelope.error(REASON_PERSIST_FAILED, "message was not saved"));
                        }
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    return deliver(sender, recipient, saved)
                            .thenAccept(delivered -> reply(session, WsEnvelope.messageSent(recipient.username(), saved)));
                })
                .thenCompose(f -> f);
    }

    /**
     * 推给接收方的当前连接。推送成功才推进到 DELIVERED；不在线、推送失败或超时都保持 SENT。
     *
     * @return 是否已标记为 DELIVERED
     */
    private CompletableFuture<Boolean> deliver(Identity sender, Identity recipient, MessageEntity saved) {
        ConnectionSession target = presenceRegistry.lookup(recipient.userId());
        if (target == null) {
            log.debug("recipient offline, keep SENT: msgId={}, to={}", saved.getId(), recipient.userId());
            return CompletableFuture.completedFuture(false);
        }
        return target.push(WsEnvelope.newMessage(sender, saved), pushProps.timeoutMsEffective())
                .handle((v, e) -> {
                    if (e != null) {
                        log.debug("push failed, keep SENT: msgId={}, to={}, err={}", saved.getId(), recipient.userId(), unwrap(e).toString());
                        return false;
                    }
                    return true;
                })
                .thenCompose(pushed -> pushed ? markDelivered(saved) : CompletableFuture.completedFuture(false));
    }

    private CompletableFuture<Boolean> markDelivered(MessageEntity saved) {
        return supplyOnDb(() -> messageStore.advanceDeliveryState(saved.getId(), DeliveryState.DELIVERED))
                .handle((advanced, e) -> {
                    if (e != null) {
                        log.warn("mark delivered failed: msgId={}, err={}", saved.getId(), unwrap(e).toString());
                        return false;
                    }
                    if (Boolean.TRUE.equals(advanced)) {
                        saved.setDeliveryState(DeliveryState.DELIVERED);
                    }
                    return Boolean.TRUE.equals(advanced);
                });
    }

    private <T> CompletableFuture<T> supplyOnDb(Supplier<T> supplier) {
        try {
            return CompletableFuture.supplyAsync(supplier, dbExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static void reply(ConnectionSession session, WsEnvelope env) {
        session.send(env).whenComplete((v, e) -> {
            if (e != null) {
                log.debug("reply not written: uid={}, type={}, err={}", session.userId(), env.getType(), e.toString());
            }
        });
    }

    private static Throwable unwrap(Throwable e) {
        Throwable cur = e;
        while (cur instanceof CompletionException && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
