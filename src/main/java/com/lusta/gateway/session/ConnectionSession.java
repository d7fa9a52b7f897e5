package com.lusta.gateway.session;

import com.lusta.domain.dto.Identity;
import com.lusta.gateway.ws.WsEnvelope;
import com.lusta.gateway.ws.WsWriter;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一条已通过握手鉴权的 WS 连接。
 *
 * <p>生命周期：CONNECTING -> AUTHENTICATED -> ACTIVE -> CLOSED，只前进。
 * 握手未通过的连接不会创建 session，所以对象创建即处于 AUTHENTICATED。</p>
 *
 * <p>push/send 都不阻塞：写出在 channel 的 eventLoop 上完成，结果通过 future 返回。</p>
 */
@Slf4j
public class ConnectionSession {

    public static final AttributeKey<ConnectionSession> ATTR_SESSION = AttributeKey.valueOf("im:ws:session");

    public static final int CLOSE_REPLACED = 4001;
    public static final String CLOSE_REASON_REPLACED = "replaced";

    public static final int CLOSE_PROTOCOL_ERROR = 1002;
    public static final String CLOSE_REASON_PROTOCOL_ERROR = "protocol_error";

    public enum State {
        CONNECTING,
        AUTHENTICATED,
        ACTIVE,
        CLOSED
    }

    private final Identity identity;
    private final Channel channel;
    private final WsWriter writer;
    private final AtomicReference<State> state = new AtomicReference<>(State.AUTHENTICATED);
    private final AtomicBoolean closeRequested = new AtomicBoolean(false);

    public ConnectionSession(Identity identity, Channel channel, WsWriter writer) {
        if (identity == null) {
            throw new IllegalArgumentException("identity is null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel is null");
        }
        this.identity = identity;
        this.channel = channel;
        this.writer = writer;
    }

    public Identity identity() {
        return identity;
    }

    public long userId() {
        return identity.userId();
    }

    public Channel channel() {
        return channel;
    }

    public State state() {
        return state.get();
    }

    /**
     * AUTHENTICATED -> ACTIVE，只在注册进在线表时调用一次。
     */
    public boolean activate() {
        return state.compareAndSet(State.AUTHENTICATED, State.ACTIVE);
    }

    public boolean isActive() {
        return state.get() == State.ACTIVE && channel.isActive();
    }

    public void markClosed() {
        state.set(State.CLOSED);
    }

    /**
     * 写一帧给这条连接。连接已关闭或不可写时 future 直接失败。
     */
    public CompletableFuture<Void> send(WsEnvelope env) {
        CompletableFuture<Void> out = new CompletableFuture<>();
        if (state.get() == State.CLOSED) {
            out.completeExceptionally(new IllegalStateException("session closed"));
            return out;
        }
        try {
            writer.write(channel, env).addListener(f -> {
                if (f.isSuccess()) {
                    out.complete(null);
                } else {
                    out.completeExceptionally(f.cause());
                }
            });
        } catch (Exception e) {
            out.completeExceptionally(e);
        }
        return out;
    }

    /**
     * 带超时的推送：超过 timeoutMs 还没写出完成，按失败处理。
     */
    public CompletableFuture<Void> push(WsEnvelope env, long timeoutMs) {
        return send(env).orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 发送 close 帧后关闭底层连接。多次调用只有第一次生效。
     *
     * @return 本次调用是否真正触发了关闭
     */
    public boolean close(int code, String reason) {
        if (!closeRequested.compareAndSet(false, true)) {
            return false;
        }
        state.set(State.CLOSED);
        log.info("ws session closing: uid={}, username={}, code={}, reason={}",
                identity.userId(), identity.username(), code, reason);
        if (!channel.isActive()) {
            channel.close();
            return true;
        }
        channel.writeAndFlush(new CloseWebSocketFrame(code, reason)).addListener(ChannelFutureListener.CLOSE);
        return true;
    }

    @Override
    public String toString() {
        return "ConnectionSession{uid=" + identity.userId()
                + ", username=" + identity.username()
                + ", state=" + state.get()
                + ", channel=" + channel.id().asShortText() + "}";
    }
}
