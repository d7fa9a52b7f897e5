package com.lusta.gateway.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lusta.gateway.config.WsBackpressureProperties;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.channels.ClosedChannelException;
import java.util.concurrent.RejectedExecutionException;

/**
 * 出站帧写出。
 * <p>
 * 帧在调用线程序列化，真正的 writeAndFlush 总是落在 channel 自己的 eventLoop 上。
 * 连接已关闭，或开启丢弃策略时 channel 不可写，直接返回失败的 future。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsWriter {

    private final ObjectMapper objectMapper;
    private final WsBackpressureProperties backpressureProps;

    public ChannelFuture write(Channel ch, WsEnvelope env) {
        if (ch == null) {
            throw new IllegalArgumentException("channel is null");
        }
        if (!ch.isActive()) {
            return ch.newFailedFuture(new ClosedChannelException());
        }
        if (shouldDrop(ch)) {
            log.debug("ws frame dropped, channel unwritable: ch={}, type={}", ch.id(), env.getType());
            return ch.newFailedFuture(new IllegalStateException("ws backpressure: channel not writable"));
        }

        TextWebSocketFrame frame;
        try {
            frame = new TextWebSocketFrame(objectMapper.writeValueAsString(env));
        } catch (JsonProcessingException e) {
            log.warn("ws serialize failed: type={}, err={}", env.getType(), e.toString());
            return ch.newFailedFuture(e);
        }

        if (ch.eventLoop().inEventLoop()) {
            return ch.writeAndFlush(frame);
        }
        ChannelPromise promise = ch.newPromise();
        try {
            ch.eventLoop().execute(() -> ch.writeAndFlush(frame, promise));
        } catch (RejectedExecutionException e) {
            // eventLoop 已关闭
            frame.release();
            promise.setFailure(e);
        }
        return promise;
    }

    private boolean shouldDrop(Channel ch) {
        return backpressureProps != null
                && backpressureProps.enabledEffective()
                && backpressureProps.dropWhenUnwritableEffective()
                && !ch.isWritable();
    }
}
