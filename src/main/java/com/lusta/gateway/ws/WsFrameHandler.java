package com.lusta.gateway.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lusta.domain.dto.Identity;
import com.lusta.gateway.config.WsInboundQueueProperties;
import com.lusta.gateway.session.ConnectionSession;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.RejectedExecutionException;

/**
 * 连接级入口：握手完成后建 session 并上线，文本帧解析后按连接串行交给 {@link MessageRouter}，
 * 断开时下线。每个 channel 一个实例。
 */
@Slf4j
public class WsFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private final ObjectMapper objectMapper;
    private final MessageRouter router;
    private final WsWriter wsWriter;
    private final WsInboundQueueProperties inboundQueueProps;

    public WsFrameHandler(ObjectMapper objectMapper,
                          MessageRouter router,
                          WsWriter wsWriter,
                          WsInboundQueueProperties inboundQueueProps) {
        this.objectMapper = objectMapper;
        this.router = router;
        this.wsWriter = wsWriter;
        this.inboundQueueProps = inboundQueueProps;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            onHandshakeComplete(ctx.channel());
            return;
        }
        if (evt instanceof IdleStateEvent idle) {
            if (idle.state() == IdleState.WRITER_IDLE) {
                ctx.writeAndFlush(new PingWebSocketFrame());
            } else if (idle.state() == IdleState.READER_IDLE) {
                log.info("ws reader idle, closing: session={}", session(ctx));
                ctx.close();
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    void onHandshakeComplete(Channel ch) {
        Identity identity = ch.attr(WsHandshakeAuthHandler.ATTR_IDENTITY).get();
        if (identity == null) {
            // 握手鉴权没绑定身份，不应发生
            log.warn("ws handshake completed without identity, closing: remote={}", ch.remoteAddress());
            ch.close();
            return;
        }
        ConnectionSession session = new ConnectionSession(identity, ch, wsWriter);
        ch.attr(ConnectionSession.ATTR_SESSION).set(session);
        router.onConnect(session);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        ConnectionSession session = session(ctx);
        if (session == null) {
            ctx.close();
            return;
        }

        WsEnvelope msg;
        try {
            msg = objectMapper.readValue(frame.text(), WsEnvelope.class);
        } catch (JsonProcessingException e) {
            msg = null;
        }
        if (msg == null) {
            log.info("malformed ws frame, closing: session={}", session);
            session.close(ConnectionSession.CLOSE_PROTOCOL_ERROR, ConnectionSession.CLOSE_REASON_PROTOCOL_ERROR);
            return;
        }

        final WsEnvelope inbound = msg;
        WsChannelSerialQueue.submit(ctx.channel(), () -> router.handle(session, inbound), inboundQueueProps.maxPendingPerConnEffective())
                .whenComplete((v, e) -> {
                    if (e == null) {
                        return;
                    }
                    if (e instanceof RejectedExecutionException) {
                        log.warn("ws inbound queue full: session={}, pending={}", session, WsChannelSerialQueue.pending(ctx.channel()));
                        session.send(WsEnvelope.error(MessageRouter.REASON_SERVER_BUSY, "too many pending frames"));
                    } else {
                        log.error("ws frame handling failed: session={}, action={}", session, inbound.getAction(), e);
                    }
                });
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        ConnectionSession session = session(ctx);
        if (session != null) {
            router.onDisconnect(session);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("ws channel error, closing: session={}, err={}", session(ctx), cause.toString());
        ctx.close();
    }

    private static ConnectionSession session(ChannelHandlerContext ctx) {
        return ctx.channel().attr(ConnectionSession.ATTR_SESSION).get();
    }
}
