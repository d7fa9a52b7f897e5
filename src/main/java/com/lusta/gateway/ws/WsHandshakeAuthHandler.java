package com.lusta.gateway.ws;

import com.lusta.auth.service.AuthService;
import com.lusta.common.api.AuthFailureException;
import com.lusta.domain.dto.Identity;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.AttributeKey;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * WS 握手（HTTP Upgrade）阶段鉴权。
 *
 * <p>accessToken 取自 Authorization: Bearer &lt;token&gt;，或 query 参数 token / accessToken（浏览器 WebSocket 不能带自定义头）。
 * 校验通过后把 Identity 绑定到 channel，交给后面的 WebSocketServerProtocolHandler 完成握手；
 * 失败直接回 HTTP 401，连接不会升级，也不会进入在线表。</p>
 */
@Slf4j
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    public static final AttributeKey<Identity> ATTR_IDENTITY = AttributeKey.valueOf("im:ws:identity");

    static final String UNAUTHENTICATED = "unauthenticated";

    private final String wsPath;
    private final AuthService authService;

    public WsHandshakeAuthHandler(String wsPath, AuthService authService) {
        this.wsPath = wsPath;
        this.authService = authService;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        if (!wsPath.equals(decoder.path())) {
            writeAndClose(ctx, HttpResponseStatus.NOT_FOUND, "not_found");
            return;
        }

        Identity identity;
        try {
            identity = authService.verifyAccessToken(extractAccessToken(req, decoder));
        } catch (AuthFailureException e) {
            log.info("ws handshake rejected: remote={}, reason={}", ctx.channel().remoteAddress(), e.getMessage());
            writeAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, UNAUTHENTICATED);
            return;
        }

        ctx.channel().attr(ATTR_IDENTITY).set(identity);
        ctx.fireChannelRead(req.retain());
    }

    static String extractAccessToken(FullHttpRequest req, QueryStringDecoder decoder) {
        String auth = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (auth != null && auth.startsWith("Bearer ")) {
            String token = auth.substring("Bearer ".length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        String token = firstParam(decoder, "token");
        if (token != null) {
            return token;
        }
        return firstParam(decoder, "accessToken");
    }

    private static String firstParam(QueryStringDecoder decoder, String key) {
        List<String> values = decoder.parameters().get(key);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }

    private static void writeAndClose(ChannelHandlerContext ctx, HttpResponseStatus status, String body) {
        byte[] bytes = body.getBytes(CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
    }
}
