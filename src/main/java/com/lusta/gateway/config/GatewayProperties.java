package com.lusta.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WS 网关监听与心跳配置。
 *
 * @param readerIdleSeconds  这段时间内没有任何入站数据（包括 pong）就关闭连接
 * @param writerIdleSeconds  这段时间内没有写出就发一次 WS ping
 */
@ConfigurationProperties(prefix = "im.gateway.ws")
public record GatewayProperties(
        String host,
        int port,
        String path,
        Integer readerIdleSeconds,
        Integer writerIdleSeconds
) {

    public int readerIdleSecondsEffective() {
        Integer v = readerIdleSeconds;
        if (v == null || v < 0) {
            return 180;
        }
        return v;
    }

    public int writerIdleSecondsEffective() {
        Integer v = writerIdleSeconds;
        if (v == null || v < 0) {
            return 60;
        }
        return v;
    }
}
