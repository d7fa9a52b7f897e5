package com.lusta.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 单连接入站串行队列：同一连接的帧严格按到达顺序处理，积压超过上限时回 server_busy。
 */
@ConfigurationProperties(prefix = "im.gateway.ws.inbound-queue")
public record WsInboundQueueProperties(
        Integer maxPendingPerConn
) {

    public int maxPendingPerConnEffective() {
        Integer v = maxPendingPerConn;
        if (v == null) {
            return 256;
        }
        return Math.max(1, v);
    }
}
