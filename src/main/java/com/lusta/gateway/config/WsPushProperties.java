package com.lusta.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 实时推送：等待接收方连接写出完成的上限，超时按推送失败处理（消息保持 SENT）。
 */
@ConfigurationProperties(prefix = "im.gateway.ws.push")
public record WsPushProperties(
        Long timeoutMs
) {

    public long timeoutMsEffective() {
        Long v = timeoutMs;
        if (v == null || v <= 0) {
            return 2_000;
        }
        return v;
    }
}
