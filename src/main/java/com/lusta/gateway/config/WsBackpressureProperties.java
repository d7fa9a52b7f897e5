package com.lusta.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 慢消费者保护：写缓冲水位、不可写时是否直接丢弃推送、持续不可写多久后断开。
 */
@ConfigurationProperties(prefix = "im.gateway.ws.backpressure")
public record WsBackpressureProperties(
        Boolean enabled,
        Integer writeBufferLowWaterMarkBytes,
        Integer writeBufferHighWaterMarkBytes,
        Long closeUnwritableAfterMs,
        Boolean dropWhenUnwritable
) {

    public boolean enabledEffective() {
        return enabled == null || enabled;
    }

    public int lowWaterMarkBytesEffective() {
        Integer v = writeBufferLowWaterMarkBytes;
        if (v == null || v <= 0) {
            return 32 * 1024;
        }
        return v;
    }

    public int highWaterMarkBytesEffective() {
        Integer v = writeBufferHighWaterMarkBytes;
        if (v == null || v <= 0) {
            return 64 * 1024;
        }
        return Math.max(v, lowWaterMarkBytesEffective() + 1);
    }

    /**
     * 负数表示不因持续不可写而断开。
     */
    public long closeUnwritableAfterMsEffective() {
        Long v = closeUnwritableAfterMs;
        if (v == null) {
            return 5_000;
        }
        return v;
    }

    public boolean dropWhenUnwritableEffective() {
        return dropWhenUnwritable == null || dropWhenUnwritable;
    }
}
