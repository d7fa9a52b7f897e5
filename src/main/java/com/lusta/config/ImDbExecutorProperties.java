package com.lusta.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 落库线程池配置：消息写入、投递状态推进、收件人解析都在这里跑，不占用 Netty eventLoop。
 */
@ConfigurationProperties(prefix = "im.executors.db")
public record ImDbExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity
) {

    public int corePoolSizeEffective() {
        Integer v = corePoolSize;
        if (v == null) {
            return 8;
        }
        return Math.max(1, v);
    }

    public int maxPoolSizeEffective() {
        Integer v = maxPoolSize;
        if (v == null) {
            return 32;
        }
        return Math.max(1, v);
    }

    public int queueCapacityEffective() {
        Integer v = queueCapacity;
        if (v == null) {
            return 10_000;
        }
        return Math.max(0, v);
    }
}
