package com.lusta.gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        GatewayProperties.class,
        WsBackpressureProperties.class,
        WsInboundQueueProperties.class,
        WsPushProperties.class
})
public class GatewayConfig {
}
