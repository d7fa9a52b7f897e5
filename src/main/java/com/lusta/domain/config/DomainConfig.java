package com.lusta.domain.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({MessagePolicyProperties.class, UserDirectoryCacheProperties.class})
public class DomainConfig {
}
