package com.lusta.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 发消息的业务规则开关。
 *
 * <p>是否允许给自己发、是否允许空内容历来没有约定，这里做成配置，默认与旧行为一致（都允许）。</p>
 */
@ConfigurationProperties(prefix = "im.message.policy")
public record MessagePolicyProperties(
        Boolean allowSelfMessage,
        Boolean allowBlankContent,
        Integer maxContentLength
) {

    public boolean allowSelfMessageEffective() {
        return allowSelfMessage == null || allowSelfMessage;
    }

    public boolean allowBlankContentEffective() {
        return allowBlankContent == null || allowBlankContent;
    }

    public int maxContentLengthEffective() {
        Integer v = maxContentLength;
        if (v == null || v <= 0) {
            return 4096;
        }
        return v;
    }
}
