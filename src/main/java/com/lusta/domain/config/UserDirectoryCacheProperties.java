package com.lusta.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.caffeine.user-directory")
public class UserDirectoryCacheProperties {

    /** 是否启用 username -> identity 本地缓存。 */
    private boolean enabled = true;

    /** Caffeine 初始容量。 */
    private int initialCapacity = 256;

    /** Caffeine 最大条目数。 */
    private long maximumSize = 10_000;

    /** 访问后过期（秒）。 */
    private long expireAfterAccessSeconds = 3600;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public void setInitialCapacity(int initialCapacity) {
        this.initialCapacity = initialCapacity;
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public long getExpireAfterAccessSeconds() {
        return expireAfterAccessSeconds;
    }

    public void setExpireAfterAccessSeconds(long expireAfterAccessSeconds) {
        this.expireAfterAccessSeconds = expireAfterAccessSeconds;
    }
}
