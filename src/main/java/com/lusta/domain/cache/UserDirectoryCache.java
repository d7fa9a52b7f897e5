package com.lusta.domain.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.lusta.domain.config.UserDirectoryCacheProperties;
import com.lusta.domain.dto.Identity;
import com.lusta.domain.entity.UserEntity;
import com.lusta.domain.store.MessageStore;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 基于 Caffeine 的收件人解析缓存：username -> Identity。
 *
 * <p>用户注册后 id 与用户名都不变、也不会删除，所以命中即有效，无需失效逻辑。
 * 只缓存命中结果：查不到的用户名可能稍后被注册，不能缓存“不存在”。</p>
 */
@Component
public class UserDirectoryCache {

    private final MessageStore messageStore;
    private final UserDirectoryCacheProperties props;
    private final Cache<String, Identity> cache;

    public UserDirectoryCache(MessageStore messageStore, UserDirectoryCacheProperties props) {
        this.messageStore = messageStore;
        this.props = props;
        this.cache = Caffeine.newBuilder()
                .initialCapacity(Math.max(1, props.getInitialCapacity()))
                .maximumSize(Math.max(1, props.getMaximumSize()))
                .expireAfterAccess(Duration.ofSeconds(Math.max(1, props.getExpireAfterAccessSeconds())))
                .build();
    }

    /**
     * 阻塞调用（可能查库），只能在 db 线程池里用。
     */
    public Identity findByUsername(String username) {
        if (username == null || username.isBlank()) {
            return null;
        }
        if (!props.isEnabled()) {
            return load(username);
        }
        Identity cached = cache.getIfPresent(username);
        if (cached != null) {
            return cached;
        }
        Identity loaded = load(username);
        if (loaded != null) {
            cache.put(username, loaded);
        }
        return loaded;
    }

    private Identity load(String username) {
        UserEntity user = messageStore.findUserByUsername(username);
        if (user == null || user.getId() == null) {
            return null;
        }
        return new Identity(user.getId(), user.getUsername());
    }
}
