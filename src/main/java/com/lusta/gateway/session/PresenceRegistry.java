package com.lusta.gateway.session;

import com.lusta.domain.dto.Identity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单机在线表：userId -> 当前连接。
 *
 * <ul>
 *   <li>每个用户最多一条连接：后登录的顶掉先登录的（last login wins），被顶掉的连接由调用方关闭</li>
 *   <li>注销带上 session 本身做比较：旧连接的迟到断开不会把新连接踢下线</li>
 * </ul>
 */
@Slf4j
@Component
public class PresenceRegistry {

    private final ConcurrentHashMap<Long, ConnectionSession> sessions = new ConcurrentHashMap<>();

    /**
     * 登记 session 为该用户的当前连接。
     *
     * @return 被顶掉的旧连接；没有旧连接（或重复登记同一个 session）返回 null
     */
    public ConnectionSession register(ConnectionSession session) {
        ConnectionSession evicted = sessions.put(session.userId(), session);
        if (evicted == session) {
            return null;
        }
        if (evicted != null) {
            log.info("presence replaced: uid={}, old={}, new={}", session.userId(), evicted, session);
        }
        return evicted;
    }

    /**
     * 只有当前登记的就是这个 session 时才移除。
     *
     * @return 是否真的移除了
     */
    public boolean deregister(long userId, ConnectionSession session) {
        if (session == null) {
            return false;
        }
        return sessions.remove(userId, session);
    }

    public ConnectionSession lookup(long userId) {
        return sessions.get(userId);
    }

    public boolean isOnline(long userId) {
        return sessions.containsKey(userId);
    }

    /**
     * 某一时刻的快照，返回后不再随在线表变化。
     */
    public Set<Identity> listOnline() {
        List<ConnectionSession> snapshot = new ArrayList<>(sessions.values());
        Set<Identity> out = new LinkedHashSet<>(snapshot.size());
        for (ConnectionSession s : snapshot) {
            out.add(s.identity());
        }
        return out;
    }

    public int onlineCount() {
        return sessions.size();
    }
}
