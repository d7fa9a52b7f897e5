package com.lusta.domain.controller;

import com.lusta.auth.web.AuthContext;
import com.lusta.common.api.Result;
import com.lusta.domain.dto.Identity;
import com.lusta.domain.dto.OnlineUsersDto;
import com.lusta.domain.dto.UserBasicDto;
import com.lusta.domain.entity.UserEntity;
import com.lusta.domain.store.MessageStore;
import com.lusta.gateway.session.PresenceRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 用户目录与在线列表。
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/users")
public class UserController {

    private final MessageStore messageStore;
    private final PresenceRegistry presenceRegistry;

    /**
     * 全部注册用户，按 id 升序。
     */
    @GetMapping
    public Result<List<UserBasicDto>> list() {
        AuthContext.requireUserId();
        List<UserEntity> users = messageStore.listUsers();
        List<UserBasicDto> out = new ArrayList<>(users.size());
        for (UserEntity u : users) {
            out.add(new UserBasicDto(u.getId(), u.getUsername()));
        }
        return Result.ok(out);
    }

    /**
     * 在线快照，内容与 WS get_online_users 一致。
     */
    @GetMapping("/online")
    public Result<OnlineUsersDto> online() {
        AuthContext.requireUserId();
        List<String> users = new ArrayList<>();
        for (Identity identity : presenceRegistry.listOnline()) {
            users.add(identity.username());
        }
        Collections.sort(users);
        return Result.ok(new OnlineUsersDto(users, users.size()));
    }
}
