package com.lusta.domain.controller;

import com.lusta.common.api.Result;
import com.lusta.gateway.session.PresenceRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 存活探测，无需登录。
 */
@RequiredArgsConstructor
@RestController
public class StatusController {

    public record StatusDto(String name, String status, int online) {
    }

    private final PresenceRegistry presenceRegistry;

    @Value("${spring.application.name:lusta-messenger}")
    private String appName;

    @GetMapping("/")
    public Result<StatusDto> status() {
        return Result.ok(new StatusDto(appName, "running", presenceRegistry.onlineCount()));
    }
}
