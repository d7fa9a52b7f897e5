package com.lusta.auth.web;

import com.lusta.auth.dto.LoginRequest;
import com.lusta.auth.dto.LoginResponse;
import com.lusta.auth.dto.RegisterRequest;
import com.lusta.auth.dto.RegisterResponse;
import com.lusta.auth.service.AuthService;
import com.lusta.common.api.Result;
import com.lusta.domain.dto.Identity;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 注册与登录。
 *
 * <p>登录拿到的 accessToken 同时用于 HTTP（Authorization: Bearer）与 WS 握手。</p>
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    public Result<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        // 重名：ConflictException -> 409 username_taken
        Identity identity = authService.register(request.username(), request.password());
        return Result.ok(new RegisterResponse(identity.userId(), identity.username()));
    }

    @PostMapping("/login")
    public Result<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        // 失败：AuthFailureException -> 401 invalid_username_or_password
        return Result.ok(authService.login(request));
    }
}
