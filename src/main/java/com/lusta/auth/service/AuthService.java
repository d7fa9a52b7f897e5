package com.lusta.auth.service;

import com.lusta.auth.config.AuthProperties;
import com.lusta.auth.dto.LoginRequest;
import com.lusta.auth.dto.LoginResponse;
import com.lusta.common.api.AuthFailureException;
import com.lusta.common.api.ConflictException;
import com.lusta.domain.dto.Identity;
import com.lusta.domain.entity.UserEntity;
import com.lusta.domain.store.MessageStore;
import io.jsonwebtoken.JwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * 身份与凭证：注册、校验用户名密码、签发与解析 accessToken。
 */
@Slf4j
@Service
public class AuthService {

    private final MessageStore messageStore;
    private final JwtService jwtService;
    private final PasswordEncoder passwordEncoder;
    private final AuthProperties props;

    public AuthService(MessageStore messageStore,
                       JwtService jwtService,
                       PasswordEncoder passwordEncoder,
                       AuthProperties props) {
        this.messageStore = messageStore;
        this.jwtService = jwtService;
        this.passwordEncoder = passwordEncoder;
        this.props = props;
    }

    /**
     * 注册：用户名必须未被占用；重名直接拒绝，不会覆盖已有用户的密码。
     *
     * <p>先查再插只是快速失败；并发注册同名时以 uk_username 为准，DuplicateKeyException 同样翻译为冲突。</p>
     */
    public Identity register(String username, String password) {
        if (messageStore.findUserByUsername(username) != null) {
            throw new ConflictException("username_taken");
        }
        UserEntity user;
        try {
            user = messageStore.createUser(username, passwordEncoder.encode(password));
        } catch (DuplicateKeyException e) {
            throw new ConflictException("username_taken", e);
        }
        log.info("user registered: userId={}, username={}", user.getId(), user.getUsername());
        return new Identity(user.getId(), user.getUsername());
    }

    /**
     * 校验用户名密码，成功返回身份。用户不存在与密码错误返回同一个错误，避免枚举用户名。
     */
    public Identity verify(String username, String password) {
        UserEntity user = messageStore.findUserByUsername(username);
        if (user == null
                || user.getPasswordHash() == null
                || !passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new AuthFailureException("invalid_username_or_password");
        }
        return new Identity(user.getId(), user.getUsername());
    }

    public LoginResponse login(LoginRequest request) {
        Identity identity = verify(request.username(), request.password());
        String accessToken = jwtService.issueAccessToken(identity);
        return new LoginResponse(
                identity.userId(),
                identity.username(),
                accessToken,
                props.accessTokenTtlSeconds()
        );
    }

    /**
     * 解析连接/请求携带的 accessToken。
     *
     * @throws AuthFailureException token 缺失、签名错误、过期或缺少身份声明
     */
    public Identity verifyAccessToken(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthFailureException("missing_access_token");
        }
        try {
            return jwtService.getIdentity(jwtService.parseAccessToken(token).getPayload());
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthFailureException("invalid_access_token", e);
        }
    }
}
