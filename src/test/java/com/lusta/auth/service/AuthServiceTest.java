package com.lusta.auth.service;

import com.lusta.auth.config.AuthProperties;
import com.lusta.auth.dto.LoginRequest;
import com.lusta.auth.dto.LoginResponse;
import com.lusta.common.api.AuthFailureException;
import com.lusta.common.api.ConflictException;
import com.lusta.domain.dto.Identity;
import com.lusta.domain.store.InMemoryMessageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthServiceTest {

    private InMemoryMessageStore store;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        store = new InMemoryMessageStore();
        AuthProperties props = new AuthProperties("lusta-test", "test-secret-test-secret-test-secret-0123456789", 600);
        // cost 4：测试里 BCrypt 不需要默认强度
        authService = new AuthService(store, new JwtService(props), new BCryptPasswordEncoder(4), props);
    }

    @Test
    void register_thenVerify() {
        Identity registered = authService.register("alice", "pw-1");

        assertThat(authService.verify("alice", "pw-1")).isEqualTo(registered);
        assertThat(store.findUserByUsername("alice").getPasswordHash()).isNotEqualTo("pw-1");
    }

    @Test
    void duplicateRegistration_isRejectedAndKeepsOriginalCredentials() {
        authService.register("alice", "original");

        assertThatThrownBy(() -> authService.register("alice", "hijack"))
                .isInstanceOf(ConflictException.class)
                .hasMessage("username_taken");

        assertThat(authService.verify("alice", "original").username()).isEqualTo("alice");
        assertThatThrownBy(() -> authService.verify("alice", "hijack"))
                .isInstanceOf(AuthFailureException.class);
        assertThat(store.listUsers()).hasSize(1);
    }

    @Test
    void usernamesAreCaseSensitive() {
        authService.register("alice", "pw");
        Identity upper = authService.register("Alice", "pw");

        assertThat(upper.username()).isEqualTo("Alice");
        assertThat(store.listUsers()).hasSize(2);
    }

    @Test
    void verify_unknownUserAndWrongPasswordLookTheSame() {
        authService.register("alice", "pw");

        assertThatThrownBy(() -> authService.verify("nobody", "pw"))
                .isInstanceOf(AuthFailureException.class)
                .hasMessage("invalid_username_or_password");
        assertThatThrownBy(() -> authService.verify("alice", "wrong"))
                .isInstanceOf(AuthFailureException.class)
                .hasMessage("invalid_username_or_password");
    }

    @Test
    void login_issuesTokenThatResolvesBackToIdentity() {
        Identity alice = authService.register("alice", "pw");

        LoginResponse resp = authService.login(new LoginRequest("alice", "pw"));

        assertThat(resp.userId()).isEqualTo(alice.userId());
        assertThat(resp.accessTokenExpiresInSeconds()).isEqualTo(600);
        assertThat(authService.verifyAccessToken(resp.accessToken())).isEqualTo(alice);
    }

    @Test
    void verifyAccessToken_missingOrGarbage() {
        assertThatThrownBy(() -> authService.verifyAccessToken(null))
                .isInstanceOf(AuthFailureException.class)
                .hasMessage("missing_access_token");
        assertThatThrownBy(() -> authService.verifyAccessToken("not-a-jwt"))
                .isInstanceOf(AuthFailureException.class)
                .hasMessage("invalid_access_token");
    }
}
