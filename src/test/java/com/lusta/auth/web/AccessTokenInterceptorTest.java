package com.lusta.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lusta.auth.service.AuthService;
import com.lusta.common.api.AuthFailureException;
import com.lusta.domain.dto.Identity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccessTokenInterceptorTest {

    private final AuthService authService = mock(AuthService.class);
    private final AccessTokenInterceptor interceptor = new AccessTokenInterceptor(authService, new ObjectMapper());

    @AfterEach
    void tearDown() {
        AuthContext.clear();
    }

    @Test
    void validBearer_bindsCallerUntilCompletion() {
        when(authService.verifyAccessToken("good")).thenReturn(new Identity(7L, "alice"));
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/chats");
        req.addHeader("Authorization", "Bearer good");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(req, resp, new Object())).isTrue();
        assertThat(AuthContext.requireUserId()).isEqualTo(7L);

        interceptor.afterCompletion(req, resp, new Object(), null);
        assertThatThrownBy(AuthContext::requireUserId).isInstanceOf(AuthFailureException.class);
    }

    @Test
    void noHeader_passesThroughWithoutCaller() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/");

        assertThat(interceptor.preHandle(req, new MockHttpServletResponse(), new Object())).isTrue();
        assertThatThrownBy(AuthContext::requireUserId).isInstanceOf(AuthFailureException.class);
    }

    @Test
    void invalidBearer_rejectedWith401Envelope() throws Exception {
        when(authService.verifyAccessToken("bad")).thenThrow(new AuthFailureException("invalid_access_token"));
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/chats");
        req.addHeader("Authorization", "Bearer bad");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(req, resp, new Object())).isFalse();
        assertThat(resp.getStatus()).isEqualTo(401);
        assertThat(resp.getContentAsString()).contains("\"ok\":false").contains("unauthorized");
    }
}
