package com.example.hub_auth.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.hub_auth.model.HubSession;
import com.example.hub_auth.service.SessionService;
import jakarta.servlet.http.Cookie;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

class SessionCookieAuthenticationFilterTest {

  private final SessionService sessionService = mock(SessionService.class);
  private final SessionCookieAuthenticationFilter filter =
      new SessionCookieAuthenticationFilter(sessionService, "HUB_SESSION");

  @AfterEach
  void cleanup() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void liveSessionCookieBecomesAuthentication() throws Exception {
    final HubSession session = new HubSession("session-1", "alice", null);
    when(sessionService.findSession("session-1")).thenReturn(Optional.of(session));
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/me");
    request.setCookies(new Cookie("HUB_SESSION", "session-1"));
    final AtomicReference<Authentication> seen = new AtomicReference<>();

    filter.doFilter(
        request,
        new MockHttpServletResponse(),
        (req, res) -> seen.set(SecurityContextHolder.getContext().getAuthentication()));

    assertThat(seen.get()).isNotNull();
    assertThat(seen.get().isAuthenticated()).isTrue();
    assertThat(seen.get().getPrincipal()).isSameAs(session);
    assertThat(seen.get().getName()).isEqualTo("alice");
  }

  @Test
  void expiredSessionLeavesRequestUnauthenticated() throws Exception {
    when(sessionService.findSession("stale")).thenReturn(Optional.empty());
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/me");
    request.setCookies(new Cookie("HUB_SESSION", "stale"));
    final AtomicReference<Authentication> seen = new AtomicReference<>();

    filter.doFilter(
        request,
        new MockHttpServletResponse(),
        (req, res) -> seen.set(SecurityContextHolder.getContext().getAuthentication()));

    assertThat(seen.get()).isNull();
  }

  @Test
  void otherCookiesAreIgnored() throws Exception {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/me");
    request.setCookies(new Cookie("JSESSIONID", "abc"));

    filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> {});

    verifyNoInteractions(sessionService);
  }
}
