package com.example.hub_auth.config;

import com.example.hub_auth.model.HubSession;
import com.example.hub_auth.service.SessionService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

// ハブセッション Cookie を SecurityContext の認証情報へ変換する。
public class SessionCookieAuthenticationFilter extends OncePerRequestFilter {

  private final SessionService sessionService;
  private final String cookieName;

  public SessionCookieAuthenticationFilter(SessionService sessionService, String cookieName) {
    this.sessionService = sessionService;
    this.cookieName = cookieName;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final Optional<HubSession> session =
        resolveSessionId(request).flatMap(sessionService::findSession);
    if (session.isPresent()) {
      final SecurityContext context = SecurityContextHolder.createEmptyContext();
      context.setAuthentication(
          UsernamePasswordAuthenticationToken.authenticated(session.get(), null, List.of()));
      SecurityContextHolder.setContext(context);
    }
    filterChain.doFilter(request, response);
  }

  private Optional<String> resolveSessionId(HttpServletRequest request) {
    final Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return Optional.empty();
    }
    for (Cookie cookie : cookies) {
      if (cookieName.equals(cookie.getName())
          && cookie.getValue() != null
          && !cookie.getValue().isBlank()) {
        return Optional.of(cookie.getValue());
      }
    }
    return Optional.empty();
  }
}
