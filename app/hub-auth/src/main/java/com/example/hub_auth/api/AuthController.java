/*
 * どこで: app/hub-auth/src/main/java/com/example/hub_auth/api/AuthController.java
 * 何を: プロキシが付与した id_token でのログインと自分情報 API を提供
 * なぜ: 認証フローの入口をハブに集約し、以降は Cookie セッションで扱うため
 */
package com.example.hub_auth.api;

import com.example.hub_auth.api.response.MeResponse;
import com.example.hub_auth.api.response.ProjectResponse;
import com.example.hub_auth.config.SessionProperties;
import com.example.hub_auth.model.HubSession;
import com.example.hub_auth.model.HubUser;
import com.example.hub_auth.service.HubLoginService;
import com.example.hub_auth.service.HubMetrics;
import com.example.hub_auth.service.HubSessionResolver;
import com.example.hub_auth.service.SessionService;
import java.net.URI;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AuthController {

  static final String ID_TOKEN_HEADER = "X-Auth-Id-Token";

  private final HubLoginService hubLoginService;
  private final SessionService sessionService;
  private final HubSessionResolver hubSessionResolver;
  private final SessionProperties sessionProperties;
  private final HubMetrics hubMetrics;

  /**
   * 役割:
   * - X-Auth-Id-Token ヘッダの id_token を検証し、ハブセッションを発行する。
   *
   * 期待動作:
   * - 成功時は HttpOnly Cookie を設定して next (同一オリジンのパスのみ) へ 302。
   * - トークン不正は 401、platform に合う project が無ければ 403。
   */
  @GetMapping("/login")
  public ResponseEntity<Void> login(
      @RequestHeader(name = ID_TOKEN_HEADER, required = false) String idToken,
      @RequestParam(name = "next", required = false) String next) {
    final HubUser user = hubLoginService.login(idToken);
    final String sessionId = sessionService.createSession(user);
    final ResponseCookie cookie =
        ResponseCookie.from(sessionProperties.cookieName(), sessionId)
            .httpOnly(true)
            .secure(sessionProperties.secureCookie())
            .sameSite("Lax")
            .path("/")
            .maxAge(sessionProperties.ttl())
            .build();
    hubMetrics.recordLoginResult("success");
    return ResponseEntity.status(HttpStatus.FOUND)
        .header(HttpHeaders.SET_COOKIE, cookie.toString())
        .location(URI.create(redirectTarget(next)))
        .build();
  }

  @GetMapping("/v1/me")
  public ResponseEntity<MeResponse> me(Authentication authentication) {
    final HubSession session = hubSessionResolver.resolve(authentication);
    final List<ProjectResponse> projects =
        session.spawnerState().bricsProjects().projects().entrySet().stream()
            .map(
                entry ->
                    new ProjectResponse(
                        entry.getKey(), entry.getValue().name(), entry.getValue().username()))
            .toList();
    return ResponseEntity.ok(new MeResponse(session.userName(), projects));
  }

  private String redirectTarget(String next) {
    // オープンリダイレクト防止: "/" 始まりかつ "//" でないパスだけを許可する
    if (next == null
        || !next.startsWith("/")
        || next.startsWith("//")
        || next.contains("\\")) {
      return sessionProperties.defaultNextUrl();
    }
    return next;
  }
}
