package com.example.hub_auth.api;

import com.example.hub_auth.service.HubMetrics;
import com.example.hub_auth.service.InvalidSessionException;
import com.example.hub_auth.service.OidcIntegrationException;
import com.example.hub_auth.service.ProjectAccessDeniedException;
import com.example.hub_auth.service.SpawnOptionsValidationException;
import com.example.hub_auth.service.TokenAuthenticationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class HubApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(HubApiExceptionHandler.class);

  private final HubMetrics hubMetrics;

  @ExceptionHandler(TokenAuthenticationException.class)
  public ResponseEntity<ApiErrorResponse> handleTokenAuthentication(
      TokenAuthenticationException ex) {
    hubMetrics.recordLoginResult("unauthorized");
    return error(HttpStatus.UNAUTHORIZED, "AUTH_INVALID_TOKEN", ex.getMessage());
  }

  @ExceptionHandler(ProjectAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleProjectAccessDenied(
      ProjectAccessDeniedException ex) {
    hubMetrics.recordLoginResult("forbidden");
    return error(HttpStatus.FORBIDDEN, "NO_PLATFORM_PROJECTS", ex.getMessage());
  }

  @ExceptionHandler(OidcIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleOidcIntegration(OidcIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case DISCOVERY_FAILED -> "OIDC_DISCOVERY_FAILED";
          case INVALID_DISCOVERY_DOCUMENT -> "OIDC_INVALID_DISCOVERY_DOCUMENT";
          case JWKS_FETCH_FAILED -> "OIDC_JWKS_FETCH_FAILED";
          case INVALID_JWKS -> "OIDC_INVALID_JWKS";
        };
    logger.error("oidc provider integration failed code={} message={}", code, ex.getMessage());
    hubMetrics.recordLoginResult("error");
    return error(HttpStatus.INTERNAL_SERVER_ERROR, code, ex.getMessage());
  }

  @ExceptionHandler(SpawnOptionsValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleSpawnOptionsValidation(
      SpawnOptionsValidationException ex) {
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "SPAWN_OPTIONS_INVALID", ex.getMessage());
  }

  @ExceptionHandler(InvalidSessionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidSession(InvalidSessionException ex) {
    return error(HttpStatus.UNAUTHORIZED, "SESSION_INVALID", ex.getMessage());
  }

  private ResponseEntity<ApiErrorResponse> error(HttpStatus status, String code, String message) {
    hubMetrics.recordError(code);
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}
