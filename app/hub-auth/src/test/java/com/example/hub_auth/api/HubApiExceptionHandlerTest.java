/*
 * どこで: Hub-Auth API 層テスト
 * 何を: 例外ハンドラのステータス・エラーコード・メトリクス記録を検証する
 * なぜ: 401/403/500 の契約とエラー種別カウントが欠落しないことを保証するため
 */
package com.example.hub_auth.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.example.hub_auth.service.HubMetrics;
import com.example.hub_auth.service.OidcIntegrationException;
import com.example.hub_auth.service.ProjectAccessDeniedException;
import com.example.hub_auth.service.SpawnOptionsValidationException;
import com.example.hub_auth.service.TokenAuthenticationException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class HubApiExceptionHandlerTest {

  private final HubMetrics metrics = Mockito.mock(HubMetrics.class);
  private final HubApiExceptionHandler handler = new HubApiExceptionHandler(metrics);

  @Test
  void tokenFailureIsUnauthorizedAndCounted() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleTokenAuthentication(
            new TokenAuthenticationException("Invalid JWT token: Invalid issuer"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse("AUTH_INVALID_TOKEN", "Invalid JWT token: Invalid issuer"));
    verify(metrics).recordLoginResult("unauthorized");
    verify(metrics).recordError("AUTH_INVALID_TOKEN");
  }

  @Test
  void projectDenialIsForbidden() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleProjectAccessDenied(
            new ProjectAccessDeniedException("No projects with valid platform"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    verify(metrics).recordLoginResult("forbidden");
    verify(metrics).recordError("NO_PLATFORM_PROJECTS");
  }

  @Test
  void providerFailuresMapToReasonSpecificCodes() {
    handler.handleOidcIntegration(
        new OidcIntegrationException(
            OidcIntegrationException.Reason.JWKS_FETCH_FAILED, "jwks request failed"));
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleOidcIntegration(
            new OidcIntegrationException(
                OidcIntegrationException.Reason.INVALID_DISCOVERY_DOCUMENT,
                "oidc discovery document is invalid"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo("OIDC_INVALID_DISCOVERY_DOCUMENT");
    verify(metrics).recordError("OIDC_JWKS_FETCH_FAILED");
    verify(metrics).recordError("OIDC_INVALID_DISCOVERY_DOCUMENT");
  }

  @Test
  void spawnValidationFailureKeepsPrefixedMessage() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleSpawnOptionsValidation(
            new SpawnOptionsValidationException("runtime not valid"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().message())
        .isEqualTo("Invalid spawner options input: runtime not valid");
    verify(metrics).recordError("SPAWN_OPTIONS_INVALID");
  }
}
