package com.example.hub_auth.service;

import com.example.hub_auth.config.OidcClientProperties;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jwt.SignedJWT;
import java.net.URI;
import java.text.ParseException;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

// トークンヘッダの kid で JWKS から署名鍵を選ぶ。キャッシュしない。
@Service
@RequiredArgsConstructor
public class JwksSigningKeyResolver implements SigningKeyResolver {

  private static final Logger logger = LoggerFactory.getLogger(JwksSigningKeyResolver.class);

  private final RestClient oidcRestClient;
  private final OidcClientProperties properties;

  @Override
  public JWK resolve(String jwksUri, String token) {
    if (jwksUri == null || jwksUri.isBlank()) {
      throw new IllegalArgumentException("jwksUri is required");
    }
    final String keyId = readKeyId(token);
    final List<JWK> signingKeys =
        fetchKeySet(jwksUri).getKeys().stream().filter(this::isSigningKey).toList();
    if (signingKeys.isEmpty()) {
      throw new TokenAuthenticationException(
          "The JWKS endpoint did not contain any signing keys");
    }
    return signingKeys.stream()
        .filter(key -> Objects.equals(key.getKeyID(), keyId))
        .findFirst()
        .orElseThrow(
            () ->
                new TokenAuthenticationException(
                    "Unable to find a signing key that matches: \"" + keyId + "\""));
  }

  private String readKeyId(String token) {
    if (token == null || token.isBlank()) {
      throw new TokenAuthenticationException("Invalid JWT token: token is empty");
    }
    try {
      final JWSHeader header = SignedJWT.parse(token).getHeader();
      return header.getKeyID();
    } catch (ParseException ex) {
      throw new TokenAuthenticationException("Invalid JWT token: Invalid token header", ex);
    }
  }

  private JWKSet fetchKeySet(String jwksUri) {
    final String body;
    try {
      body =
          oidcRestClient
              .get()
              .uri(URI.create(jwksUri))
              .header(properties.clientHeaderName(), properties.clientHeaderValue())
              .retrieve()
              .body(String.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "jwks fetch failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.JWKS_FETCH_FAILED, "jwks request failed", ex);
    } catch (ResourceAccessException ex) {
      logger.warn("jwks fetch connection failed", ex);
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.JWKS_FETCH_FAILED, "jwks connection failed", ex);
    }
    if (body == null || body.isBlank()) {
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.INVALID_JWKS, "jwks response is empty");
    }
    try {
      return JWKSet.parse(body);
    } catch (ParseException ex) {
      logger.warn("jwks response parse failed: {}", ex.getMessage());
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.INVALID_JWKS, "jwks response parse failed", ex);
    }
  }

  private boolean isSigningKey(JWK key) {
    return key.getKeyUse() == null || KeyUse.SIGNATURE.equals(key.getKeyUse());
  }
}
