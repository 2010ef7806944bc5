package com.example.hub_auth.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "oidc")
public record OidcClientProperties(
    String serverUrl,
    String discoveryPath,
    String audience,
    double leewaySeconds,
    String clientHeaderName,
    String clientHeaderValue,
    Duration connectTimeout,
    Duration readTimeout) {

  static final Duration MAX_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);

  public OidcClientProperties {
    // server-url は期待する iss とも完全一致させるため末尾スラッシュ等は加工しない
    serverUrl =
        serverUrl == null || serverUrl.isBlank()
            ? "https://keycloak.isambard.ac.uk/realms/isambard"
            : serverUrl;
    discoveryPath =
        discoveryPath == null || discoveryPath.isBlank()
            ? "/.well-known/openid-configuration"
            : discoveryPath;
    audience = audience == null || audience.isBlank() ? "zenith-jupyter" : audience;
    if (leewaySeconds < 0 || Double.isNaN(leewaySeconds)) {
      throw new IllegalArgumentException("oidc.leeway-seconds must be >= 0");
    }
    clientHeaderName =
        clientHeaderName == null || clientHeaderName.isBlank() ? "User-Agent" : clientHeaderName;
    clientHeaderValue =
        clientHeaderValue == null || clientHeaderValue.isBlank()
            ? "hub-auth-jwks-client"
            : clientHeaderValue;
    connectTimeout =
        requireTimeout("oidc.connect-timeout", connectTimeout, Duration.ofSeconds(5));
    readTimeout = requireTimeout("oidc.read-timeout", readTimeout, Duration.ofSeconds(10));
  }

  // HTTP クライアントはミリ秒を int で保持するため、その範囲に収まる値のみ受け付ける
  private static Duration requireTimeout(String name, Duration value, Duration defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    if (value.isNegative() || value.compareTo(MAX_TIMEOUT) > 0) {
      throw new IllegalArgumentException(name + " must be between 0 and " + MAX_TIMEOUT);
    }
    return value;
  }

  public String discoveryUrl() {
    final String base =
        serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
    return base + discoveryPath;
  }
}
