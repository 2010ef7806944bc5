package com.example.hub_auth.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "hub.session")
public record SessionProperties(
    String cookieName, Duration ttl, boolean secureCookie, String defaultNextUrl) {

  public SessionProperties {
    cookieName = cookieName == null || cookieName.isBlank() ? "HUB_SESSION" : cookieName;
    ttl = ttl == null || ttl.isNegative() || ttl.isZero() ? Duration.ofHours(1) : ttl;
    defaultNextUrl =
        defaultNextUrl == null || defaultNextUrl.isBlank() ? "/v1/me" : defaultNextUrl;
  }
}
