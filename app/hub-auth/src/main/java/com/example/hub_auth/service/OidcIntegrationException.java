package com.example.hub_auth.service;

public class OidcIntegrationException extends RuntimeException {

  public enum Reason {
    DISCOVERY_FAILED,
    INVALID_DISCOVERY_DOCUMENT,
    JWKS_FETCH_FAILED,
    INVALID_JWKS
  }

  private final Reason reason;

  public OidcIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public OidcIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
