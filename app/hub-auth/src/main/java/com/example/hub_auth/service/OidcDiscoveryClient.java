package com.example.hub_auth.service;

import com.example.hub_auth.model.OidcConfiguration;
import com.example.hub_auth.service.dto.OidcDiscoveryDocument;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class OidcDiscoveryClient {

  private static final Logger logger = LoggerFactory.getLogger(OidcDiscoveryClient.class);

  private final RestClient oidcRestClient;

  public OidcConfiguration fetch(String discoveryUrl) {
    if (discoveryUrl == null || discoveryUrl.isBlank()) {
      throw new IllegalArgumentException("discoveryUrl is required");
    }
    final OidcDiscoveryDocument document = callDiscovery(discoveryUrl);
    if (document.signingAlgorithms() == null
        || document.signingAlgorithms().isEmpty()
        || document.jwksUri() == null
        || document.jwksUri().isBlank()) {
      logger.warn("oidc discovery document is missing signing algorithms or jwks_uri");
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.INVALID_DISCOVERY_DOCUMENT,
          "oidc discovery document is invalid");
    }
    return new OidcConfiguration(document.signingAlgorithms(), document.jwksUri());
  }

  private OidcDiscoveryDocument callDiscovery(String discoveryUrl) {
    try {
      logger.debug("requesting oidc configuration from {}", discoveryUrl);
      final OidcDiscoveryDocument document =
          oidcRestClient
              .get()
              .uri(URI.create(discoveryUrl))
              .retrieve()
              .body(OidcDiscoveryDocument.class);
      if (document == null) {
        logger.warn("oidc discovery returned empty body");
        throw new OidcIntegrationException(
            OidcIntegrationException.Reason.INVALID_DISCOVERY_DOCUMENT,
            "oidc discovery response is empty");
      }
      return document;
    } catch (RestClientResponseException ex) {
      logger.warn(
          "oidc discovery failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.DISCOVERY_FAILED, "oidc discovery request failed", ex);
    } catch (ResourceAccessException ex) {
      logger.warn("oidc discovery connection failed", ex);
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.DISCOVERY_FAILED, "oidc discovery connection failed", ex);
    } catch (OidcIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("oidc discovery response parse failed", ex);
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.INVALID_DISCOVERY_DOCUMENT,
          "oidc discovery response parse failed",
          ex);
    }
  }
}
