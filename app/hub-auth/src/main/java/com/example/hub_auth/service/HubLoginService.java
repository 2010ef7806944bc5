package com.example.hub_auth.service;

import com.example.hub_auth.config.BricsPlatformProperties;
import com.example.hub_auth.config.OidcClientProperties;
import com.example.hub_auth.model.AuthorizationState;
import com.example.hub_auth.model.HubUser;
import com.example.hub_auth.model.OidcClaims;
import com.example.hub_auth.model.OidcConfiguration;
import com.example.hub_auth.model.ProjectsClaim;
import com.nimbusds.jose.jwk.JWK;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class HubLoginService {

  private static final Logger logger = LoggerFactory.getLogger(HubLoginService.class);

  private final OidcDiscoveryClient discoveryClient;
  private final SigningKeyResolver signingKeyResolver;
  private final OidcTokenVerifier tokenVerifier;
  private final ProjectsClaimNormalizer projectsClaimNormalizer;
  private final PlatformProjectFilter platformProjectFilter;
  private final OidcClientProperties oidcProperties;
  private final BricsPlatformProperties platformProperties;

  public HubUser login(String idToken) {
    if (idToken == null || idToken.isBlank()) {
      throw new TokenAuthenticationException("Missing X-Auth-Id-Token header");
    }

    final OidcConfiguration configuration = discoveryClient.fetch(oidcProperties.discoveryUrl());
    final JWK signingKey = signingKeyResolver.resolve(configuration.jwksUri(), idToken);
    final OidcClaims claims =
        tokenVerifier.verify(
            idToken,
            signingKey,
            configuration.signingAlgorithms(),
            oidcProperties.audience(),
            oidcProperties.serverUrl(),
            oidcProperties.leewaySeconds());
    final ProjectsClaim projects = projectsClaimNormalizer.normalize(claims);

    final String userName = claims.shortName();
    if (userName == null || userName.isBlank()) {
      throw new TokenAuthenticationException("Invalid token: Missing short_name claim");
    }

    final AuthorizationState state =
        platformProjectFilter.deriveAuthorizationState(projects, platformProperties.platform());
    if (state.isEmpty()) {
      logger.warn(
          "login rejected: no projects for platform={} user={}",
          platformProperties.platform(),
          userName);
      throw new ProjectAccessDeniedException("No projects with valid platform");
    }
    logger.info("login accepted user={} projects={}", userName, state.projectIds().size());
    return new HubUser(userName, state);
  }
}
