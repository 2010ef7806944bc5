package com.example.hub_auth.model;

import org.springframework.security.core.AuthenticatedPrincipal;

public record HubSession(String sessionId, String userName, SpawnerState spawnerState)
    implements AuthenticatedPrincipal {

  public HubSession {
    spawnerState = spawnerState == null ? new SpawnerState(null) : spawnerState;
  }

  @Override
  public String getName() {
    return userName;
  }
}
