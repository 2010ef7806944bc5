package com.example.hub_auth.model;

public record SpawnerState(AuthorizationState bricsProjects) {

  public SpawnerState {
    bricsProjects = bricsProjects == null ? AuthorizationState.empty() : bricsProjects;
  }

  // auth state 無しは空の project 集合として扱う
  public static SpawnerState fromAuthState(AuthorizationState authState) {
    return new SpawnerState(authState);
  }
}
