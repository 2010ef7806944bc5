package com.example.hub_auth.model;

public record HubUser(String name, AuthorizationState authorizationState) {

  public HubUser {
    authorizationState =
        authorizationState == null ? AuthorizationState.empty() : authorizationState;
  }
}
