package com.example.hub_auth.model;

import java.util.List;

public record OidcConfiguration(List<String> signingAlgorithms, String jwksUri) {

  public OidcConfiguration {
    signingAlgorithms = signingAlgorithms == null ? List.of() : List.copyOf(signingAlgorithms);
  }
}
