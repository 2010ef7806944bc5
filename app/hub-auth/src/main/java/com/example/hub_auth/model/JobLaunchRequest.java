package com.example.hub_auth.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record JobLaunchRequest(
    String hubUser,
    String projectUserName,
    String homeDirectory,
    Map<String, String> environment,
    SpawnOptions options) {

  public JobLaunchRequest {
    environment =
        environment == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
  }
}
