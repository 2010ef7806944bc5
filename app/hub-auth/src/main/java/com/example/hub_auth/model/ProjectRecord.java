package com.example.hub_auth.model;

import java.util.List;

public record ProjectRecord(String name, List<ProjectResource> resources) {

  public ProjectRecord {
    resources = resources == null ? List.of() : List.copyOf(resources);
  }
}
