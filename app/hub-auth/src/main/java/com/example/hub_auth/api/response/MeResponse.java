package com.example.hub_auth.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MeResponse(String userName, List<ProjectResponse> projects) {

  public MeResponse {
    projects = projects == null ? List.of() : List.copyOf(projects);
  }
}
