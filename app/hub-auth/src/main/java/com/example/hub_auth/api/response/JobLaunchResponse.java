package com.example.hub_auth.api.response;

import com.example.hub_auth.model.JobLaunchRequest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobLaunchResponse(
    String hubUser,
    String projectUserName,
    String homeDirectory,
    Map<String, String> environment,
    String bricsProject,
    String runtime,
    String ngpus,
    String partition,
    String reservation) {

  public static JobLaunchResponse from(JobLaunchRequest request) {
    return new JobLaunchResponse(
        request.hubUser(),
        request.projectUserName(),
        request.homeDirectory(),
        request.environment(),
        request.options().bricsProject(),
        request.options().runtime(),
        request.options().ngpus(),
        request.options().partition(),
        request.options().reservation());
  }
}
