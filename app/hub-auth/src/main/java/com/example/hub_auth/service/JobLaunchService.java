package com.example.hub_auth.service;

import com.example.hub_auth.config.BricsPlatformProperties;
import com.example.hub_auth.model.AuthorizationState;
import com.example.hub_auth.model.HubSession;
import com.example.hub_auth.model.JobLaunchRequest;
import com.example.hub_auth.model.ProjectGrant;
import com.example.hub_auth.model.SpawnOptions;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobLaunchService {

  private static final Logger logger = LoggerFactory.getLogger(JobLaunchService.class);

  private final SpawnOptionsValidator spawnOptionsValidator;
  private final BricsPlatformProperties properties;
  private final HubMetrics hubMetrics;

  public JobLaunchRequest prepareLaunch(HubSession session, Map<String, List<String>> formData) {
    if (session == null) {
      throw new InvalidSessionException("hub session is required");
    }
    final AuthorizationState projects = session.spawnerState().bricsProjects();
    final SpawnOptions options;
    try {
      options = spawnOptionsValidator.validateAndSanitize(formData, projects.projectIds());
    } catch (SpawnOptionsValidationException ex) {
      logger.warn("spawn options rejected user={} reason={}", session.userName(), ex.reason());
      hubMetrics.recordSpawnOptionsResult("rejected");
      throw ex;
    }
    hubMetrics.recordSpawnOptionsResult("accepted");

    // 検証済みの project ID はクォート不要な文字だけで構成される
    final ProjectGrant grant =
        projects
            .find(options.bricsProject())
            .orElseThrow(() -> new SpawnOptionsValidationException("unknown brics_project"));
    final String homeDirectory = homeDirectory(options.bricsProject(), grant.username());

    final Map<String, String> environment = new LinkedHashMap<>();
    environment.put("USER", grant.username());
    environment.put("HOME", homeDirectory);
    environment.put("SHELL", properties.loginShell());

    return new JobLaunchRequest(
        session.userName(), grant.username(), homeDirectory, environment, options);
  }

  private String homeDirectory(String projectId, String projectUserName) {
    final int dot = projectId.indexOf('.');
    final String shortProject = dot < 0 ? projectId : projectId.substring(0, dot);
    return properties.homeRoot() + "/" + shortProject + "/" + projectUserName;
  }
}
