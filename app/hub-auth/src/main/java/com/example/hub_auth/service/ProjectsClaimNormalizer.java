package com.example.hub_auth.service;

import com.example.hub_auth.model.OidcClaims;
import com.example.hub_auth.model.ProjectRecord;
import com.example.hub_auth.model.ProjectResource;
import com.example.hub_auth.model.ProjectsClaim;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProjectsClaimNormalizer {

  private static final Logger logger = LoggerFactory.getLogger(ProjectsClaimNormalizer.class);

  private final ObjectMapper objectMapper;

  /**
   * 役割:
   * - projects claim (object または JSON 文字列) を ProjectsClaim へ正規化する。
   *
   * 期待動作:
   * - object 以外や不正な JSON はログを出して空の claim にする。
   * - object でない project は resource 無しで残し、username の無い resource は捨てる。
   */
  public ProjectsClaim normalize(OidcClaims claims) {
    if (claims == null) {
      return ProjectsClaim.empty();
    }
    Object projects = claims.projects();
    if (projects == null) {
      return ProjectsClaim.empty();
    }
    logger.debug("projects claim is of type {}", projects.getClass().getSimpleName());
    if (projects instanceof String encoded) {
      try {
        projects =
            objectMapper
                .readerFor(Object.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .readValue(encoded);
      } catch (JsonProcessingException ex) {
        logger.warn("Invalid projects format: could not decode JSON");
        return ProjectsClaim.empty();
      }
    }
    if (!(projects instanceof Map<?, ?> entries)) {
      logger.warn("Invalid projects format: expected an object but got {}", typeName(projects));
      return ProjectsClaim.empty();
    }

    final Map<String, ProjectRecord> normalized = new LinkedHashMap<>();
    entries.forEach((id, value) -> normalized.put(String.valueOf(id), toProjectRecord(id, value)));
    return new ProjectsClaim(normalized);
  }

  private ProjectRecord toProjectRecord(Object id, Object value) {
    if (!(value instanceof Map<?, ?> project)) {
      logger.warn("Unexpected project format for {}: {}", id, typeName(value));
      return new ProjectRecord(null, List.of());
    }
    final String name = project.get("name") instanceof String projectName ? projectName : null;
    final List<ProjectResource> resources = new ArrayList<>();
    if (project.get("resources") instanceof List<?> rawResources) {
      for (Object rawResource : rawResources) {
        if (rawResource instanceof Map<?, ?> resource
            && resource.get("name") instanceof String resourceName
            && resource.get("username") instanceof String username) {
          resources.add(new ProjectResource(resourceName, username));
        }
      }
    }
    return new ProjectRecord(name, resources);
  }

  private String typeName(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
