package com.example.hub_auth.service;

import com.example.hub_auth.model.AuthorizationState;
import com.example.hub_auth.model.ProjectGrant;
import com.example.hub_auth.model.SpawnerState;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

// 永続化形式: {"version": 1, "brics_projects": {id: {name, username}}}
// version の無い旧形式は version 1 として読む
@Component
@RequiredArgsConstructor
public class SpawnerStateCodec {

  static final String VERSION_KEY = "version";
  static final String BRICS_PROJECTS_KEY = "brics_projects";
  static final int CURRENT_VERSION = 1;

  private static final TypeReference<LinkedHashMap<String, ProjectGrant>> GRANTS_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public Map<String, Object> save(SpawnerState state) {
    final SpawnerState source = state == null ? new SpawnerState(null) : state;
    final Map<String, Object> grants = new LinkedHashMap<>();
    source
        .bricsProjects()
        .projects()
        .forEach(
            (id, grant) -> {
              final Map<String, Object> value = new LinkedHashMap<>();
              value.put("name", grant.name());
              value.put("username", grant.username());
              grants.put(id, value);
            });
    final Map<String, Object> saved = new LinkedHashMap<>();
    saved.put(VERSION_KEY, CURRENT_VERSION);
    saved.put(BRICS_PROJECTS_KEY, grants);
    return saved;
  }

  public SpawnerState load(Map<String, ?> state) {
    if (state == null || state.isEmpty()) {
      return new SpawnerState(null);
    }
    final int version = resolveVersion(state.get(VERSION_KEY));
    if (version != CURRENT_VERSION) {
      throw new IllegalArgumentException("unsupported spawner state version: " + version);
    }
    final Object rawProjects = state.get(BRICS_PROJECTS_KEY);
    if (rawProjects == null) {
      return new SpawnerState(null);
    }
    final Map<String, ProjectGrant> grants = objectMapper.convertValue(rawProjects, GRANTS_TYPE);
    return new SpawnerState(new AuthorizationState(grants));
  }

  private int resolveVersion(Object rawVersion) {
    if (rawVersion == null) {
      // バージョン導入前の保存形式
      return CURRENT_VERSION;
    }
    if (rawVersion instanceof Number number) {
      return number.intValue();
    }
    throw new IllegalArgumentException("spawner state version must be a number");
  }
}
