/*
 * どこで: app/hub-auth/src/main/java/com/example/hub_auth/model/AuthorizationState.java
 * 何を: 現在の platform で利用可能な project だけを保持する認可状態
 * なぜ: ログイン時に一度だけ確定させ、spawn 時は読み取り専用で参照するため
 */
package com.example.hub_auth.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public record AuthorizationState(Map<String, ProjectGrant> projects) {

  public AuthorizationState {
    projects =
        projects == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(projects));
  }

  public static AuthorizationState empty() {
    return new AuthorizationState(Map.of());
  }

  public boolean isEmpty() {
    return projects.isEmpty();
  }

  public Set<String> projectIds() {
    return projects.keySet();
  }

  public Optional<ProjectGrant> find(String projectId) {
    return Optional.ofNullable(projects.get(projectId));
  }
}
