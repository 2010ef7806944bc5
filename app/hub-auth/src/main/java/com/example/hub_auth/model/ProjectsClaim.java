/*
 * どこで: app/hub-auth/src/main/java/com/example/hub_auth/model/ProjectsClaim.java
 * 何を: id_token の projects claim を正規化した project ID -> ProjectRecord の対応
 * なぜ: claim の歴史的な形状差分を下流へ漏らさないため
 */
package com.example.hub_auth.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProjectsClaim(Map<String, ProjectRecord> projects) {

  public ProjectsClaim {
    // resources と同様に claim 内の順序を保持する
    projects =
        projects == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(projects));
  }

  public static ProjectsClaim empty() {
    return new ProjectsClaim(Map.of());
  }

  public boolean isEmpty() {
    return projects.isEmpty();
  }
}
