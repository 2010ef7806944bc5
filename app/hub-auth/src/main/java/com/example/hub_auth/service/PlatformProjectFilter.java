package com.example.hub_auth.service;

import com.example.hub_auth.model.AuthorizationState;
import com.example.hub_auth.model.ProjectGrant;
import com.example.hub_auth.model.ProjectRecord;
import com.example.hub_auth.model.ProjectResource;
import com.example.hub_auth.model.ProjectsClaim;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

// projects claim を現在の platform で使える project だけに絞り込む。
@Component
public class PlatformProjectFilter {

  /**
   * 役割:
   * - projects claim から platform 上で使える project だけを抜き出す。
   *
   * 期待動作:
   * - project ごとに claim 順で最初に platform 名と一致した resource を採用する。
   * - 結果が空でも例外にしない (403 判定は呼び出し側)。
   */
  public AuthorizationState deriveAuthorizationState(ProjectsClaim projects, String platform) {
    if (projects == null || platform == null) {
      return AuthorizationState.empty();
    }
    final Map<String, ProjectGrant> grants = new LinkedHashMap<>();
    for (Map.Entry<String, ProjectRecord> entry : projects.projects().entrySet()) {
      final ProjectRecord project = entry.getValue();
      for (ProjectResource resource : project.resources()) {
        if (platform.equals(resource.name())) {
          grants.put(
              entry.getKey(),
              new ProjectGrant(displayName(entry.getKey(), project), resource.username()));
          break;
        }
      }
    }
    return new AuthorizationState(grants);
  }

  private String displayName(String projectId, ProjectRecord project) {
    return project.name() == null ? projectId : project.name();
  }
}
