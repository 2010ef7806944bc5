/*
 * どこで: Hub-Auth API DTO
 * 何を: spawner オプションフォームの描画に必要な project 一覧と入力項目を定義する
 * なぜ: フォームの選択肢を認可状態から導出し、クライアントに project 名を直接持たせないため
 */
package com.example.hub_auth.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SpawnOptionsFormResponse(List<ProjectOption> projects, List<String> fields) {

  public SpawnOptionsFormResponse {
    projects = projects == null ? List.of() : List.copyOf(projects);
    fields = fields == null ? List.of() : List.copyOf(fields);
  }

  public record ProjectOption(String id, String name) {}
}
