/*
 * どこで: Hub-Auth API
 * 何を: spawner オプションフォームの取得と送信 API を公開する
 * なぜ: フォーム値をハブ側で検証・クォートしてからスケジューラへ渡す境界を維持するため
 */
package com.example.hub_auth.api;

import com.example.hub_auth.api.response.JobLaunchResponse;
import com.example.hub_auth.api.response.SpawnOptionsFormResponse;
import com.example.hub_auth.model.HubSession;
import com.example.hub_auth.model.JobLaunchRequest;
import com.example.hub_auth.service.HubSessionResolver;
import com.example.hub_auth.service.JobLaunchService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/spawn")
@RequiredArgsConstructor
public class SpawnController {

  static final List<String> FORM_FIELDS =
      List.of("brics_project", "runtime", "ngpus", "partition", "reservation");
  private static final String CSRF_PARAMETER = "_csrf";

  private final HubSessionResolver hubSessionResolver;
  private final JobLaunchService jobLaunchService;

  @GetMapping("/options")
  public ResponseEntity<SpawnOptionsFormResponse> options(Authentication authentication) {
    final HubSession session = hubSessionResolver.resolve(authentication);
    final List<SpawnOptionsFormResponse.ProjectOption> projects =
        session.spawnerState().bricsProjects().projects().entrySet().stream()
            .map(
                entry ->
                    new SpawnOptionsFormResponse.ProjectOption(
                        entry.getKey(), entry.getValue().name()))
            .toList();
    return ResponseEntity.ok(new SpawnOptionsFormResponse(projects, FORM_FIELDS));
  }

  @PostMapping
  public ResponseEntity<JobLaunchResponse> spawn(
      @RequestParam MultiValueMap<String, String> form, Authentication authentication) {
    final HubSession session = hubSessionResolver.resolve(authentication);
    final Map<String, List<String>> formData = new LinkedHashMap<>(form);
    // CSRF トークンはフォーム項目ではない
    formData.remove(CSRF_PARAMETER);
    final JobLaunchRequest request = jobLaunchService.prepareLaunch(session, formData);
    return ResponseEntity.ok(JobLaunchResponse.from(request));
  }
}
