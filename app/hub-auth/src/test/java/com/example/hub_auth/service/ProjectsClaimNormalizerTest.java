package com.example.hub_auth.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.hub_auth.model.OidcClaims;
import com.example.hub_auth.model.ProjectRecord;
import com.example.hub_auth.model.ProjectResource;
import com.example.hub_auth.model.ProjectsClaim;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProjectsClaimNormalizerTest {

  private final ProjectsClaimNormalizer normalizer =
      new ProjectsClaimNormalizer(new ObjectMapper());

  @Test
  void objectClaimIsConvertedInClaimOrder() {
    final Map<String, Object> projects = new LinkedHashMap<>();
    projects.put("project2", project("Project 2", resource("brics.aip1.notebooks.shared", "u2")));
    projects.put("project1", project("Project 1", resource("brics.other", "u1")));

    final ProjectsClaim claim = normalizer.normalize(claims(projects));

    assertThat(claim.projects().keySet()).containsExactly("project2", "project1");
    assertThat(claim.projects().get("project2"))
        .isEqualTo(
            new ProjectRecord(
                "Project 2", List.of(new ProjectResource("brics.aip1.notebooks.shared", "u2"))));
  }

  @Test
  void jsonEncodedClaimDecodesToSameResultAsObject() {
    final String encoded =
        """
        {"project1": {"name": "Project 1",
                      "resources": [{"name": "brics.aip1.notebooks.shared", "username": "u1"}]}}
        """;
    final Map<String, Object> decoded =
        Map.of("project1", project("Project 1", resource("brics.aip1.notebooks.shared", "u1")));

    assertThat(normalizer.normalize(claims(encoded)))
        .isEqualTo(normalizer.normalize(claims(decoded)));
  }

  @Test
  void invalidJsonStringDegradesToEmpty() {
    assertThat(normalizer.normalize(claims("{not json")).isEmpty()).isTrue();
  }

  @Test
  void jsonStringWithTrailingContentDegradesToEmpty() {
    assertThat(normalizer.normalize(claims("{\"p\": {}} garbage")).isEmpty()).isTrue();
    assertThat(normalizer.normalize(claims("{\"p\": {}} {\"q\": {}}")).isEmpty()).isTrue();
  }

  @Test
  void jsonListDegradesToEmpty() {
    assertThat(normalizer.normalize(claims("[\"project1\"]")).isEmpty()).isTrue();
  }

  @Test
  void emptyObjectNullClaimAndNullClaimsAreEmpty() {
    assertThat(normalizer.normalize(claims(Map.of())).isEmpty()).isTrue();
    assertThat(normalizer.normalize(claims(null)).isEmpty()).isTrue();
    assertThat(normalizer.normalize(null).isEmpty()).isTrue();
  }

  @Test
  void nonObjectScalarDegradesToEmpty() {
    assertThat(normalizer.normalize(claims(42)).isEmpty()).isTrue();
  }

  @Test
  void legacyListEntryKeepsIdWithoutResources() {
    final ProjectsClaim claim =
        normalizer.normalize(claims(Map.of("project1", List.of("brics.aip1.notebooks.shared"))));

    assertThat(claim.projects()).containsEntry("project1", new ProjectRecord(null, List.of()));
  }

  @Test
  void resourcesMissingUsernameAreDropped() {
    final Map<String, Object> projects =
        Map.of(
            "project1",
            Map.of(
                "name",
                "Project 1",
                "resources",
                List.of(
                    Map.of("name", "brics.aip1.notebooks.shared"),
                    "not-a-resource",
                    resource("brics.aip1.notebooks.shared", "u1"))));

    final ProjectsClaim claim = normalizer.normalize(claims(projects));

    assertThat(claim.projects().get("project1").resources())
        .containsExactly(new ProjectResource("brics.aip1.notebooks.shared", "u1"));
  }

  private static OidcClaims claims(Object projects) {
    return new OidcClaims("iss", List.of("aud"), 0L, 0L, "alice", projects);
  }

  private static Map<String, Object> project(String name, Map<String, Object> resource) {
    return Map.of("name", name, "resources", List.of(resource));
  }

  private static Map<String, Object> resource(String name, String username) {
    return Map.of("name", name, "username", username);
  }
}
