/*
 * どこで: Hub-Auth サービス層テスト
 * 何を: ログイン・エラー・spawn 入力のメトリクスが期待どおり記録されることを検証する
 * なぜ: メトリクス名やタグの退行を防ぎ、監視クエリの互換性を保つため
 */
package com.example.hub_auth.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class HubMetricsTest {

  @Test
  void recordsLoginAndErrorMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final HubMetrics metrics = new HubMetrics(registry);

    metrics.recordLoginResult("success");
    metrics.recordLoginResult("success");
    metrics.recordLoginResult("forbidden");
    metrics.recordError("AUTH_INVALID_TOKEN");

    final Counter success = registry.get("hub.login.total").tag("result", "success").counter();
    final Counter forbidden = registry.get("hub.login.total").tag("result", "forbidden").counter();
    final Counter invalidToken =
        registry.get("hub.error.total").tag("code", "AUTH_INVALID_TOKEN").counter();

    assertThat(success.count()).isEqualTo(2.0d);
    assertThat(forbidden.count()).isEqualTo(1.0d);
    assertThat(invalidToken.count()).isEqualTo(1.0d);
  }

  @Test
  void recordsSpawnOptionsMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final HubMetrics metrics = new HubMetrics(registry);

    metrics.recordSpawnOptionsResult("accepted");
    metrics.recordSpawnOptionsResult("rejected");

    assertThat(
            registry.get("hub.spawn.options.total").tag("result", "accepted").counter().count())
        .isEqualTo(1.0d);
    assertThat(
            registry.get("hub.spawn.options.total").tag("result", "rejected").counter().count())
        .isEqualTo(1.0d);
  }
}
