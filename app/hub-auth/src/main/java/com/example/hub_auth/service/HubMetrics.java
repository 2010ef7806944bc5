/*
 * どこで: Hub-Auth サービス層
 * 何を: ログイン結果・エラーコード・spawn オプション検証結果のメトリクスを記録する
 * なぜ: 401/403/500 の増加や不正な spawn 入力を Prometheus から直接観測できるようにするため
 */
package com.example.hub_auth.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class HubMetrics {

  private static final String METRIC_LOGIN_TOTAL = "hub.login.total";
  private static final String METRIC_ERROR_TOTAL = "hub.error.total";
  private static final String METRIC_SPAWN_OPTIONS_TOTAL = "hub.spawn.options.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> spawnOptionsCounters = new ConcurrentHashMap<>();

  public HubMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLoginResult(String result) {
    loginCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_LOGIN_TOTAL)
                    .description("Hub login endpoint outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordError(String code) {
    errorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_ERROR_TOTAL)
                    .description("Hub API errors by code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSpawnOptionsResult(String result) {
    spawnOptionsCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_SPAWN_OPTIONS_TOTAL)
                    .description("Spawner options form submissions by outcome")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }
}
