/*
 * どこで: Hub-Auth サービス層
 * 何を: spawner オプションフォームの入力を検証し、シェル安全な値へ変換する
 * なぜ: バッチスケジューラのコマンドラインへ未検証の値が渡らないようにするため
 */
package com.example.hub_auth.service;

import com.example.hub_auth.model.SpawnOptions;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class SpawnOptionsValidator {

  static final String BRICS_PROJECT = "brics_project";
  static final String RUNTIME = "runtime";
  static final String NGPUS = "ngpus";
  static final String PARTITION = "partition";
  static final String RESERVATION = "reservation";

  private static final Set<String> ALLOWED_FIELDS =
      Set.of(BRICS_PROJECT, RUNTIME, NGPUS, PARTITION, RESERVATION);

  // project ID は "<name>.<portal>" 形式を許容する。'.' は 1 個まで
  private static final Pattern BRICS_PROJECT_PATTERN = Pattern.compile("^[a-z][a-z0-9\\-_.]+$");
  private static final Pattern NGPUS_PATTERN = Pattern.compile("^\\d$");
  private static final Pattern SCHEDULER_NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]*$");
  // 各フィールドは 1-2 桁
  private static final DateTimeFormatter RUNTIME_FORMAT =
      new DateTimeFormatterBuilder()
          .appendValue(ChronoField.HOUR_OF_DAY, 1, 2, SignStyle.NOT_NEGATIVE)
          .appendLiteral(':')
          .appendValue(ChronoField.MINUTE_OF_HOUR, 1, 2, SignStyle.NOT_NEGATIVE)
          .appendLiteral(':')
          .appendValue(ChronoField.SECOND_OF_MINUTE, 1, 2, SignStyle.NOT_NEGATIVE)
          .toFormatter()
          .withResolverStyle(ResolverStyle.STRICT);

  /**
   * 役割:
   * - spawner フォームを検証し、全ての値をシェルクォートして返す。
   *
   * 期待動作:
   * - 各フィールドは先頭の値のみ参照する。
   * - 不正な入力はフィールドごとの reason を持つ SpawnOptionsValidationException。
   */
  public SpawnOptions validateAndSanitize(
      Map<String, List<String>> fields, Set<String> validProjects) {
    if (fields == null) {
      throw new SpawnOptionsValidationException("form data is required");
    }
    if (!ALLOWED_FIELDS.containsAll(fields.keySet())) {
      throw new SpawnOptionsValidationException("unknown form data keys");
    }

    final String bricsProject = first(fields, BRICS_PROJECT);
    if (!BRICS_PROJECT_PATTERN.matcher(bricsProject).matches()
        || bricsProject.indexOf('.') != bricsProject.lastIndexOf('.')) {
      throw new SpawnOptionsValidationException("brics_project not valid");
    }
    if (validProjects == null || !validProjects.contains(bricsProject)) {
      throw new SpawnOptionsValidationException("unknown brics_project");
    }

    final String runtime = first(fields, RUNTIME);
    try {
      LocalTime.parse(runtime, RUNTIME_FORMAT);
    } catch (DateTimeParseException ex) {
      throw new SpawnOptionsValidationException("runtime not valid");
    }

    final String ngpus = first(fields, NGPUS);
    if (!NGPUS_PATTERN.matcher(ngpus).matches()) {
      throw new SpawnOptionsValidationException("ngpus not valid");
    }

    final String partition = optionalSchedulerName(fields, PARTITION);
    final String reservation = optionalSchedulerName(fields, RESERVATION);

    return new SpawnOptions(
        ShellQuoting.defuse(bricsProject),
        ShellQuoting.defuse(runtime),
        ShellQuoting.defuse(ngpus),
        partition == null ? null : ShellQuoting.defuse(partition),
        reservation == null ? null : ShellQuoting.defuse(reservation));
  }

  private String optionalSchedulerName(Map<String, List<String>> fields, String field) {
    final String value = first(fields, field);
    if (value.isEmpty()) {
      return null;
    }
    if (!SCHEDULER_NAME_PATTERN.matcher(value).matches()) {
      throw new SpawnOptionsValidationException(field + " not valid");
    }
    return value;
  }

  private String first(Map<String, List<String>> fields, String field) {
    final List<String> values = fields.get(field);
    if (values == null || values.isEmpty() || values.get(0) == null) {
      return "";
    }
    return values.get(0);
  }
}
