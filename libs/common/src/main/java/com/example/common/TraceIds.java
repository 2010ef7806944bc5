/*
 * どこで: Common 共通ユーティリティ
 * 何を: リクエスト相関 ID の採番と、外部から渡された ID の受け入れ判定
 * なぜ: X-Request-Id 等のヘッダ値をそのままログへ流すと改行や巨大値でログが壊れるため
 */
package com.example.common;

import java.util.UUID;
import java.util.regex.Pattern;

public final class TraceIds {

  static final int MAX_LENGTH = 128;
  private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:\\-]+");

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // 相関 ID として安全な値ならそのまま、そうでなければ新規採番する
  public static String acceptOrNew(String candidate) {
    if (candidate == null
        || candidate.isBlank()
        || candidate.length() > MAX_LENGTH
        || !SAFE_ID.matcher(candidate).matches()) {
      return newTraceId();
    }
    return candidate;
  }
}
