package com.example.hub_auth.service;

import java.util.regex.Pattern;

public final class ShellQuoting {

  private static final Pattern UNSAFE = Pattern.compile("[^\\w@%+=:,./-]");

  private ShellQuoting() {}

  // 安全な文字だけならそのまま、それ以外はシングルクォートで囲む
  public static String defuse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("value is required");
    }
    if (value.isEmpty()) {
      return "''";
    }
    if (!UNSAFE.matcher(value).find()) {
      return value;
    }
    return "'" + value.replace("'", "'\"'\"'") + "'";
  }
}
