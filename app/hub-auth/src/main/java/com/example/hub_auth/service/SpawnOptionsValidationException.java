package com.example.hub_auth.service;

public class SpawnOptionsValidationException extends RuntimeException {

  static final String MESSAGE_PREFIX = "Invalid spawner options input: ";

  private final String reason;

  public SpawnOptionsValidationException(String reason) {
    super(MESSAGE_PREFIX + reason);
    this.reason = reason;
  }

  public String reason() {
    return reason;
  }
}
