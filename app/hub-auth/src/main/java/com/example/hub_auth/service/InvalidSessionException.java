package com.example.hub_auth.service;

public class InvalidSessionException extends RuntimeException {

  public InvalidSessionException(String message) {
    super(message);
  }
}
