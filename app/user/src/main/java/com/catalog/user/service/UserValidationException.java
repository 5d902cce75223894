package com.catalog.user.service;

public class UserValidationException extends RuntimeException {

  public enum Reason {
    EMPTY_IDENTITY,
    BACKEND
  }

  private final Reason reason;

  public UserValidationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public UserValidationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
