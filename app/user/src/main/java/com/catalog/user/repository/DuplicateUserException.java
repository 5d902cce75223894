package com.catalog.user.repository;

public class DuplicateUserException extends RuntimeException {

  public DuplicateUserException(Throwable cause) {
    super("user already exists", cause);
  }
}
