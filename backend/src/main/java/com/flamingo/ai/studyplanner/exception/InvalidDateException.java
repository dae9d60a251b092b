package com.flamingo.ai.studyplanner.exception;

/** Exception thrown for an unparseable date or a date range that ends before it starts. */
public class InvalidDateException extends RuntimeException {

  public InvalidDateException(String message) {
    super(message);
  }

  public InvalidDateException(String message, Throwable cause) {
    super(message, cause);
  }
}
