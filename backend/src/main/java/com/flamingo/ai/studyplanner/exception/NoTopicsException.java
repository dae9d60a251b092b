package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when a schedule is requested before any document has been segmented. */
public class NoTopicsException extends RuntimeException {

  public NoTopicsException() {
    super("No topics found. Process documents first.");
  }
}
