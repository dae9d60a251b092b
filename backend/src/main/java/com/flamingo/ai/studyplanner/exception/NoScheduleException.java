package com.flamingo.ai.studyplanner.exception;

import java.util.UUID;

/** Exception thrown when a schedule is read or exported before one has been generated. */
public class NoScheduleException extends RuntimeException {

  private final UUID sessionId;

  public NoScheduleException(UUID sessionId) {
    super("No schedule found for session " + sessionId);
    this.sessionId = sessionId;
  }

  public UUID getSessionId() {
    return sessionId;
  }
}
