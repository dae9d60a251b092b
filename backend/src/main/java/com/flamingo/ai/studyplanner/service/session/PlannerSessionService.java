package com.flamingo.ai.studyplanner.service.session;

import java.util.List;
import java.util.UUID;

/** Service interface for planner session management. */
public interface PlannerSessionService {

  /**
   * Creates a new, empty planner session.
   *
   * @return the created session
   */
  PlannerSession createSession();

  /**
   * Gets a session by ID.
   *
   * @param sessionId the session ID
   * @return the session
   * @throws com.flamingo.ai.studyplanner.exception.SessionNotFoundException if not found
   */
  PlannerSession getSession(UUID sessionId);

  /**
   * Gets all live sessions.
   *
   * @return list of sessions
   */
  List<PlannerSession> getAllSessions();

  /**
   * Deletes a session and everything stored in it.
   *
   * @param sessionId the session ID
   */
  void deleteSession(UUID sessionId);
}
