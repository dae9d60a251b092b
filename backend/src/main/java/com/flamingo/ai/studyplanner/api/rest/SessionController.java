package com.flamingo.ai.studyplanner.api.rest;

import com.flamingo.ai.studyplanner.api.dto.response.SessionResponse;
import com.flamingo.ai.studyplanner.service.session.PlannerSession;
import com.flamingo.ai.studyplanner.service.session.PlannerSessionService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for planner session management. */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

  private final PlannerSessionService sessionService;

  /** Creates a new session. */
  @PostMapping
  public ResponseEntity<SessionResponse> createSession() {
    PlannerSession session = sessionService.createSession();
    return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(session));
  }

  /** Gets all sessions. */
  @GetMapping
  public ResponseEntity<List<SessionResponse>> getAllSessions() {
    return ResponseEntity.ok(
        sessionService.getAllSessions().stream().map(SessionController::toResponse).toList());
  }

  /** Gets a session by ID. */
  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> getSession(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(toResponse(sessionService.getSession(sessionId)));
  }

  /** Deletes a session. */
  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> deleteSession(@PathVariable UUID sessionId) {
    sessionService.deleteSession(sessionId);
    return ResponseEntity.noContent().build();
  }

  private static SessionResponse toResponse(PlannerSession session) {
    return session.withLock(() -> SessionResponse.fromSession(session));
  }
}
