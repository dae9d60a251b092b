package com.flamingo.ai.studyplanner.service.session;

import com.flamingo.ai.studyplanner.exception.SessionNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Process-local {@link PlannerSessionService}. Session state lives only as long as the process. */
@Service
@RequiredArgsConstructor
@Slf4j
public class InMemoryPlannerSessionService implements PlannerSessionService {

  private final Map<UUID, PlannerSession> sessions = new ConcurrentHashMap<>();
  private final MeterRegistry meterRegistry;

  @Override
  public PlannerSession createSession() {
    PlannerSession session = new PlannerSession(UUID.randomUUID());
    sessions.put(session.getId(), session);
    meterRegistry.counter("planner.session.created").increment();

    log.info("Created planner session with ID: {}", session.getId());
    return session;
  }

  @Override
  public PlannerSession getSession(UUID sessionId) {
    PlannerSession session = sessions.get(sessionId);
    if (session == null) {
      throw new SessionNotFoundException(sessionId);
    }
    return session;
  }

  @Override
  public List<PlannerSession> getAllSessions() {
    return sessions.values().stream()
        .sorted(Comparator.comparing(PlannerSession::getCreatedAt))
        .toList();
  }

  @Override
  public void deleteSession(UUID sessionId) {
    if (sessions.remove(sessionId) == null) {
      throw new SessionNotFoundException(sessionId);
    }
    meterRegistry.counter("planner.session.deleted").increment();
    log.info("Deleted planner session: {}", sessionId);
  }
}
