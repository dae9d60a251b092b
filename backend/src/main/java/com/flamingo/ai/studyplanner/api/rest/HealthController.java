package com.flamingo.ai.studyplanner.api.rest;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.service.session.PlannerSession;
import com.flamingo.ai.studyplanner.service.session.PlannerSessionService;
import com.flamingo.ai.studyplanner.util.Rounding;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness and a snapshot of what the planner currently holds in memory. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final PlannerSessionService sessionService;
  private final PlannerConfig plannerConfig;
  private final Clock clock;

  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "UP");
    health.put("service", "study-planner");
    health.put("allocationPolicy", plannerConfig.getScheduling().getPolicy());
    health.put("timestamp", LocalDateTime.now(clock));
    return ResponseEntity.ok(health);
  }

  /** Totals across live sessions: topics, documents, generated schedules and planned hours. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    int sessions = 0;
    int topics = 0;
    int documents = 0;
    int schedules = 0;
    int plannedMinutes = 0;
    for (PlannerSession session : sessionService.getAllSessions()) {
      SessionCounts counts = session.withLock(() -> SessionCounts.of(session));
      sessions++;
      topics += counts.topics();
      documents += counts.documents();
      if (counts.plannedMinutes() >= 0) {
        schedules++;
        plannedMinutes += counts.plannedMinutes();
      }
    }

    Map<String, Object> stats = new LinkedHashMap<>();
    stats.put("sessions", sessions);
    stats.put("topics", topics);
    stats.put("documents", documents);
    stats.put("schedules", schedules);
    stats.put("plannedHours", Rounding.round(plannedMinutes / 60.0, 2));
    stats.put("timestamp", LocalDateTime.now(clock));
    return ResponseEntity.ok(stats);
  }

  /** Counts of one session; {@code plannedMinutes} is -1 when it has no schedule. */
  private record SessionCounts(int topics, int documents, int plannedMinutes) {

    static SessionCounts of(PlannerSession session) {
      return new SessionCounts(
          session.getTopics().size(),
          session.getDocuments().size(),
          session.getSchedule().map(s -> s.summary().totalStudyMinutes()).orElse(-1));
    }
  }
}
