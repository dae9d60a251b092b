package com.flamingo.ai.studyplanner.api.dto.response;

import com.flamingo.ai.studyplanner.service.session.PlannerSession;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for planner session data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

  private UUID id;
  private LocalDateTime createdAt;
  private int topicCount;
  private int documentCount;
  private boolean hasSchedule;

  /** Creates a SessionResponse from a snapshot of the session. Call under the session lock. */
  public static SessionResponse fromSession(PlannerSession session) {
    return SessionResponse.builder()
        .id(session.getId())
        .createdAt(session.getCreatedAt())
        .topicCount(session.getTopics().size())
        .documentCount(session.getDocuments().size())
        .hasSchedule(session.getSchedule().isPresent())
        .build();
  }
}
