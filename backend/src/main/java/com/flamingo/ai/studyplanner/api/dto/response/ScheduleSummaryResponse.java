package com.flamingo.ai.studyplanner.api.dto.response;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO returned after generating a schedule. The full plan is fetched separately. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleSummaryResponse {

  private String scheduleId;
  private String policy;
  private int days;
  private double totalHours;
  private Map<String, Double> hoursBySubject;
  private int topicsScheduled;
  private int totalTopics;
  private String message;
}
