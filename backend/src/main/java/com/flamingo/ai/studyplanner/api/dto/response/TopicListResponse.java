package com.flamingo.ai.studyplanner.api.dto.response;

import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO listing topics grouped by subject. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicListResponse {

  private int totalTopics;
  private double totalHours;

  /** Subjects in the order their first document was processed. */
  private Map<String, SubjectTopics> bySubject;

  /** Topics and total hours of one subject. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class SubjectTopics {
    private List<TopicEntry> topics;
    private double totalHours;
  }

  /** A single topic in the listing. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class TopicEntry {
    private String id;
    private String title;
    private double hours;
  }
}
