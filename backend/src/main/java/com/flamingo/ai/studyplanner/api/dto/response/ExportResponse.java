package com.flamingo.ai.studyplanner.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an exported schedule document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ExportResponse {

  private String format;
  private String fileName;

  /** CSV data rows without the header; omitted for other formats. */
  private List<String> rows;

  private String content;
  private ExportSummary summary;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ExportSummary {
    private String period;
    private double totalHours;
    private int studyDays;

    /** Scheduled over total topics, e.g. {@code 3/4}. */
    private String topicsScheduled;

    private Map<String, Double> hoursPerSubject;
  }
}
