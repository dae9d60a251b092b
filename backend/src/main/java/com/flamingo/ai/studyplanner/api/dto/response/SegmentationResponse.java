package com.flamingo.ai.studyplanner.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a segmented document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentationResponse {

  private String documentId;
  private String subject;
  private String fileName;
  private int pages;
  private int topicsCreated;
  private double totalHours;

  /** Up to 15 entries formatted as "title (Nh)". */
  private List<String> topics;

  private String message;
}
