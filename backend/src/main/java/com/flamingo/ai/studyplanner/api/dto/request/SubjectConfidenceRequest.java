package com.flamingo.ai.studyplanner.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for recording how confident the learner feels about a subject. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubjectConfidenceRequest {

  @NotBlank(message = "Subject is required")
  private String subject;

  /** Clamped into [0, 1]. */
  @NotNull(message = "Confidence is required")
  private Double confidence;
}
