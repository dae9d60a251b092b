package com.flamingo.ai.studyplanner.api.dto.response;

import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an exam upsert. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExamResponse {

  private String subject;
  private LocalDate examDate;

  /** {@code true} if an existing exam of the subject was moved. */
  private boolean updated;

  private String message;
}
