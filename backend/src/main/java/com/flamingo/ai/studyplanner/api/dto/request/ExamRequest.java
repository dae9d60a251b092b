package com.flamingo.ai.studyplanner.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for adding or moving an exam. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExamRequest {

  @NotBlank(message = "Subject is required")
  private String subject;

  @NotBlank(message = "Exam date is required")
  private String examDate;
}
