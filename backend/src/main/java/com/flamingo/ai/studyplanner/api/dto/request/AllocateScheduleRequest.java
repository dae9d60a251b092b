package com.flamingo.ai.studyplanner.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for generating a schedule. Dates are ISO {@code yyyy-MM-dd}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocateScheduleRequest {

  /** Defaults to today when absent. */
  private String startDate;

  @NotBlank(message = "End date is required")
  private String endDate;

  /** Overrides the configured allocation policy for this run. */
  private String policy;
}
