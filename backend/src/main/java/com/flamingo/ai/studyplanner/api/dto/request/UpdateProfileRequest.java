package com.flamingo.ai.studyplanner.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for updating the learner profile. Null fields keep their current value. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProfileRequest {

  @DecimalMin(value = "0.5", message = "Daily hours must be at least 0.5")
  @DecimalMax(value = "16", message = "Daily hours must be at most 16")
  private Double maxDailyDeepHours;

  @DecimalMin(value = "0.25", message = "Session time must be at least 0.25 hours")
  @DecimalMax(value = "8", message = "Session time must be at most 8 hours")
  private Double maxSessionTime;

  private List<
          @Pattern(regexp = "([01]\\d|2[0-3]):[0-5]\\d", message = "Peak windows use HH:mm")
          String>
      peakWindows;
}
