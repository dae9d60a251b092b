package com.flamingo.ai.studyplanner.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalTime;

/**
 * One contiguous block of time assigned to exactly one topic.
 *
 * <p>Durations are held in whole minutes so that exported documents re-derive the same totals.
 */
public record StudySession(
    String topicId,
    String subject,
    String title,
    @JsonFormat(pattern = "HH:mm") LocalTime startTime,
    int durationMinutes,
    double complexity) {

  @JsonProperty("durationHours")
  public double durationHours() {
    return durationMinutes / 60.0;
  }

  @JsonProperty("endTime")
  @JsonFormat(pattern = "HH:mm")
  public LocalTime endTime() {
    return startTime.plusMinutes(durationMinutes);
  }
}
