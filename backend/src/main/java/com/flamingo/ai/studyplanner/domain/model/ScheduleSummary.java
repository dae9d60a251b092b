package com.flamingo.ai.studyplanner.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate statistics of a schedule.
 *
 * @param totalStudyMinutes sum of all session durations
 * @param studyDays number of days with at least one session
 * @param minutesPerSubject scheduled minutes per subject, in first-scheduled order
 * @param topicsScheduled topics that received any session
 * @param totalTopics topics that were offered to the allocator
 */
public record ScheduleSummary(
    int totalStudyMinutes,
    int studyDays,
    Map<String, Integer> minutesPerSubject,
    int topicsScheduled,
    int totalTopics) {

  @JsonProperty("totalStudyHours")
  public double totalStudyHours() {
    return totalStudyMinutes / 60.0;
  }

  @JsonProperty("hoursPerSubject")
  public Map<String, Double> hoursPerSubject() {
    Map<String, Double> hours = new LinkedHashMap<>();
    minutesPerSubject.forEach((subject, minutes) -> hours.put(subject, minutes / 60.0));
    return hours;
  }
}
