package com.flamingo.ai.studyplanner.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/** The sessions planned for one calendar day. Days without sessions are never recorded. */
public record StudyDay(LocalDate date, DayOfWeek weekday, List<StudySession> sessions) {

  @JsonProperty("totalMinutes")
  public int totalMinutes() {
    return sessions.stream().mapToInt(StudySession::durationMinutes).sum();
  }

  @JsonProperty("totalHours")
  public double totalHours() {
    return totalMinutes() / 60.0;
  }
}
