package com.flamingo.ai.studyplanner.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Scheduling preferences of a learner, produced by the survey flow. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LearnerProfile {

  @Builder.Default private double maxDailyDeepHours = 6;

  @Builder.Default private double maxSessionTime = 1.5;

  /** Times of day ("HH:mm") at which the learner reports peak focus. */
  @Builder.Default private List<String> peakWindows = new ArrayList<>();

  /** Self-reported confidence per subject, within [0, 1]. Recorded only. */
  @Builder.Default private Map<String, Double> subjectConfidence = new LinkedHashMap<>();
}
