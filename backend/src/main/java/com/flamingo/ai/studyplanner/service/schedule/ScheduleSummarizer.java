package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.domain.model.ScheduleSummary;
import com.flamingo.ai.studyplanner.domain.model.StudyDay;
import com.flamingo.ai.studyplanner.domain.model.StudySession;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Aggregates an allocation run into per-subject and overall totals. */
@Component
public class ScheduleSummarizer {

  /** A topic counts as scheduled once more than this much of its budget has been consumed. */
  static final int SCHEDULED_THRESHOLD_MINUTES = 6;

  public ScheduleSummary summarize(AllocationResult result) {
    Map<String, Integer> minutesPerSubject = new LinkedHashMap<>();
    int totalMinutes = 0;
    for (StudyDay day : result.days()) {
      for (StudySession session : day.sessions()) {
        minutesPerSubject.merge(session.subject(), session.durationMinutes(), Integer::sum);
        totalMinutes += session.durationMinutes();
      }
    }

    int topicsScheduled =
        (int)
            result.workingTopics().stream()
                .filter(
                    t ->
                        t.getRemainingMinutes()
                            < t.getTotalMinutes() - SCHEDULED_THRESHOLD_MINUTES)
                .count();

    return new ScheduleSummary(
        totalMinutes,
        result.days().size(),
        minutesPerSubject,
        topicsScheduled,
        result.workingTopics().size());
  }
}
