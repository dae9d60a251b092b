package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import com.flamingo.ai.studyplanner.util.Rounding;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Gives every subject a share of each day proportional to its outstanding hours, then sweeps the
 * subjects in descending order of outstanding work, one session per subject per pass.
 *
 * <p>Within a subject, topics are studied strictly in document order: a per-subject cursor only
 * moves forward once its topic has less than the minimum session length left.
 */
@Component
@Order(1)
public class ProportionalBudgetAllocator extends AbstractScheduleAllocator {

  public static final String POLICY = "proportional";

  public ProportionalBudgetAllocator(PlannerConfig plannerConfig) {
    super(plannerConfig);
  }

  @Override
  public String policyName() {
    return POLICY;
  }

  @Override
  protected DayPlanner createPlanner(List<WorkingTopic> workingTopics, LearnerProfile profile) {
    return new Planner(workingTopics, profile);
  }

  private final class Planner implements DayPlanner {

    private final Map<String, SubjectQueue> subjects = new LinkedHashMap<>();
    private final LearnerProfile profile;
    private final int minSession;
    private final int maxSession;
    private final int passCap;

    Planner(List<WorkingTopic> workingTopics, LearnerProfile profile) {
      this.profile = profile;
      this.minSession = minSessionMinutes();
      this.maxSession = toMinutes(profile.getMaxSessionTime());
      this.passCap = Math.max(1, scheduling.getIterationCapMultiplier() * workingTopics.size());
      for (WorkingTopic topic : workingTopics) {
        subjects.computeIfAbsent(topic.getSubject(), s -> new SubjectQueue()).add(topic);
      }
    }

    @Override
    public boolean hasOutstandingWork() {
      return subjects.values().stream().anyMatch(s -> s.outstandingMinutes() >= minSession);
    }

    @Override
    public void planDay(DayPlan day) {
      List<SubjectQueue> active = new ArrayList<>();
      int totalOutstanding = 0;
      for (SubjectQueue subject : subjects.values()) {
        int outstanding = subject.outstandingMinutes();
        if (outstanding >= minSession) {
          active.add(subject);
          totalOutstanding += outstanding;
        }
      }
      if (active.isEmpty()) {
        return;
      }

      for (SubjectQueue subject : active) {
        double share = (double) subject.outstandingMinutes() / totalOutstanding;
        subject.budgetLeft = toMinutes(Rounding.round(share * profile.getMaxDailyDeepHours(), 2));
      }
      // List.sort is stable, so equal subjects keep their first-seen order
      active.sort(Comparator.comparingInt(SubjectQueue::outstandingMinutes).reversed());

      for (int pass = 0; pass < passCap; pass++) {
        boolean scheduled = false;
        for (SubjectQueue subject : active) {
          if (day.remainingMinutes() < minSession) {
            return;
          }
          if (subject.budgetLeft < minSession) {
            continue;
          }
          WorkingTopic topic = subject.current(minSession);
          if (topic == null) {
            continue;
          }
          int minutes =
              sessionMinutes(
                  Math.min(
                      Math.min(maxSession, topic.getRemainingMinutes()),
                      Math.min(subject.budgetLeft, day.remainingMinutes())));
          if (minutes < minSession) {
            continue;
          }
          day.schedule(topic, minutes);
          subject.budgetLeft -= minutes;
          scheduled = true;
        }
        if (!scheduled) {
          return;
        }
      }
    }
  }

  /** One subject's topics in document order with a forward-only cursor. */
  private static final class SubjectQueue {

    private final List<WorkingTopic> topics = new ArrayList<>();
    private int cursor;
    private int budgetLeft;

    void add(WorkingTopic topic) {
      topics.add(topic);
    }

    int outstandingMinutes() {
      return topics.stream().mapToInt(WorkingTopic::getRemainingMinutes).sum();
    }

    /** Returns the cursor topic, first skipping topics with too little time left. */
    WorkingTopic current(int minSession) {
      while (cursor < topics.size() && topics.get(cursor).getRemainingMinutes() < minSession) {
        cursor++;
      }
      return cursor < topics.size() ? topics.get(cursor) : null;
    }
  }
}
