package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import com.flamingo.ai.studyplanner.domain.model.StudyDay;
import com.flamingo.ai.studyplanner.domain.model.Topic;
import com.flamingo.ai.studyplanner.exception.InvalidDateException;
import com.flamingo.ai.studyplanner.exception.NoTopicsException;
import com.flamingo.ai.studyplanner.exception.TooManyTopicsException;
import com.flamingo.ai.studyplanner.util.Rounding;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared allocation pipeline: input validation, demand/capacity scaling, the calendar loop and
 * session emission. Subclasses decide only which topic gets the next session within a day.
 */
@Slf4j
public abstract class AbstractScheduleAllocator implements ScheduleAllocator {

  protected final PlannerConfig.Scheduling scheduling;

  protected AbstractScheduleAllocator(PlannerConfig plannerConfig) {
    this.scheduling = plannerConfig.getScheduling();
  }

  /** Plans the days of one allocation run. A new instance is created for every run. */
  protected interface DayPlanner {

    /** Returns {@code true} while some topic still has schedulable time left. */
    boolean hasOutstandingWork();

    /** Fills {@code day} with sessions until the policy or the day's capacity stops it. */
    void planDay(DayPlan day);
  }

  /**
   * Creates the per-run planner for this policy.
   *
   * @param workingTopics scaled topics in document-then-section order
   * @param profile learner preferences
   * @return a planner holding any state that must survive from one day to the next
   */
  protected abstract DayPlanner createPlanner(
      List<WorkingTopic> workingTopics, LearnerProfile profile);

  @Override
  public AllocationResult allocate(
      List<Topic> topics, LearnerProfile profile, LocalDate startDate, LocalDate endDate) {
    if (topics == null || topics.isEmpty()) {
      throw new NoTopicsException();
    }
    if (endDate.isBefore(startDate)) {
      throw new InvalidDateException(
          String.format("End date %s is before start date %s", endDate, startDate));
    }
    if (topics.size() > scheduling.getMaxTopics()) {
      throw new TooManyTopicsException(topics.size(), scheduling.getMaxTopics());
    }

    long totalDays = ChronoUnit.DAYS.between(startDate, endDate) + 1;
    double scale = scale(topics, profile, totalDays);
    List<WorkingTopic> workingTopics = new ArrayList<>(topics.size());
    for (Topic topic : topics) {
      workingTopics.add(new WorkingTopic(topic, Rounding.round(topic.estimatedHours() * scale, 1)));
    }

    DayPlanner planner = createPlanner(workingTopics, profile);
    int capacityMinutes = toMinutes(profile.getMaxDailyDeepHours());
    List<StudyDay> days = new ArrayList<>();
    for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
      if (!planner.hasOutstandingWork()) {
        break;
      }
      DayPlan day =
          new DayPlan(
              date,
              capacityMinutes,
              scheduling.getDayStart(),
              scheduling.getLunchStart(),
              scheduling.getLunchEnd(),
              scheduling.getBufferMinutes());
      planner.planDay(day);
      log.debug("Planned {} of {} minutes on {}", day.usedMinutes(), capacityMinutes, date);
      if (!day.isEmpty()) {
        days.add(day.toStudyDay());
      }
    }

    log.debug(
        "Policy {} planned {} topics into {} of {} days (scale {})",
        policyName(),
        topics.size(),
        days.size(),
        totalDays,
        scale);
    long outstanding =
        workingTopics.stream().filter(t -> t.getRemainingMinutes() >= minSessionMinutes()).count();
    if (outstanding > 0) {
      log.warn(
          "Policy {} left {} topics with outstanding work between {} and {}",
          policyName(),
          outstanding,
          startDate,
          endDate);
    }
    return new AllocationResult(List.copyOf(days), List.copyOf(workingTopics), scale);
  }

  /** Stretches demand up to the configured maximum, or compresses it to fit the range. */
  double scale(List<Topic> topics, LearnerProfile profile, long totalDays) {
    double needed = topics.stream().mapToDouble(Topic::estimatedHours).sum();
    if (needed <= 0) {
      return 1.0;
    }
    double available = totalDays * profile.getMaxDailyDeepHours();
    return Math.min(scheduling.getMaxScale(), available / needed);
  }

  /**
   * Trims a session of an hour or more down to whole tenths of an hour, so its length reads
   * exactly as {@code 1.3h}. Shorter sessions keep their minute length.
   */
  protected static int sessionMinutes(int minutes) {
    return minutes >= 60 ? minutes - minutes % 6 : minutes;
  }

  protected int minSessionMinutes() {
    return toMinutes(scheduling.getMinSessionHours());
  }

  /** Converts hours to whole minutes, tolerating binary representation error. */
  protected static int toMinutes(double hours) {
    return (int) Math.floor(hours * 60 + 1e-6);
  }
}
