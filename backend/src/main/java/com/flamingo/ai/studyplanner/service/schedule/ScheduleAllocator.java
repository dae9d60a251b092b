package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import com.flamingo.ai.studyplanner.domain.model.Topic;
import java.time.LocalDate;
import java.util.List;

/**
 * Distributes topics over a date range as concrete study sessions.
 *
 * <p>Implementations are stateless Spring beans; all per-run state lives inside a single {@link
 * #allocate} call. {@link ScheduleAllocatorRouter} selects an implementation by {@link
 * #policyName()}.
 */
public interface ScheduleAllocator {

  /**
   * Returns the policy name this allocator is registered under (e.g. {@code proportional}).
   *
   * @return policy name, lower case
   */
  String policyName();

  /**
   * Plans sessions for every day from {@code startDate} to {@code endDate} inclusive.
   *
   * <p>Running out of days is not an error: the result simply under-covers the demand.
   *
   * @param topics topics in document-then-section order
   * @param profile learner preferences supplying the daily and per-session limits
   * @param startDate first day to plan
   * @param endDate last day to plan
   * @return planned days (never empty ones) and the per-topic working state
   * @throws com.flamingo.ai.studyplanner.exception.NoTopicsException if {@code topics} is empty
   * @throws com.flamingo.ai.studyplanner.exception.InvalidDateException if the range is inverted
   * @throws com.flamingo.ai.studyplanner.exception.TooManyTopicsException above the topic cap
   */
  AllocationResult allocate(
      List<Topic> topics, LearnerProfile profile, LocalDate startDate, LocalDate endDate);
}
