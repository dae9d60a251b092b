package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.domain.model.StudyDay;
import java.util.List;

/**
 * Outcome of one allocation run.
 *
 * @param days days with at least one session, in chronological order
 * @param workingTopics per-topic scaled budgets and what is left of them
 * @param scale demand/capacity factor applied to every topic's estimate
 */
public record AllocationResult(
    List<StudyDay> days, List<WorkingTopic> workingTopics, double scale) {}
