package com.flamingo.ai.studyplanner.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * The result of one allocation run. A new run replaces the previous schedule wholesale.
 *
 * @param id fingerprint of the requested date range
 * @param startDate first day of the range
 * @param endDate last day of the range (inclusive)
 * @param days days with at least one session, in chronological order
 * @param summary aggregate statistics
 */
public record Schedule(
    String id,
    LocalDate startDate,
    LocalDate endDate,
    List<StudyDay> days,
    ScheduleSummary summary) {}
