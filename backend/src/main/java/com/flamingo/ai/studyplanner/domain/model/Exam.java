package com.flamingo.ai.studyplanner.domain.model;

import java.time.LocalDate;

/**
 * An exam date for a subject. Recorded for future prioritisation; the allocators do not read it.
 *
 * @param subject the subject, unique per planner session
 * @param examDate the date of the exam
 */
public record Exam(String subject, LocalDate examDate) {}
