package com.flamingo.ai.studyplanner.domain.model;

/**
 * A schedulable unit of study material derived from one detected document section.
 *
 * @param id stable identifier: document fingerprint plus zero-padded section index
 * @param subject subject the source document was filed under
 * @param title section title, truncated for display
 * @param startPage first page of the section (1-based)
 * @param endPage last page of the section (inclusive)
 * @param estimatedHours estimated study time, within [0.5, 8.0]
 * @param complexity heuristic difficulty, within [0.3, 0.9]
 */
public record Topic(
    String id,
    String subject,
    String title,
    int startPage,
    int endPage,
    double estimatedHours,
    double complexity) {}
