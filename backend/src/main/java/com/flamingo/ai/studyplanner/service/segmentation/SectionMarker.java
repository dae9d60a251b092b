package com.flamingo.ai.studyplanner.service.segmentation;

/**
 * The start of a detected section.
 *
 * @param title section title
 * @param page 1-based page on which the section starts
 */
public record SectionMarker(String title, int page) {}
