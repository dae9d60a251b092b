package com.flamingo.ai.studyplanner.service.segmentation;

/**
 * One bookmark from a document's table of contents.
 *
 * @param title bookmark text as stored in the document
 * @param depth nesting depth, 1 for top-level entries
 * @param page 1-based page the bookmark points to
 */
public record OutlineEntry(String title, int depth, int page) {}
