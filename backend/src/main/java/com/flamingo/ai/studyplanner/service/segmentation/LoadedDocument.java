package com.flamingo.ai.studyplanner.service.segmentation;

import java.util.List;

/**
 * Page-addressable text of a document together with its optional outline.
 *
 * @param fileName bare filename of the source
 * @param totalPages number of pages
 * @param pageTexts text per page, index 0 holding page 1; unreadable pages are empty strings
 * @param outline bookmarks in document order, empty when the document has none
 */
public record LoadedDocument(
    String fileName, int totalPages, List<String> pageTexts, List<OutlineEntry> outline) {

  /** Returns the text of a 1-based page, or an empty string for pages out of range. */
  public String pageText(int page) {
    if (page < 1 || page > pageTexts.size()) {
      return "";
    }
    String text = pageTexts.get(page - 1);
    return text != null ? text : "";
  }

  /** Returns at most {@code maxChars} leading characters of a 1-based page. */
  public String sample(int page, int maxChars) {
    String text = pageText(page);
    return text.length() > maxChars ? text.substring(0, maxChars) : text;
  }
}
