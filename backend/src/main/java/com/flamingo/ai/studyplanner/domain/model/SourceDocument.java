package com.flamingo.ai.studyplanner.domain.model;

import java.util.List;

/**
 * A processed source file and the topics it produced.
 *
 * @param id fingerprint of filename and page count
 * @param fileName bare filename, without directories
 * @param subject subject the document was filed under
 * @param totalPages number of pages in the document
 * @param topicIds ids of the created topics, in section order
 */
public record SourceDocument(
    String id, String fileName, String subject, int totalPages, List<String> topicIds) {}
