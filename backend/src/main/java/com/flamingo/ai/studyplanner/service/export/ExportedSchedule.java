package com.flamingo.ai.studyplanner.service.export;

import java.util.List;

/**
 * A serialized schedule.
 *
 * @param content the full document
 * @param rows data rows without the header, for formats that are row based; empty otherwise
 */
public record ExportedSchedule(String content, List<String> rows) {}
