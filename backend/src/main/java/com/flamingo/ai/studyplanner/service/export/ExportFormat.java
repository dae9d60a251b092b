package com.flamingo.ai.studyplanner.service.export;

import com.flamingo.ai.studyplanner.exception.UnsupportedExportFormatException;
import java.util.Arrays;
import java.util.Locale;

/** Document formats a schedule can be exported to. */
public enum ExportFormat {
  CSV("csv", "study_schedule.csv"),
  MARKDOWN("markdown", "study_schedule.md");

  private final String value;
  private final String fileName;

  ExportFormat(String value, String fileName) {
    this.value = value;
    this.fileName = fileName;
  }

  public String getValue() {
    return value;
  }

  public String getFileName() {
    return fileName;
  }

  /**
   * Resolves a request parameter such as {@code csv} or {@code Markdown}.
   *
   * @throws UnsupportedExportFormatException for any other value
   */
  public static ExportFormat fromValue(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(f -> f.value.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new UnsupportedExportFormatException(value));
  }
}
