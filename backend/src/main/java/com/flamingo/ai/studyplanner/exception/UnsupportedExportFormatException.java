package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when an export is requested in a format that has no exporter. */
public class UnsupportedExportFormatException extends RuntimeException {

  private final String format;

  public UnsupportedExportFormatException(String format) {
    super("Unsupported export format: " + format);
    this.format = format;
  }

  public String getFormat() {
    return format;
  }
}
