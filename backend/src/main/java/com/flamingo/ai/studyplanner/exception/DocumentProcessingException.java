package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when a supported document cannot be opened at all. */
public class DocumentProcessingException extends RuntimeException {

  private final String fileName;

  public DocumentProcessingException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return "Failed to read document " + fileName;
  }
}
