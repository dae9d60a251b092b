package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when segmentation is asked to process something that is not a document. */
public class UnsupportedFileException extends RuntimeException {

  private final String fileName;
  private final String userMessage;

  public UnsupportedFileException(String fileName, String message, String userMessage) {
    super(message);
    this.fileName = fileName;
    this.userMessage = userMessage;
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
