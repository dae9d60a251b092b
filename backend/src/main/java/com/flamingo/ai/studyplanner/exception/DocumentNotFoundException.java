package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when no uploaded file with the given name exists in the session. */
public class DocumentNotFoundException extends RuntimeException {

  private final String fileName;

  public DocumentNotFoundException(String fileName) {
    super("Uploaded document not found: " + fileName);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
