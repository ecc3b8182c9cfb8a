package com.flamingo.ai.photostore.exception;

/** Exception thrown when caller input is malformed; raised before anything is persisted. */
public class PhotoValidationException extends RuntimeException {

  private final String filePath;

  public PhotoValidationException(String message) {
    super(message);
    this.filePath = null;
  }

  public PhotoValidationException(String filePath, String message) {
    super(filePath != null ? message + " [" + filePath + "]" : message);
    this.filePath = filePath;
  }

  /** Path of the photo being ingested, or {@code null} for query input. */
  public String getFilePath() {
    return filePath;
  }
}
