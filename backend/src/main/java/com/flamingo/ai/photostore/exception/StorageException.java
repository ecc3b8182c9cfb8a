package com.flamingo.ai.photostore.exception;

/**
 * Exception thrown when a write or read against the database fails.
 *
 * <p>The transaction that raised it has been rolled back completely. {@link #isConflict()} marks
 * failures caused by a concurrent writer, which are safe to repeat as a whole.
 */
public class StorageException extends RuntimeException {

  private final String filePath;
  private final String operation;
  private final boolean conflict;
  private final String userMessage;

  public StorageException(String filePath, String operation, Throwable cause) {
    this(filePath, operation, cause, false);
  }

  public StorageException(String filePath, String operation, Throwable cause, boolean conflict) {
    super(
        String.format(
            "%s failed%s: %s",
            operation,
            filePath != null ? " for " + filePath : "",
            cause != null ? cause.getMessage() : "unknown cause"),
        cause);
    this.filePath = filePath;
    this.operation = operation;
    this.conflict = conflict;
    this.userMessage =
        conflict
            ? "The photo is being updated concurrently. Please retry."
            : "Photo storage is temporarily unavailable. Please try again later.";
  }

  public String getFilePath() {
    return filePath;
  }

  public String getOperation() {
    return operation;
  }

  public boolean isConflict() {
    return conflict;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
