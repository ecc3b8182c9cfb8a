package com.flamingo.ai.photostore.exception;

/**
 * Exception thrown when the database schema cannot be created or does not have the expected
 * shape. Fatal: the store refuses to operate until the schema is fixed.
 */
public class SchemaException extends RuntimeException {

  private final String tableName;

  public SchemaException(String tableName, String message) {
    super(message);
    this.tableName = tableName;
  }

  public SchemaException(String tableName, String message, Throwable cause) {
    super(message, cause);
    this.tableName = tableName;
  }

  /** Table the failure relates to, or {@code null} when it is not table specific. */
  public String getTableName() {
    return tableName;
  }
}
