package com.flamingo.ai.photostore.schema;

import java.util.List;

/** An index the store relies on for lookups or uniqueness. */
public record IndexDefinition(String name, String table, List<String> columns, boolean unique) {

  /** Returns the {@code CREATE INDEX} statement for this index. */
  public String createSql() {
    return String.format(
        "CREATE %sINDEX %s ON %s (%s)",
        unique ? "UNIQUE " : "", name, table, String.join(", ", columns));
  }
}
