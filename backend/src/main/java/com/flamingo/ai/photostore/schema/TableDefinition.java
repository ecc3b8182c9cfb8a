package com.flamingo.ai.photostore.schema;

import java.util.List;

/**
 * A table owned by the store.
 *
 * @param name table name as written in DDL
 * @param columns columns an existing table must have to be considered compatible
 * @param createSql idempotent {@code CREATE TABLE IF NOT EXISTS} statement
 */
public record TableDefinition(String name, List<String> columns, String createSql) {}
