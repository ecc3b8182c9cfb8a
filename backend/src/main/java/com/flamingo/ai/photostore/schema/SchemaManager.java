package com.flamingo.ai.photostore.schema;

import com.flamingo.ai.photostore.exception.SchemaException;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates and verifies the store's tables and indexes.
 *
 * <p>{@link #ensureSchema()} is idempotent. Missing tables and indexes are created; existing
 * tables are checked against their expected column set and rejected when a column is missing.
 * Once verification fails, every later {@link #requireReady()} rethrows the same failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SchemaManager {

  private final JdbcTemplate jdbcTemplate;

  private volatile boolean ready;
  private volatile SchemaException failure;

  /**
   * Creates every missing table and index and verifies the shape of existing tables.
   *
   * @throws SchemaException if DDL or metadata access fails, or an existing table is incompatible
   */
  public synchronized void ensureSchema() {
    try {
      jdbcTemplate.execute(
          (ConnectionCallback<Void>)
              connection -> {
                applySchema(connection);
                return null;
              });
      failure = null;
      ready = true;
    } catch (SchemaException e) {
      markFailed(e);
      throw e;
    } catch (DataAccessException e) {
      SchemaException schemaException =
          new SchemaException(null, "Could not access database to verify schema", e);
      markFailed(schemaException);
      throw schemaException;
    }
  }

  /**
   * Guards store operations: passes when the schema has been verified, verifies it on first use
   * otherwise.
   *
   * @throws SchemaException if verification failed now or earlier
   */
  public void requireReady() {
    if (ready) {
      return;
    }
    SchemaException previous = failure;
    if (previous != null) {
      throw previous;
    }
    ensureSchema();
  }

  public boolean isReady() {
    return ready;
  }

  private void markFailed(SchemaException e) {
    ready = false;
    failure = e;
    log.error("Photo store schema is not usable: {}", e.getMessage());
  }

  private void applySchema(Connection connection) {
    DatabaseMetaData metaData = metaData(connection);
    Map<String, String> existingTables = existingTables(connection, metaData);

    for (TableDefinition table : PhotoStoreSchema.TABLES) {
      String actualName = existingTables.get(table.name().toLowerCase(Locale.ROOT));
      if (actualName == null) {
        execute(connection, table.name(), table.createSql());
        log.info("Created table {}", table.name());
      } else {
        verifyColumns(connection, metaData, table, actualName);
      }
    }

    // Re-read so that tables created above resolve to their stored names.
    existingTables = existingTables(connection, metaData);
    for (IndexDefinition index : PhotoStoreSchema.INDEXES) {
      String actualTable = existingTables.get(index.table().toLowerCase(Locale.ROOT));
      if (actualTable == null) {
        throw new SchemaException(index.table(), "Table missing after creation: " + index.table());
      }
      if (!indexExists(connection, metaData, actualTable, index.name())) {
        execute(connection, index.table(), index.createSql());
        log.info("Created index {} on {}", index.name(), index.table());
      }
    }
  }

  private void verifyColumns(
      Connection connection, DatabaseMetaData metaData, TableDefinition table, String actualName) {
    Set<String> existingColumns = new LinkedHashSet<>();
    try (ResultSet rs =
        metaData.getColumns(connection.getCatalog(), connection.getSchema(), actualName, null)) {
      while (rs.next()) {
        existingColumns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
      }
    } catch (SQLException e) {
      throw new SchemaException(table.name(), "Could not read columns of " + table.name(), e);
    }

    List<String> missing =
        table.columns().stream().filter(column -> !existingColumns.contains(column)).toList();
    if (!missing.isEmpty()) {
      throw new SchemaException(
          table.name(),
          String.format(
              "Existing table %s is incompatible: missing columns %s", table.name(), missing));
    }
    log.debug("Table {} present with expected columns", table.name());
  }

  private Map<String, String> existingTables(Connection connection, DatabaseMetaData metaData) {
    Map<String, String> names = new HashMap<>();
    try (ResultSet rs =
        metaData.getTables(connection.getCatalog(), connection.getSchema(), null, null)) {
      while (rs.next()) {
        String name = rs.getString("TABLE_NAME");
        names.put(name.toLowerCase(Locale.ROOT), name);
      }
    } catch (SQLException e) {
      throw new SchemaException(null, "Could not list existing tables", e);
    }
    return names;
  }

  private boolean indexExists(
      Connection connection, DatabaseMetaData metaData, String actualTable, String indexName) {
    try (ResultSet rs =
        metaData.getIndexInfo(
            connection.getCatalog(), connection.getSchema(), actualTable, false, false)) {
      while (rs.next()) {
        String existing = rs.getString("INDEX_NAME");
        if (existing != null && existing.equalsIgnoreCase(indexName)) {
          return true;
        }
      }
      return false;
    } catch (SQLException e) {
      throw new SchemaException(actualTable, "Could not read indexes of " + actualTable, e);
    }
  }

  private void execute(Connection connection, String tableName, String sql) {
    try (Statement statement = connection.createStatement()) {
      statement.execute(sql);
    } catch (SQLException e) {
      throw new SchemaException(
          tableName, "Failed to apply DDL on " + tableName + ": " + e.getMessage(), e);
    }
  }

  private DatabaseMetaData metaData(Connection connection) {
    try {
      return connection.getMetaData();
    } catch (SQLException e) {
      throw new SchemaException(null, "Could not read database metadata", e);
    }
  }
}
