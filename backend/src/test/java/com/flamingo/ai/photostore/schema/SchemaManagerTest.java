package com.flamingo.ai.photostore.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.flamingo.ai.photostore.exception.SchemaException;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

@DisplayName("SchemaManager")
class SchemaManagerTest {

  private JdbcTemplate jdbcTemplate;
  private SchemaManager schemaManager;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource dataSource =
        new DriverManagerDataSource(
            "jdbc:h2:mem:schema_"
                + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
            "sa",
            "");
    jdbcTemplate = new JdbcTemplate(dataSource);
    schemaManager = new SchemaManager(jdbcTemplate);
  }

  @Nested
  @DisplayName("on an empty database")
  class EmptyDatabase {

    @Test
    @DisplayName("should create every table")
    void shouldCreateEveryTable() {
      schemaManager.ensureSchema();

      for (TableDefinition table : PhotoStoreSchema.TABLES) {
        Integer rows =
            jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table.name(), Integer.class);
        assertThat(rows).as(table.name()).isZero();
      }
      assertThat(schemaManager.isReady()).isTrue();
    }

    @Test
    @DisplayName("should enforce unique photo paths")
    void shouldEnforceUniquePhotoPaths() {
      schemaManager.ensureSchema();
      String insert =
          "INSERT INTO photos (file_path, file_name, created_at, updated_at) "
              + "VALUES ('/a.jpg', 'a.jpg', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)";
      jdbcTemplate.update(insert);

      assertThatThrownBy(() -> jdbcTemplate.update(insert))
          .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("should enforce one summary row per photo and class")
    void shouldEnforceUniqueObjectSummary() {
      schemaManager.ensureSchema();
      jdbcTemplate.update(
          "INSERT INTO photos (id, file_path, file_name, created_at, updated_at) "
              + "VALUES (1, '/a.jpg', 'a.jpg', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)");
      String insert =
          "INSERT INTO object_summary "
              + "(photo_id, class_label, total_count, avg_confidence, max_confidence) "
              + "VALUES (1, 'person', 1, 0.5, 0.5)";
      jdbcTemplate.update(insert);

      assertThatThrownBy(() -> jdbcTemplate.update(insert))
          .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("should be a no-op when called again")
    void shouldBeIdempotent() {
      schemaManager.ensureSchema();
      jdbcTemplate.update(
          "INSERT INTO known_faces (name, encoding, created_at) "
              + "VALUES ('Jane', '[0.1]', CURRENT_TIMESTAMP)");

      schemaManager.ensureSchema();
      new SchemaManager(jdbcTemplate).ensureSchema();

      assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM known_faces", Integer.class))
          .isEqualTo(1);
      assertThat(schemaManager.isReady()).isTrue();
    }

    @Test
    @DisplayName("requireReady should verify the schema on first use")
    void requireReadyShouldVerifyLazily() {
      assertThat(schemaManager.isReady()).isFalse();

      schemaManager.requireReady();

      assertThat(schemaManager.isReady()).isTrue();
      assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM photos", Integer.class))
          .isZero();
    }
  }

  @Nested
  @DisplayName("with an incompatible existing table")
  class IncompatibleTable {

    @BeforeEach
    void createLegacyTable() {
      jdbcTemplate.execute(
          "CREATE TABLE photos (id BIGINT AUTO_INCREMENT PRIMARY KEY, "
              + "file_path VARCHAR(500) NOT NULL)");
    }

    @Test
    @DisplayName("should fail naming the table and the missing columns")
    void shouldFailWithMissingColumns() {
      assertThatThrownBy(() -> schemaManager.ensureSchema())
          .isInstanceOf(SchemaException.class)
          .hasMessageContaining("photos")
          .hasMessageContaining("file_name")
          .hasFieldOrPropertyWithValue("tableName", "photos");
      assertThat(schemaManager.isReady()).isFalse();
    }

    @Test
    @DisplayName("should keep refusing operations after the failure")
    void shouldRethrowOnRequireReady() {
      SchemaException failure = null;
      try {
        schemaManager.ensureSchema();
      } catch (SchemaException e) {
        failure = e;
      }

      assertThat(failure).isNotNull();
      SchemaException expected = failure;
      assertThatThrownBy(() -> schemaManager.requireReady()).isSameAs(expected);
    }
  }

  @Test
  @DisplayName("should wrap connection failures in SchemaException")
  @SuppressWarnings("unchecked")
  void shouldWrapConnectionFailures() {
    JdbcTemplate brokenTemplate = mock(JdbcTemplate.class);
    when(brokenTemplate.execute(any(ConnectionCallback.class)))
        .thenThrow(new CannotGetJdbcConnectionException("Access denied for user"));
    SchemaManager manager = new SchemaManager(brokenTemplate);

    assertThatThrownBy(manager::ensureSchema)
        .isInstanceOf(SchemaException.class)
        .hasCauseInstanceOf(CannotGetJdbcConnectionException.class);
    assertThat(manager.isReady()).isFalse();
  }

  @Test
  @DisplayName("should be created by Spring from the JdbcTemplate bean alone")
  void shouldBeCreatedBySpring() {
    try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
      context.registerBean(JdbcTemplate.class, () -> jdbcTemplate);
      context.register(SchemaManager.class);
      context.refresh();

      SchemaManager manager = context.getBean(SchemaManager.class);
      manager.ensureSchema();
      assertThat(manager.isReady()).isTrue();
    }
  }
}
