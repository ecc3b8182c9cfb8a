package com.flamingo.ai.photostore.service.store;

import static org.assertj.core.api.Assertions.assertThat;

import org.springframework.jdbc.core.JdbcTemplate;

/** SQL checks shared by the store integration tests. */
final class StoreInvariants {

  private static final String[] TABLES_IN_DELETE_ORDER = {
    "face_summary",
    "face_detections",
    "object_summary",
    "object_detections",
    "exif_data",
    "photos",
    "known_faces"
  };

  private StoreInvariants() {}

  static void clear(JdbcTemplate jdbcTemplate) {
    for (String table : TABLES_IN_DELETE_ORDER) {
      jdbcTemplate.update("DELETE FROM " + table);
    }
  }

  /** Asserts that every summary row agrees with the detection rows it was built from. */
  static void assertSummariesConsistent(JdbcTemplate jdbcTemplate) {
    assertThat(
            count(
                jdbcTemplate,
                "SELECT COUNT(*) FROM object_summary s WHERE s.total_count <> "
                    + "(SELECT COUNT(*) FROM object_detections d "
                    + "WHERE d.photo_id = s.photo_id AND d.class_label = s.class_label)"))
        .as("object summaries with a wrong count")
        .isZero();
    assertThat(
            count(
                jdbcTemplate,
                "SELECT COUNT(*) FROM (SELECT DISTINCT photo_id, class_label "
                    + "FROM object_detections) d WHERE NOT EXISTS (SELECT 1 FROM object_summary s "
                    + "WHERE s.photo_id = d.photo_id AND s.class_label = d.class_label)"))
        .as("detected classes without a summary row")
        .isZero();
    assertThat(
            count(
                jdbcTemplate,
                "SELECT COUNT(*) FROM face_summary s WHERE "
                    + "s.total_faces <> (SELECT COUNT(*) FROM face_detections f "
                    + "WHERE f.photo_id = s.photo_id) "
                    + "OR s.recognized_faces <> (SELECT COUNT(*) FROM face_detections f "
                    + "WHERE f.photo_id = s.photo_id AND f.known_face_id IS NOT NULL) "
                    + "OR s.unrecognized_faces <> (SELECT COUNT(*) FROM face_detections f "
                    + "WHERE f.photo_id = s.photo_id AND f.known_face_id IS NULL)"))
        .as("face summaries with wrong counts")
        .isZero();
    assertThat(
            count(
                jdbcTemplate,
                "SELECT COUNT(*) FROM photos p WHERE NOT EXISTS "
                    + "(SELECT 1 FROM face_summary s WHERE s.photo_id = p.id)"))
        .as("photos without a face summary")
        .isZero();
  }

  static long count(JdbcTemplate jdbcTemplate, String sql, Object... args) {
    Long count = jdbcTemplate.queryForObject(sql, Long.class, args);
    return count != null ? count : 0L;
  }
}
