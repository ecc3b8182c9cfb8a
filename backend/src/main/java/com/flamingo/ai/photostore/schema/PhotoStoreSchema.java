package com.flamingo.ai.photostore.schema;

import java.util.List;

/**
 * Table and index definitions of the photo metadata store.
 *
 * <p>DDL is written for MySQL/InnoDB and also runs on H2 in MySQL mode. Tables are listed in
 * dependency order.
 */
public final class PhotoStoreSchema {

  public static final TableDefinition PHOTOS =
      new TableDefinition(
          "photos",
          List.of(
              "id",
              "file_path",
              "file_name",
              "file_size",
              "format",
              "width",
              "height",
              "processing_model",
              "created_at",
              "updated_at"),
          """
          CREATE TABLE IF NOT EXISTS photos (
            id BIGINT AUTO_INCREMENT PRIMARY KEY,
            file_path VARCHAR(500) NOT NULL,
            file_name VARCHAR(500) NOT NULL,
            file_size BIGINT,
            format VARCHAR(50),
            width INT,
            height INT,
            processing_model VARCHAR(100),
            created_at DATETIME(6) NOT NULL,
            updated_at DATETIME(6) NOT NULL
          )""");

  public static final TableDefinition EXIF_DATA =
      new TableDefinition(
          "exif_data",
          List.of(
              "id",
              "photo_id",
              "camera_make",
              "camera_model",
              "software",
              "exposure_time",
              "f_number",
              "iso_speed",
              "focal_length",
              "gps_latitude",
              "gps_longitude",
              "gps_altitude",
              "captured_at"),
          """
          CREATE TABLE IF NOT EXISTS exif_data (
            id BIGINT AUTO_INCREMENT PRIMARY KEY,
            photo_id BIGINT NOT NULL,
            camera_make VARCHAR(100),
            camera_model VARCHAR(100),
            software VARCHAR(200),
            exposure_time DOUBLE,
            f_number DOUBLE,
            iso_speed INT,
            focal_length DOUBLE,
            gps_latitude DOUBLE,
            gps_longitude DOUBLE,
            gps_altitude DOUBLE,
            captured_at DATETIME(6),
            CONSTRAINT fk_exif_data_photo FOREIGN KEY (photo_id)
              REFERENCES photos (id) ON DELETE CASCADE
          )""");

  public static final TableDefinition OBJECT_DETECTIONS =
      new TableDefinition(
          "object_detections",
          List.of(
              "id",
              "photo_id",
              "class_label",
              "class_id",
              "confidence",
              "bbox_x",
              "bbox_y",
              "bbox_width",
              "bbox_height",
              "bbox_units",
              "model_id"),
          """
          CREATE TABLE IF NOT EXISTS object_detections (
            id BIGINT AUTO_INCREMENT PRIMARY KEY,
            photo_id BIGINT NOT NULL,
            class_label VARCHAR(100) NOT NULL,
            class_id INT,
            confidence DOUBLE NOT NULL,
            bbox_x DOUBLE NOT NULL,
            bbox_y DOUBLE NOT NULL,
            bbox_width DOUBLE NOT NULL,
            bbox_height DOUBLE NOT NULL,
            bbox_units VARCHAR(16) NOT NULL,
            model_id VARCHAR(100),
            CONSTRAINT fk_object_detections_photo FOREIGN KEY (photo_id)
              REFERENCES photos (id) ON DELETE CASCADE
          )""");

  public static final TableDefinition OBJECT_SUMMARY =
      new TableDefinition(
          "object_summary",
          List.of(
              "id", "photo_id", "class_label", "total_count", "avg_confidence", "max_confidence"),
          """
          CREATE TABLE IF NOT EXISTS object_summary (
            id BIGINT AUTO_INCREMENT PRIMARY KEY,
            photo_id BIGINT NOT NULL,
            class_label VARCHAR(100) NOT NULL,
            total_count INT NOT NULL,
            avg_confidence DOUBLE NOT NULL,
            max_confidence DOUBLE NOT NULL,
            CONSTRAINT fk_object_summary_photo FOREIGN KEY (photo_id)
              REFERENCES photos (id) ON DELETE CASCADE
          )""");

  public static final TableDefinition KNOWN_FACES =
      new TableDefinition(
          "known_faces",
          List.of("id", "name", "encoding", "image_path", "created_at"),
          """
          CREATE TABLE IF NOT EXISTS known_faces (
            id BIGINT AUTO_INCREMENT PRIMARY KEY,
            name VARCHAR(100) NOT NULL,
            encoding TEXT NOT NULL,
            image_path VARCHAR(500),
            created_at DATETIME(6) NOT NULL
          )""");

  public static final TableDefinition FACE_DETECTIONS =
      new TableDefinition(
          "face_detections",
          List.of(
              "id",
              "photo_id",
              "known_face_id",
              "match_confidence",
              "encoding",
              "bbox_x",
              "bbox_y",
              "bbox_width",
              "bbox_height",
              "bbox_units",
              "model_id"),
          """
          CREATE TABLE IF NOT EXISTS face_detections (
            id BIGINT AUTO_INCREMENT PRIMARY KEY,
            photo_id BIGINT NOT NULL,
            known_face_id BIGINT,
            match_confidence DOUBLE,
            encoding TEXT,
            bbox_x DOUBLE NOT NULL,
            bbox_y DOUBLE NOT NULL,
            bbox_width DOUBLE NOT NULL,
            bbox_height DOUBLE NOT NULL,
            bbox_units VARCHAR(16) NOT NULL,
            model_id VARCHAR(100),
            CONSTRAINT fk_face_detections_photo FOREIGN KEY (photo_id)
              REFERENCES photos (id) ON DELETE CASCADE,
            CONSTRAINT fk_face_detections_known_face FOREIGN KEY (known_face_id)
              REFERENCES known_faces (id) ON DELETE SET NULL
          )""");

  public static final TableDefinition FACE_SUMMARY =
      new TableDefinition(
          "face_summary",
          List.of("id", "photo_id", "total_faces", "recognized_faces", "unrecognized_faces"),
          """
          CREATE TABLE IF NOT EXISTS face_summary (
            id BIGINT AUTO_INCREMENT PRIMARY KEY,
            photo_id BIGINT NOT NULL,
            total_faces INT NOT NULL,
            recognized_faces INT NOT NULL,
            unrecognized_faces INT NOT NULL,
            CONSTRAINT fk_face_summary_photo FOREIGN KEY (photo_id)
              REFERENCES photos (id) ON DELETE CASCADE
          )""");

  public static final List<TableDefinition> TABLES =
      List.of(
          PHOTOS,
          EXIF_DATA,
          OBJECT_DETECTIONS,
          OBJECT_SUMMARY,
          KNOWN_FACES,
          FACE_DETECTIONS,
          FACE_SUMMARY);

  /** Unique index that makes {@code file_path} the photo's natural key. */
  public static final String PHOTO_PATH_INDEX = "uq_photos_file_path";

  public static final List<IndexDefinition> INDEXES =
      List.of(
          new IndexDefinition(PHOTO_PATH_INDEX, "photos", List.of("file_path"), true),
          new IndexDefinition("uq_exif_data_photo", "exif_data", List.of("photo_id"), true),
          new IndexDefinition(
              "idx_exif_data_camera", "exif_data", List.of("camera_make", "camera_model"), false),
          new IndexDefinition(
              "idx_object_detections_photo", "object_detections", List.of("photo_id"), false),
          new IndexDefinition(
              "idx_object_detections_class", "object_detections", List.of("class_label"), false),
          new IndexDefinition(
              "uq_object_summary_photo_class",
              "object_summary",
              List.of("photo_id", "class_label"),
              true),
          new IndexDefinition(
              "idx_object_summary_class", "object_summary", List.of("class_label"), false),
          new IndexDefinition("idx_known_faces_name", "known_faces", List.of("name"), false),
          new IndexDefinition(
              "uq_known_faces_image_path", "known_faces", List.of("image_path"), true),
          new IndexDefinition(
              "idx_face_detections_photo", "face_detections", List.of("photo_id"), false),
          new IndexDefinition(
              "idx_face_detections_known_face",
              "face_detections",
              List.of("known_face_id"),
              false),
          new IndexDefinition("uq_face_summary_photo", "face_summary", List.of("photo_id"), true));

  private PhotoStoreSchema() {}
}
