package com.flamingo.ai.photostore.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A single object found in a photo by a detector.
 *
 * <p>Rows are written in bulk for one photo and never updated; re-processing the photo replaces
 * the whole set.
 */
@Entity
@Table(name = "object_detections")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObjectDetection {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "photo_id", nullable = false)
  private Long photoId;

  @Column(name = "class_label", nullable = false, length = 100)
  private String classLabel;

  /** Numeric class index of the detector's label set, when it reports one. */
  @Column(name = "class_id")
  private Integer classId;

  @Column(nullable = false)
  private double confidence;

  @Embedded private BoundingBox box;

  @Column(name = "model_id", length = 100)
  private String modelId;
}
