package com.flamingo.ai.photostore.domain.entity;

import jakarta.persistence.Column;
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
 * Per-class aggregate of a photo's object detections.
 *
 * <p>Always equal to {@code COUNT/AVG/MAX} over the {@link ObjectDetection} rows of the same photo
 * and class. Written only by the ingestion transaction that wrote those rows.
 */
@Entity
@Table(name = "object_summary")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObjectSummary {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "photo_id", nullable = false)
  private Long photoId;

  @Column(name = "class_label", nullable = false, length = 100)
  private String classLabel;

  @Column(name = "total_count", nullable = false)
  private int totalCount;

  @Column(name = "avg_confidence", nullable = false)
  private double avgConfidence;

  @Column(name = "max_confidence", nullable = false)
  private double maxConfidence;
}
