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

/** Face counts of one photo, derived from its {@link FaceDetection} rows. */
@Entity
@Table(name = "face_summary")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FaceSummary {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "photo_id", nullable = false, unique = true)
  private Long photoId;

  @Column(name = "total_faces", nullable = false)
  private int totalFaces;

  @Column(name = "recognized_faces", nullable = false)
  private int recognizedFaces;

  @Column(name = "unrecognized_faces", nullable = false)
  private int unrecognizedFaces;
}
