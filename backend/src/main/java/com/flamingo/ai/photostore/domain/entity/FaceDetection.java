package com.flamingo.ai.photostore.domain.entity;

import com.flamingo.ai.photostore.domain.converter.EncodingConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
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

/** A face located in a photo, optionally matched to a {@link KnownFace}. */
@Entity
@Table(name = "face_detections")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FaceDetection {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "photo_id", nullable = false)
  private Long photoId;

  @Embedded private BoundingBox box;

  /** Matched identity; {@code null} means the face was not recognized. */
  @Column(name = "known_face_id")
  private Long knownFaceId;

  @Column(name = "match_confidence")
  private Double matchConfidence;

  @Convert(converter = EncodingConverter.class)
  @Column(columnDefinition = "TEXT")
  private double[] encoding;

  @Column(name = "model_id", length = 100)
  private String modelId;

  public boolean isRecognized() {
    return knownFaceId != null;
  }
}
