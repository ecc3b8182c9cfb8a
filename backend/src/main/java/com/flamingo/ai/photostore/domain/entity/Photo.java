package com.flamingo.ai.photostore.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A photo file known to the store; the aggregation root of all per-photo metadata. */
@Entity
@Table(name = "photos")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Photo {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "file_path", nullable = false, unique = true, length = 500)
  private String filePath;

  @Column(name = "file_name", nullable = false, length = 500)
  private String fileName;

  @Column(name = "file_size")
  private Long fileSize;

  @Column(length = 50)
  private String format;

  private Integer width;

  private Integer height;

  /** Identifier of the analysis model that produced the current metadata. */
  @Column(name = "processing_model", length = 100)
  private String processingModel;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at", nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  /** Replaces the file attributes after the photo has been processed again. */
  public void refreshFileMetadata(
      Long fileSize, String format, Integer width, Integer height, String processingModel) {
    this.fileSize = fileSize;
    this.format = format;
    this.width = width;
    this.height = height;
    this.processingModel = processingModel;
    this.updatedAt = LocalDateTime.now();
  }
}
