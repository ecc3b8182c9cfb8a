package com.flamingo.ai.photostore.api.dto.response;

import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for store-wide statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreStatistics {
  private long totalPhotos;
  private long totalObjectDetections;
  private List<ClassCount> topClasses;
  private long photosWithGps;
  private long totalFaces;
  private long recognizedFaces;
  private long unrecognizedFaces;
  private long knownFaceEncodings;
  private long knownIdentities;
  private LocalDateTime timestamp;
}
