package com.flamingo.ai.photostore.api.dto.response;

import com.flamingo.ai.photostore.domain.entity.FaceDetection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored face detection. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FaceDetectionResponse {

  private Long id;
  private BoundingBoxResponse box;
  private Long knownFaceId;
  private String matchedName;
  private Double matchConfidence;
  private boolean hasEncoding;
  private String modelId;

  /**
   * Creates a FaceDetectionResponse.
   *
   * @param matchedName name of the matched known face, null for unrecognized faces
   */
  public static FaceDetectionResponse fromEntity(FaceDetection detection, String matchedName) {
    return FaceDetectionResponse.builder()
        .id(detection.getId())
        .box(BoundingBoxResponse.fromEntity(detection.getBox()))
        .knownFaceId(detection.getKnownFaceId())
        .matchedName(matchedName)
        .matchConfidence(detection.getMatchConfidence())
        .hasEncoding(detection.getEncoding() != null)
        .modelId(detection.getModelId())
        .build();
  }
}
