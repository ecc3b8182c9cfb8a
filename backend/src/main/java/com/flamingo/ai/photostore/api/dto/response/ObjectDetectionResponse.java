package com.flamingo.ai.photostore.api.dto.response;

import com.flamingo.ai.photostore.domain.entity.ObjectDetection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored object detection. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectDetectionResponse {

  private Long id;
  private String classLabel;
  private Integer classId;
  private double confidence;
  private BoundingBoxResponse box;
  private String modelId;

  public static ObjectDetectionResponse fromEntity(ObjectDetection detection) {
    return ObjectDetectionResponse.builder()
        .id(detection.getId())
        .classLabel(detection.getClassLabel())
        .classId(detection.getClassId())
        .confidence(detection.getConfidence())
        .box(BoundingBoxResponse.fromEntity(detection.getBox()))
        .modelId(detection.getModelId())
        .build();
  }
}
