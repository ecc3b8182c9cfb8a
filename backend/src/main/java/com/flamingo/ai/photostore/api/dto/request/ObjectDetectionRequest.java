package com.flamingo.ai.photostore.api.dto.request;

import com.flamingo.ai.photostore.service.ingestion.RawObjectDetection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one detector result. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectDetectionRequest {

  @NotBlank(message = "Class label is required")
  private String classLabel;

  private Integer classId;

  @NotNull(message = "Confidence is required")
  private Double confidence;

  @NotNull(message = "Bounding box is required")
  @Valid
  private BoundingBoxRequest box;

  private String modelId;

  public RawObjectDetection toRaw() {
    return new RawObjectDetection(classLabel, classId, confidence, box.toBox(), modelId);
  }
}
