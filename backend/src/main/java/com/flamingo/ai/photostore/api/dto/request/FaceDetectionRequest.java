package com.flamingo.ai.photostore.api.dto.request;

import com.flamingo.ai.photostore.service.ingestion.RawFaceDetection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one face engine result. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FaceDetectionRequest {

  @NotNull(message = "Bounding box is required")
  @Valid
  private BoundingBoxRequest box;

  private double[] encoding;

  /** Name of the enrolled person the face was matched to; omit for unrecognized faces. */
  private String matchedName;

  private Double matchConfidence;
  private String modelId;

  public RawFaceDetection toRaw() {
    return new RawFaceDetection(box.toBox(), encoding, matchedName, matchConfidence, modelId);
  }
}
