package com.flamingo.ai.photostore.api.dto.response;

import com.flamingo.ai.photostore.domain.entity.FaceSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the face counts of a photo. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FaceSummaryResponse {

  private int totalFaces;
  private int recognizedFaces;
  private int unrecognizedFaces;

  public static FaceSummaryResponse fromEntity(FaceSummary summary) {
    return FaceSummaryResponse.builder()
        .totalFaces(summary.getTotalFaces())
        .recognizedFaces(summary.getRecognizedFaces())
        .unrecognizedFaces(summary.getUnrecognizedFaces())
        .build();
  }
}
