package com.flamingo.ai.photostore.api.dto.response;

import com.flamingo.ai.photostore.domain.entity.ObjectSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the per-class summary of a photo. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectSummaryResponse {

  private String classLabel;
  private int totalCount;
  private double avgConfidence;
  private double maxConfidence;

  public static ObjectSummaryResponse fromEntity(ObjectSummary summary) {
    return ObjectSummaryResponse.builder()
        .classLabel(summary.getClassLabel())
        .totalCount(summary.getTotalCount())
        .avgConfidence(summary.getAvgConfidence())
        .maxConfidence(summary.getMaxConfidence())
        .build();
  }
}
