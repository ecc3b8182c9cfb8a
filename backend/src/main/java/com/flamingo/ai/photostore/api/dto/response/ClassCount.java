package com.flamingo.ai.photostore.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A class label with its number of detections across all photos. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassCount {
  private String classLabel;
  private long count;
}
