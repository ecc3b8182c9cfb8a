package com.flamingo.ai.photostore.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO returned after a photo was ingested. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestPhotoResponse {
  private Long photoId;
  private String filePath;
}
