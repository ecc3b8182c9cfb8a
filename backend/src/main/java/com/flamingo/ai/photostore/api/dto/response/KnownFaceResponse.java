package com.flamingo.ai.photostore.api.dto.response;

import com.flamingo.ai.photostore.domain.entity.KnownFace;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an enrolled face encoding. The encoding itself is not returned. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnownFaceResponse {

  private Long id;
  private String name;
  private String imagePath;
  private int encodingLength;
  private LocalDateTime createdAt;

  public static KnownFaceResponse fromEntity(KnownFace knownFace) {
    return KnownFaceResponse.builder()
        .id(knownFace.getId())
        .name(knownFace.getName())
        .imagePath(knownFace.getImagePath())
        .encodingLength(knownFace.getEncoding() != null ? knownFace.getEncoding().length : 0)
        .createdAt(knownFace.getCreatedAt())
        .build();
  }
}
