package com.flamingo.ai.photostore.api.dto.response;

import com.flamingo.ai.photostore.domain.entity.Photo;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for photo data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhotoResponse {

  private Long id;
  private String filePath;
  private String fileName;
  private Long fileSize;
  private String format;
  private Integer width;
  private Integer height;
  private String processingModel;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a PhotoResponse from a Photo entity. */
  public static PhotoResponse fromEntity(Photo photo) {
    return PhotoResponse.builder()
        .id(photo.getId())
        .filePath(photo.getFilePath())
        .fileName(photo.getFileName())
        .fileSize(photo.getFileSize())
        .format(photo.getFormat())
        .width(photo.getWidth())
        .height(photo.getHeight())
        .processingModel(photo.getProcessingModel())
        .createdAt(photo.getCreatedAt())
        .updatedAt(photo.getUpdatedAt())
        .build();
  }
}
