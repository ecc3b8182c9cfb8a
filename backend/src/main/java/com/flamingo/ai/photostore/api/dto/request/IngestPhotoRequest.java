package com.flamingo.ai.photostore.api.dto.request;

import com.flamingo.ai.photostore.service.ingestion.FileMetadata;
import com.flamingo.ai.photostore.service.ingestion.RawFaceDetection;
import com.flamingo.ai.photostore.service.ingestion.RawObjectDetection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO carrying everything the analysis steps produced for one photo. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestPhotoRequest {

  @NotBlank(message = "File path is required")
  @Size(max = 500, message = "File path must be at most 500 characters")
  private String filePath;

  private Long fileSize;
  private String format;
  private Integer width;
  private Integer height;
  private String processingModel;

  /** Flat EXIF map keyed by normalized or raw EXIF tag names. */
  private Map<String, Object> exif;

  @Valid private List<ObjectDetectionRequest> objects;

  @Valid private List<FaceDetectionRequest> faces;

  public FileMetadata toFileMetadata() {
    return new FileMetadata(fileSize, format, width, height, processingModel);
  }

  /** Null entries are kept so that validation reports them by position. */
  public List<RawObjectDetection> toObjectDetections() {
    return objects != null
        ? objects.stream().map(o -> o != null ? o.toRaw() : null).toList()
        : List.of();
  }

  public List<RawFaceDetection> toFaceDetections() {
    return faces != null
        ? faces.stream().map(f -> f != null ? f.toRaw() : null).toList()
        : List.of();
  }
}
