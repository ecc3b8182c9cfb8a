package com.flamingo.ai.photostore.api.dto.response;

import com.flamingo.ai.photostore.service.query.PhotoDetail;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the complete metadata of one photo. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhotoDetailResponse {

  private PhotoResponse photo;
  private ExifResponse exif;
  private List<ObjectDetectionResponse> objects;
  private List<ObjectSummaryResponse> objectSummaries;
  private List<FaceDetectionResponse> faces;
  private FaceSummaryResponse faceSummary;

  /** Creates a PhotoDetailResponse from a PhotoDetail. */
  public static PhotoDetailResponse fromDetail(PhotoDetail detail) {
    return PhotoDetailResponse.builder()
        .photo(PhotoResponse.fromEntity(detail.photo()))
        .exif(detail.exif() != null ? ExifResponse.fromEntity(detail.exif()) : null)
        .objects(detail.objects().stream().map(ObjectDetectionResponse::fromEntity).toList())
        .objectSummaries(
            detail.objectSummaries().stream().map(ObjectSummaryResponse::fromEntity).toList())
        .faces(
            detail.faces().stream()
                .map(face -> FaceDetectionResponse.fromEntity(face, detail.matchedName(face)))
                .toList())
        .faceSummary(
            detail.faceSummary() != null
                ? FaceSummaryResponse.fromEntity(detail.faceSummary())
                : null)
        .build();
  }
}
