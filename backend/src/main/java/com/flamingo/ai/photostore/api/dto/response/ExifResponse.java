package com.flamingo.ai.photostore.api.dto.response;

import com.flamingo.ai.photostore.domain.entity.ExifAttributes;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for EXIF attributes. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExifResponse {

  private String cameraMake;
  private String cameraModel;
  private String software;
  private LocalDateTime capturedAt;
  private Double exposureTime;

  /** The f-number. */
  private Double aperture;

  private Integer isoSpeed;
  private Double focalLength;
  private Double gpsLatitude;
  private Double gpsLongitude;
  private Double gpsAltitude;

  public static ExifResponse fromEntity(ExifAttributes exif) {
    return ExifResponse.builder()
        .cameraMake(exif.getCameraMake())
        .cameraModel(exif.getCameraModel())
        .software(exif.getSoftware())
        .capturedAt(exif.getCapturedAt())
        .exposureTime(exif.getExposureTime())
        .aperture(exif.getFNumber())
        .isoSpeed(exif.getIsoSpeed())
        .focalLength(exif.getFocalLength())
        .gpsLatitude(exif.getGpsLatitude())
        .gpsLongitude(exif.getGpsLongitude())
        .gpsAltitude(exif.getGpsAltitude())
        .build();
  }
}
