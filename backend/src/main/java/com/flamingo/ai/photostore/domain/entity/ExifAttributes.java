package com.flamingo.ai.photostore.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Camera and capture attributes read from a photo's EXIF block. At most one row per photo. */
@Entity
@Table(name = "exif_data")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExifAttributes {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "photo_id", nullable = false, unique = true)
  private Long photoId;

  @Column(name = "camera_make", length = 100)
  private String cameraMake;

  @Column(name = "camera_model", length = 100)
  private String cameraModel;

  @Column(length = 200)
  private String software;

  /** Exposure time in seconds. */
  @Column(name = "exposure_time")
  private Double exposureTime;

  @Column(name = "f_number")
  private Double fNumber;

  @Column(name = "iso_speed")
  private Integer isoSpeed;

  /** Focal length in millimetres. */
  @Column(name = "focal_length")
  private Double focalLength;

  @Column(name = "gps_latitude")
  private Double gpsLatitude;

  @Column(name = "gps_longitude")
  private Double gpsLongitude;

  @Column(name = "gps_altitude")
  private Double gpsAltitude;

  @Column(name = "captured_at")
  private LocalDateTime capturedAt;

  /** Returns true when both GPS coordinates are present. */
  public boolean hasGps() {
    return gpsLatitude != null && gpsLongitude != null;
  }
}
