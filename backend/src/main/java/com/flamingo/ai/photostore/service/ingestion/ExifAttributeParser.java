package com.flamingo.ai.photostore.service.ingestion;

import com.flamingo.ai.photostore.domain.entity.ExifAttributes;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns the flat EXIF map handed over by the extractor into an {@link ExifAttributes} row.
 *
 * <p>Keys may be either normalized names ({@code camera_make}) or raw EXIF tag names ({@code
 * Make}). Numeric values may be numbers, numeric strings or rationals such as {@code "1/250"}.
 * Values that cannot be parsed, capture dates outside 1900-2100 and out-of-range GPS coordinates
 * are dropped; they never fail the ingestion.
 */
@Component
@Slf4j
public class ExifAttributeParser {

  private static final DateTimeFormatter EXIF_DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");
  private static final List<DateTimeFormatter> DATE_TIME_FORMATS =
      List.of(EXIF_DATE_TIME, DateTimeFormatter.ISO_DATE_TIME);
  private static final LocalDateTime EARLIEST_CAPTURE = LocalDate.of(1900, 1, 1).atStartOfDay();
  private static final LocalDateTime LATEST_CAPTURE = LocalDate.of(2101, 1, 1).atStartOfDay();

  /**
   * Parses the map.
   *
   * @return attributes without a photo id, or empty when no known attribute survived parsing
   */
  public Optional<ExifAttributes> parse(Map<String, ?> exif) {
    if (exif == null || exif.isEmpty()) {
      return Optional.empty();
    }

    ExifAttributes attributes =
        ExifAttributes.builder()
            .cameraMake(text(exif, 100, "camera_make", "Make"))
            .cameraModel(text(exif, 100, "camera_model", "Model"))
            .software(text(exif, 200, "software", "Software"))
            .capturedAt(captureTime(value(exif, "date_time_original", "DateTimeOriginal")))
            .exposureTime(positive(exif, "exposure_time", "ExposureTime"))
            .fNumber(positive(exif, "f_number", "FNumber"))
            .isoSpeed(iso(value(exif, "iso_speed", "ISOSpeedRatings")))
            .focalLength(positive(exif, "focal_length", "FocalLength"))
            .gpsLatitude(
                coordinate(
                    value(exif, "gps_latitude", "GPSLatitude"),
                    value(exif, "gps_latitude_ref", "GPSLatitudeRef"),
                    90.0))
            .gpsLongitude(
                coordinate(
                    value(exif, "gps_longitude", "GPSLongitude"),
                    value(exif, "gps_longitude_ref", "GPSLongitudeRef"),
                    180.0))
            .gpsAltitude(number(value(exif, "gps_altitude", "GPSAltitude")))
            .build();

    return isEmpty(attributes) ? Optional.empty() : Optional.of(attributes);
  }

  /** Parses a number, numeric string or rational string; null when not parsable. */
  Double number(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number n) {
      double d = n.doubleValue();
      return Double.isFinite(d) ? d : null;
    }
    String s = value.toString().trim();
    if (s.isEmpty()) {
      return null;
    }
    try {
      double result;
      int slash = s.indexOf('/');
      if (slash > 0) {
        double numerator = Double.parseDouble(s.substring(0, slash).trim());
        double denominator = Double.parseDouble(s.substring(slash + 1).trim());
        if (denominator == 0) {
          log.debug("Dropping EXIF rational with zero denominator: '{}'", s);
          return null;
        }
        result = numerator / denominator;
      } else {
        result = Double.parseDouble(s);
      }
      return Double.isFinite(result) ? result : null;
    } catch (NumberFormatException e) {
      log.debug("Dropping unparsable EXIF number '{}'", s);
      return null;
    }
  }

  /**
   * Parses a capture time in EXIF ({@code yyyy:MM:dd HH:mm:ss}) or ISO-8601 form.
   *
   * <p>Zeroed dates ({@code 0000:00:00 ...}) and dates outside 1900-2100 yield null.
   */
  LocalDateTime captureTime(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof LocalDateTime dateTime) {
      return inCaptureRange(dateTime, value);
    }
    String s = value.toString().trim();
    if (s.isEmpty() || s.startsWith("0000")) {
      log.debug("Dropping zeroed EXIF datetime '{}'", s);
      return null;
    }
    LocalDateTime parsed = parseDateTime(s);
    if (parsed == null) {
      log.debug("Could not parse EXIF datetime '{}'", s);
      return null;
    }
    return inCaptureRange(parsed, s);
  }

  /**
   * Parses a GPS coordinate given as decimal degrees or as a degrees/minutes/seconds list. A
   * hemisphere reference of {@code S} or {@code W} makes the value negative.
   */
  Double coordinate(Object value, Object ref, double limit) {
    Double decimal;
    if (value instanceof List<?> parts) {
      decimal = fromDegreesMinutesSeconds(parts);
    } else {
      decimal = number(value);
    }
    if (decimal == null) {
      return null;
    }
    if (ref != null) {
      String hemisphere = ref.toString().trim().toUpperCase();
      if (hemisphere.equals("S") || hemisphere.equals("W")) {
        decimal = -Math.abs(decimal);
      }
    }
    if (Math.abs(decimal) > limit) {
      log.debug("Dropping out-of-range GPS coordinate {}", decimal);
      return null;
    }
    return decimal;
  }

  private Double fromDegreesMinutesSeconds(List<?> parts) {
    if (parts.size() != 3) {
      return null;
    }
    Double degrees = number(parts.get(0));
    Double minutes = number(parts.get(1));
    Double seconds = number(parts.get(2));
    if (degrees == null || minutes == null || seconds == null) {
      return null;
    }
    return degrees + minutes / 60.0 + seconds / 3600.0;
  }

  private LocalDateTime parseDateTime(String s) {
    for (DateTimeFormatter formatter : DATE_TIME_FORMATS) {
      try {
        return formatter.parse(s, LocalDateTime::from);
      } catch (DateTimeParseException e) {
        log.trace("'{}' does not match {}", s, formatter);
      }
    }
    return null;
  }

  private LocalDateTime inCaptureRange(LocalDateTime dateTime, Object original) {
    if (dateTime.isBefore(EARLIEST_CAPTURE) || !dateTime.isBefore(LATEST_CAPTURE)) {
      log.debug("EXIF datetime out of range: '{}'", original);
      return null;
    }
    return dateTime;
  }

  private Double positive(Map<String, ?> exif, String... keys) {
    Double value = number(value(exif, keys));
    if (value != null && value <= 0) {
      log.debug("Dropping non-positive EXIF value {} for {}", value, keys[0]);
      return null;
    }
    return value;
  }

  private Integer iso(Object value) {
    // ISOSpeedRatings may be reported as a list; the first entry is the effective speed.
    Object first = value instanceof List<?> list && !list.isEmpty() ? list.get(0) : value;
    Double number = number(first);
    if (number == null || number <= 0 || number > Integer.MAX_VALUE) {
      return null;
    }
    return (int) Math.round(number);
  }

  private String text(Map<String, ?> exif, int maxLength, String... keys) {
    Object value = value(exif, keys);
    if (value == null) {
      return null;
    }
    // Camera strings are often NUL padded.
    String s = value.toString().replace("\u0000", "").trim();
    if (s.isEmpty()) {
      return null;
    }
    return s.length() > maxLength ? s.substring(0, maxLength) : s;
  }

  private Object value(Map<String, ?> exif, String... keys) {
    for (String key : keys) {
      Object value = exif.get(key);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  private boolean isEmpty(ExifAttributes a) {
    return a.getCameraMake() == null
        && a.getCameraModel() == null
        && a.getSoftware() == null
        && a.getCapturedAt() == null
        && a.getExposureTime() == null
        && a.getFNumber() == null
        && a.getIsoSpeed() == null
        && a.getFocalLength() == null
        && a.getGpsLatitude() == null
        && a.getGpsLongitude() == null
        && a.getGpsAltitude() == null;
  }
}
