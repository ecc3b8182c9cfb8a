package com.flamingo.ai.photostore.domain.entity;

import com.flamingo.ai.photostore.domain.enums.BoxUnits;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Axis-aligned region inside a photo, shared by object and face detections.
 *
 * <p>{@link #units} records whether the coordinates are pixels or fractions of the image size.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BoundingBox {

  @Column(name = "bbox_x", nullable = false)
  private double x;

  @Column(name = "bbox_y", nullable = false)
  private double y;

  @Column(name = "bbox_width", nullable = false)
  private double width;

  @Column(name = "bbox_height", nullable = false)
  private double height;

  @Enumerated(EnumType.STRING)
  @Column(name = "bbox_units", nullable = false, length = 16)
  private BoxUnits units;

  /** Creates a pixel-space box. */
  public static BoundingBox pixels(double x, double y, double width, double height) {
    return new BoundingBox(x, y, width, height, BoxUnits.PIXEL);
  }

  /** Creates a box with coordinates relative to the image size. */
  public static BoundingBox normalized(double x, double y, double width, double height) {
    return new BoundingBox(x, y, width, height, BoxUnits.NORMALIZED);
  }

  /** Returns an independent copy, so input objects are never shared between entities. */
  public BoundingBox copy() {
    return new BoundingBox(x, y, width, height, units);
  }
}
