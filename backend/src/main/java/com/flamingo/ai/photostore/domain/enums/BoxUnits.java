package com.flamingo.ai.photostore.domain.enums;

/** Coordinate space of a stored bounding box. */
public enum BoxUnits {
  /** Absolute pixel coordinates in the source image. */
  PIXEL,

  /** Coordinates relative to image width/height, each within [0, 1]. */
  NORMALIZED
}
