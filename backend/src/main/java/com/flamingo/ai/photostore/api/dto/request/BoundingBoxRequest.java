package com.flamingo.ai.photostore.api.dto.request;

import com.flamingo.ai.photostore.domain.entity.BoundingBox;
import com.flamingo.ai.photostore.domain.enums.BoxUnits;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a bounding box. Units default to pixels. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBoxRequest {

  @NotNull(message = "x is required")
  private Double x;

  @NotNull(message = "y is required")
  private Double y;

  @NotNull(message = "width is required")
  private Double width;

  @NotNull(message = "height is required")
  private Double height;

  private BoxUnits units;

  public BoundingBox toBox() {
    return new BoundingBox(x, y, width, height, units != null ? units : BoxUnits.PIXEL);
  }
}
