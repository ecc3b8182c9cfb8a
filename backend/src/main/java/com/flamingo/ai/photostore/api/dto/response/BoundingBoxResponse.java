package com.flamingo.ai.photostore.api.dto.response;

import com.flamingo.ai.photostore.domain.entity.BoundingBox;
import com.flamingo.ai.photostore.domain.enums.BoxUnits;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a bounding box. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBoxResponse {

  private double x;
  private double y;
  private double width;
  private double height;
  private BoxUnits units;

  public static BoundingBoxResponse fromEntity(BoundingBox box) {
    return BoundingBoxResponse.builder()
        .x(box.getX())
        .y(box.getY())
        .width(box.getWidth())
        .height(box.getHeight())
        .units(box.getUnits())
        .build();
  }
}
