package com.flamingo.ai.photostore.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for enrolling a known face encoding. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrollFaceRequest {

  @NotBlank(message = "Name is required")
  @Size(max = 100, message = "Name must be at most 100 characters")
  private String name;

  @NotNull(message = "Encoding is required")
  private double[] encoding;

  /** Image the encoding was computed from; enrolling the same image again replaces it. */
  @Size(max = 500, message = "Image path must be at most 500 characters")
  private String imagePath;
}
