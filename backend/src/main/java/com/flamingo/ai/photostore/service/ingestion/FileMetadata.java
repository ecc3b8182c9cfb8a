package com.flamingo.ai.photostore.service.ingestion;

/**
 * File-level attributes of a processed photo.
 *
 * @param sizeBytes file size in bytes
 * @param format image format, e.g. {@code JPEG}
 * @param width image width in pixels, when known
 * @param height image height in pixels, when known
 * @param processingModel identifier of the model that produced the detections, when known
 */
public record FileMetadata(
    Long sizeBytes, String format, Integer width, Integer height, String processingModel) {

  public static FileMetadata empty() {
    return new FileMetadata(null, null, null, null, null);
  }
}
