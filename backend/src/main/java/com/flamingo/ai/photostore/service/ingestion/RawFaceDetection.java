package com.flamingo.ai.photostore.service.ingestion;

import com.flamingo.ai.photostore.domain.entity.BoundingBox;

/**
 * One face reported by the external face engine, before validation.
 *
 * @param box face region
 * @param encoding face embedding, or {@code null} when the engine did not return one
 * @param matchedName name of the enrolled person the face was matched to, or {@code null}
 * @param matchConfidence confidence of the match, only meaningful with a matched name
 * @param modelId identifier of the face model
 */
public record RawFaceDetection(
    BoundingBox box,
    double[] encoding,
    String matchedName,
    Double matchConfidence,
    String modelId) {

  public boolean isMatched() {
    return matchedName != null && !matchedName.isBlank();
  }
}
