package com.flamingo.ai.photostore.exception;

/** Exception thrown when a known face is not found. */
public class KnownFaceNotFoundException extends RuntimeException {

  private final Long knownFaceId;

  public KnownFaceNotFoundException(Long knownFaceId) {
    super("Known face not found with ID: " + knownFaceId);
    this.knownFaceId = knownFaceId;
  }

  public Long getKnownFaceId() {
    return knownFaceId;
  }
}
