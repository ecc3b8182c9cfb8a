package com.flamingo.ai.photostore.exception;

/** Exception thrown when a photo is not found. */
public class PhotoNotFoundException extends RuntimeException {

  private final Long photoId;

  public PhotoNotFoundException(Long photoId) {
    super("Photo not found: " + photoId);
    this.photoId = photoId;
  }

  public Long getPhotoId() {
    return photoId;
  }
}
