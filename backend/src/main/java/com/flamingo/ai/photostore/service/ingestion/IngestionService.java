package com.flamingo.ai.photostore.service.ingestion;

import java.util.List;
import java.util.Map;

/**
 * Service interface for writing photo metadata.
 *
 * <p>Every method runs in its own transaction and either commits completely or leaves the store
 * untouched. Input is expected to have passed {@link IngestionValidator}.
 */
public interface IngestionService {

  /**
   * Stores the metadata of one photo, replacing everything previously stored for the same path.
   *
   * @param filePath unique photo path
   * @param fileMetadata file attributes, may be null
   * @param exif flat EXIF map, may be null
   * @param objectDetections detector output
   * @param faceDetections face engine output
   * @return the photo ID
   * @throws com.flamingo.ai.photostore.exception.PhotoValidationException if a face names an
   *     unknown person
   * @throws com.flamingo.ai.photostore.exception.StorageException if a concurrent writer created
   *     the same path first
   */
  Long ingest(
      String filePath,
      FileMetadata fileMetadata,
      Map<String, ?> exif,
      List<RawObjectDetection> objectDetections,
      List<RawFaceDetection> faceDetections);

  /**
   * Enrolls a reference encoding for a person. An existing row for the same source image is
   * replaced.
   *
   * @return the known face ID
   */
  Long enrollKnownFace(String name, double[] encoding, String sourceImagePath);

  /**
   * Deletes a photo and all its metadata.
   *
   * @throws com.flamingo.ai.photostore.exception.PhotoNotFoundException if not found
   */
  void deletePhoto(Long photoId);

  /**
   * Deletes a known face. Faces matched to it become unrecognized and the affected face summaries
   * are recomputed.
   *
   * @throws com.flamingo.ai.photostore.exception.KnownFaceNotFoundException if not found
   */
  void deleteKnownFace(Long knownFaceId);
}
