package com.flamingo.ai.photostore.service.store;

import com.flamingo.ai.photostore.api.dto.response.StoreStatistics;
import com.flamingo.ai.photostore.domain.entity.KnownFace;
import com.flamingo.ai.photostore.domain.entity.Photo;
import com.flamingo.ai.photostore.service.ingestion.FileMetadata;
import com.flamingo.ai.photostore.service.ingestion.RawFaceDetection;
import com.flamingo.ai.photostore.service.ingestion.RawObjectDetection;
import com.flamingo.ai.photostore.service.query.PhotoDetail;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.data.domain.Page;

/**
 * Single entry point to the photo metadata store.
 *
 * <p>Every operation first checks that the schema has been verified and fails with {@link
 * com.flamingo.ai.photostore.exception.SchemaException} otherwise. Database failures surface as
 * {@link com.flamingo.ai.photostore.exception.StorageException}.
 */
public interface PhotoMetadataStore {

  /**
   * Stores the metadata of one photo, replacing whatever was stored for the same path.
   *
   * @return the photo ID
   * @throws com.flamingo.ai.photostore.exception.PhotoValidationException if the input is
   *     malformed; nothing is written
   */
  Long ingestPhoto(
      String filePath,
      FileMetadata fileMetadata,
      Map<String, ?> exif,
      List<RawObjectDetection> objectDetections,
      List<RawFaceDetection> faceDetections);

  /**
   * Enrolls a reference encoding for a person.
   *
   * @return the known face ID
   */
  Long enrollKnownFace(String name, double[] encoding, String sourceImagePath);

  void deletePhoto(Long photoId);

  void deleteKnownFace(Long knownFaceId);

  List<Long> searchByObjects(Collection<String> classNames, int minCount);

  List<Long> searchByFaces(Collection<String> names);

  List<Long> searchByCamera(String make, String model);

  PhotoDetail getPhotoInfo(Long photoId);

  Optional<Photo> findPhotoByPath(String filePath);

  StoreStatistics getStatistics();

  Page<Photo> listPhotos(int page, int size);

  List<KnownFace> listKnownFaces();
}
