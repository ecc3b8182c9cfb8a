package com.flamingo.ai.photostore.service.query;

import com.flamingo.ai.photostore.api.dto.response.StoreStatistics;
import com.flamingo.ai.photostore.domain.entity.KnownFace;
import com.flamingo.ai.photostore.domain.entity.Photo;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Page;

/** Service interface for read-only photo queries. */
public interface PhotoQueryService {

  /**
   * Finds photos that contain every given class at least {@code minCount} times.
   *
   * @param classNames class labels; blanks and duplicates are ignored
   * @param minCount minimum detections per class, at least 1
   * @return photo IDs in ascending order
   * @throws com.flamingo.ai.photostore.exception.PhotoValidationException if no class is given or
   *     minCount is below 1
   */
  List<Long> searchByObjects(Collection<String> classNames, int minCount);

  /**
   * Finds photos with a recognized face of any of the given people.
   *
   * @return photo IDs in ascending order, without duplicates
   */
  List<Long> searchByFaces(Collection<String> names);

  /**
   * Finds photos taken with a camera, matching make and/or model case-insensitively.
   *
   * @return photo IDs in ascending order
   */
  List<Long> searchByCamera(String make, String model);

  /**
   * Gets everything stored for a photo.
   *
   * @throws com.flamingo.ai.photostore.exception.PhotoNotFoundException if not found
   */
  PhotoDetail getPhotoInfo(Long photoId);

  /** Finds a photo by its path. */
  Optional<Photo> findPhotoByPath(String filePath);

  /** Computes store-wide statistics with aggregate queries. */
  StoreStatistics getStatistics();

  /**
   * Lists photos ordered by ID.
   *
   * @param page zero-based page number
   * @param size page size, capped by configuration
   */
  Page<Photo> listPhotos(int page, int size);

  /** Lists all known face encodings ordered by ID. */
  List<KnownFace> listKnownFaces();
}
