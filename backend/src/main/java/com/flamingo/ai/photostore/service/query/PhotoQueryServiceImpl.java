package com.flamingo.ai.photostore.service.query;

import com.flamingo.ai.photostore.api.dto.response.ClassCount;
import com.flamingo.ai.photostore.api.dto.response.StoreStatistics;
import com.flamingo.ai.photostore.config.PhotoStoreConfig;
import com.flamingo.ai.photostore.domain.entity.FaceDetection;
import com.flamingo.ai.photostore.domain.entity.KnownFace;
import com.flamingo.ai.photostore.domain.entity.Photo;
import com.flamingo.ai.photostore.domain.repository.ExifAttributesRepository;
import com.flamingo.ai.photostore.domain.repository.FaceDetectionRepository;
import com.flamingo.ai.photostore.domain.repository.FaceSummaryRepository;
import com.flamingo.ai.photostore.domain.repository.KnownFaceRepository;
import com.flamingo.ai.photostore.domain.repository.ObjectDetectionRepository;
import com.flamingo.ai.photostore.domain.repository.ObjectSummaryRepository;
import com.flamingo.ai.photostore.domain.repository.PhotoRepository;
import com.flamingo.ai.photostore.exception.PhotoNotFoundException;
import com.flamingo.ai.photostore.exception.PhotoValidationException;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the PhotoQueryService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PhotoQueryServiceImpl implements PhotoQueryService {

  private final PhotoRepository photoRepository;
  private final ExifAttributesRepository exifAttributesRepository;
  private final ObjectDetectionRepository objectDetectionRepository;
  private final ObjectSummaryRepository objectSummaryRepository;
  private final FaceDetectionRepository faceDetectionRepository;
  private final FaceSummaryRepository faceSummaryRepository;
  private final KnownFaceRepository knownFaceRepository;
  private final PhotoStoreConfig config;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "photo.search.objects", description = "Time to search photos by object classes")
  public List<Long> searchByObjects(Collection<String> classNames, int minCount) {
    Set<String> classes = normalize(classNames, "class");
    if (minCount < 1) {
      throw new PhotoValidationException("minCount must be at least 1: " + minCount);
    }
    List<Long> photoIds =
        objectSummaryRepository.findPhotoIdsContainingAll(classes, minCount, classes.size());
    log.debug(
        "Object search {} (minCount={}) matched {} photos", classes, minCount, photoIds.size());
    return photoIds;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "photo.search.faces", description = "Time to search photos by people")
  public List<Long> searchByFaces(Collection<String> names) {
    Set<String> people = normalize(names, "name");
    List<Long> photoIds = faceDetectionRepository.findPhotoIdsMatchingAnyName(people);
    log.debug("Face search {} matched {} photos", people, photoIds.size());
    return photoIds;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "photo.search.camera", description = "Time to search photos by camera")
  public List<Long> searchByCamera(String make, String model) {
    boolean hasMake = make != null && !make.isBlank();
    boolean hasModel = model != null && !model.isBlank();
    if (hasMake && hasModel) {
      return exifAttributesRepository.findPhotoIdsByCameraMakeAndModel(make.trim(), model.trim());
    }
    if (hasMake) {
      return exifAttributesRepository.findPhotoIdsByCameraMake(make.trim());
    }
    if (hasModel) {
      return exifAttributesRepository.findPhotoIdsByCameraModel(model.trim());
    }
    throw new PhotoValidationException("Camera make or model is required");
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "photo.info", description = "Time to load the metadata of a photo")
  public PhotoDetail getPhotoInfo(Long photoId) {
    Photo photo =
        photoRepository.findById(photoId).orElseThrow(() -> new PhotoNotFoundException(photoId));

    List<FaceDetection> faces = faceDetectionRepository.findByPhotoIdOrderByIdAsc(photoId);
    Set<Long> knownFaceIds =
        faces.stream()
            .map(FaceDetection::getKnownFaceId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    Map<Long, String> knownFaceNames =
        knownFaceRepository.findAllById(knownFaceIds).stream()
            .collect(Collectors.toMap(KnownFace::getId, KnownFace::getName));

    return new PhotoDetail(
        photo,
        exifAttributesRepository.findByPhotoId(photoId).orElse(null),
        objectDetectionRepository.findByPhotoIdOrderByIdAsc(photoId),
        objectSummaryRepository.findByPhotoIdOrderByClassLabelAsc(photoId),
        faces,
        knownFaceNames,
        faceSummaryRepository.findByPhotoId(photoId).orElse(null));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Photo> findPhotoByPath(String filePath) {
    return photoRepository.findByFilePath(filePath);
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "photo.stats", description = "Time to compute store statistics")
  public StoreStatistics getStatistics() {
    long totalFaces = faceDetectionRepository.count();
    long recognizedFaces = faceDetectionRepository.countByKnownFaceIdIsNotNull();

    List<ClassCount> topClasses =
        objectSummaryRepository
            .findTopClasses(PageRequest.of(0, config.getQuery().getTopClassesLimit()))
            .stream()
            .map(row -> new ClassCount(row.getClassLabel(), row.getTotal()))
            .toList();

    return StoreStatistics.builder()
        .totalPhotos(photoRepository.count())
        .totalObjectDetections(objectDetectionRepository.count())
        .topClasses(topClasses)
        .photosWithGps(exifAttributesRepository.countWithGps())
        .totalFaces(totalFaces)
        .recognizedFaces(recognizedFaces)
        .unrecognizedFaces(totalFaces - recognizedFaces)
        .knownFaceEncodings(knownFaceRepository.count())
        .knownIdentities(knownFaceRepository.countDistinctNames())
        .timestamp(LocalDateTime.now())
        .build();
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "photo.list", description = "Time to list photos")
  public Page<Photo> listPhotos(int page, int size) {
    if (page < 0) {
      throw new PhotoValidationException("Page must not be negative: " + page);
    }
    if (size < 1) {
      throw new PhotoValidationException("Page size must be at least 1: " + size);
    }
    int cappedSize = Math.min(size, config.getQuery().getMaxPageSize());
    return photoRepository.findAll(
        PageRequest.of(page, cappedSize, Sort.by(Sort.Direction.ASC, "id")));
  }

  @Override
  @Transactional(readOnly = true)
  public List<KnownFace> listKnownFaces() {
    return knownFaceRepository.findAllByOrderByIdAsc();
  }

  /** Trims values, drops blanks and duplicates; fails when nothing is left. */
  private Set<String> normalize(Collection<String> values, String what) {
    Set<String> normalized =
        values == null
            ? Set.of()
            : values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(Predicate.not(String::isEmpty))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    if (normalized.isEmpty()) {
      throw new PhotoValidationException("At least one " + what + " is required");
    }
    return normalized;
  }
}
