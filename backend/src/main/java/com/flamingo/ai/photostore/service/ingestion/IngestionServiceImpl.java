package com.flamingo.ai.photostore.service.ingestion;

import com.flamingo.ai.photostore.config.PhotoStoreConfig;
import com.flamingo.ai.photostore.domain.entity.FaceDetection;
import com.flamingo.ai.photostore.domain.entity.KnownFace;
import com.flamingo.ai.photostore.domain.entity.ObjectDetection;
import com.flamingo.ai.photostore.domain.entity.Photo;
import com.flamingo.ai.photostore.domain.repository.ExifAttributesRepository;
import com.flamingo.ai.photostore.domain.repository.FaceDetectionRepository;
import com.flamingo.ai.photostore.domain.repository.FaceSummaryRepository;
import com.flamingo.ai.photostore.domain.repository.KnownFaceRepository;
import com.flamingo.ai.photostore.domain.repository.ObjectDetectionRepository;
import com.flamingo.ai.photostore.domain.repository.ObjectSummaryRepository;
import com.flamingo.ai.photostore.domain.repository.PhotoRepository;
import com.flamingo.ai.photostore.exception.KnownFaceNotFoundException;
import com.flamingo.ai.photostore.exception.PhotoNotFoundException;
import com.flamingo.ai.photostore.exception.PhotoValidationException;
import com.flamingo.ai.photostore.exception.StorageException;
import com.flamingo.ai.photostore.schema.PhotoStoreSchema;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Implementation of the IngestionService.
 *
 * <p>Re-processing a photo follows a fixed procedure inside one transaction: lock (or create) the
 * photo row, delete every dependent row, insert the new raw rows, then rebuild the summary rows
 * from the raw rows with {@code INSERT ... SELECT ... GROUP BY}. Summaries therefore always agree
 * with the detections they were computed from.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionServiceImpl implements IngestionService {

  private final PhotoRepository photoRepository;
  private final ExifAttributesRepository exifAttributesRepository;
  private final ObjectDetectionRepository objectDetectionRepository;
  private final ObjectSummaryRepository objectSummaryRepository;
  private final FaceDetectionRepository faceDetectionRepository;
  private final FaceSummaryRepository faceSummaryRepository;
  private final KnownFaceRepository knownFaceRepository;
  private final ExifAttributeParser exifAttributeParser;
  private final PhotoStoreConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional(isolation = Isolation.READ_COMMITTED)
  @Timed(value = "photo.ingest", description = "Time to ingest the metadata of a photo")
  public Long ingest(
      String filePath,
      FileMetadata fileMetadata,
      Map<String, ?> exif,
      List<RawObjectDetection> objectDetections,
      List<RawFaceDetection> faceDetections) {
    List<RawObjectDetection> objects = keepObjects(objectDetections);
    List<RawFaceDetection> faces = faceDetections != null ? faceDetections : List.of();
    Map<String, Long> knownFaceIds = resolveMatchedNames(filePath, faces);

    FileMetadata meta = fileMetadata != null ? fileMetadata : FileMetadata.empty();
    Optional<Photo> existing = photoRepository.findByFilePathForUpdate(filePath);
    Photo photo = existing.map(p -> refresh(p, meta)).orElseGet(() -> create(filePath, meta));
    Long photoId = photo.getId();

    clearDependents(photoId);

    exifAttributeParser
        .parse(exif)
        .ifPresent(
            attributes -> {
              attributes.setPhotoId(photoId);
              exifAttributesRepository.save(attributes);
            });

    objectDetectionRepository.saveAllAndFlush(
        objects.stream().map(raw -> toEntity(photoId, raw)).toList());
    faceDetectionRepository.saveAllAndFlush(
        faces.stream().map(raw -> toEntity(photoId, raw, knownFaceIds)).toList());

    int classes = objectSummaryRepository.rebuildForPhoto(photoId);
    faceSummaryRepository.rebuildForPhoto(photoId);

    meterRegistry
        .counter("photo.ingested", "result", existing.isPresent() ? "replaced" : "created")
        .increment();
    log.info(
        "Ingested photo {} (id={}): {} objects in {} classes, {} faces",
        filePath,
        photoId,
        objects.size(),
        classes,
        faces.size());
    return photoId;
  }

  @Override
  @Transactional(isolation = Isolation.READ_COMMITTED)
  @Timed(value = "face.enroll", description = "Time to enroll a known face")
  public Long enrollKnownFace(String name, double[] encoding, String sourceImagePath) {
    String trimmedName = name.trim();
    Optional<KnownFace> existing =
        sourceImagePath != null
            ? knownFaceRepository.findByImagePath(sourceImagePath)
            : Optional.empty();

    KnownFace knownFace;
    if (existing.isPresent()) {
      knownFace = existing.get();
      knownFace.setName(trimmedName);
      knownFace.setEncoding(encoding.clone());
      log.info("Replacing known face {} from {}", knownFace.getId(), sourceImagePath);
    } else {
      knownFace =
          KnownFace.builder()
              .name(trimmedName)
              .encoding(encoding.clone())
              .imagePath(sourceImagePath)
              .build();
    }

    KnownFace saved;
    try {
      saved = knownFaceRepository.saveAndFlush(knownFace);
    } catch (DataIntegrityViolationException e) {
      throw new StorageException(sourceImagePath, "enrollKnownFace", e, true);
    }

    meterRegistry.counter("face.enrolled").increment();
    log.info("Enrolled known face '{}' with ID: {}", trimmedName, saved.getId());
    return saved.getId();
  }

  @Override
  @Transactional(isolation = Isolation.READ_COMMITTED)
  @Timed(value = "photo.delete", description = "Time to delete a photo")
  public void deletePhoto(Long photoId) {
    Photo photo =
        photoRepository
            .findByIdForUpdate(photoId)
            .orElseThrow(() -> new PhotoNotFoundException(photoId));

    clearDependents(photoId);
    photoRepository.delete(photo);
    photoRepository.flush();

    meterRegistry.counter("photo.deleted").increment();
    log.info("Deleted photo {} (id={})", photo.getFilePath(), photoId);
  }

  @Override
  @Transactional(isolation = Isolation.READ_COMMITTED)
  @Timed(value = "face.delete", description = "Time to delete a known face")
  public void deleteKnownFace(Long knownFaceId) {
    // Locking the known face first blocks ingestions that would add new references to it.
    KnownFace knownFace =
        knownFaceRepository
            .findByIdForUpdate(knownFaceId)
            .orElseThrow(() -> new KnownFaceNotFoundException(knownFaceId));

    List<Long> affectedPhotoIds = faceDetectionRepository.findPhotoIdsByKnownFaceId(knownFaceId);
    if (!affectedPhotoIds.isEmpty()) {
      photoRepository.findAllByIdForUpdate(affectedPhotoIds);
    }

    int cleared = faceDetectionRepository.clearKnownFace(knownFaceId);
    knownFaceRepository.delete(knownFace);
    knownFaceRepository.flush();

    for (Long photoId : affectedPhotoIds) {
      faceSummaryRepository.deleteByPhotoId(photoId);
      faceSummaryRepository.rebuildForPhoto(photoId);
    }

    meterRegistry.counter("face.deleted").increment();
    log.info(
        "Deleted known face {} ('{}'): {} detections unmatched across {} photos",
        knownFaceId,
        knownFace.getName(),
        cleared,
        affectedPhotoIds.size());
  }

  private Photo create(String filePath, FileMetadata meta) {
    Photo photo =
        Photo.builder()
            .filePath(filePath)
            .fileName(fileName(filePath))
            .fileSize(meta.sizeBytes())
            .format(meta.format())
            .width(meta.width())
            .height(meta.height())
            .processingModel(meta.processingModel())
            .build();
    try {
      return photoRepository.saveAndFlush(photo);
    } catch (DataIntegrityViolationException e) {
      // Only a duplicate path means another transaction inserted it after our lookup.
      throw new StorageException(filePath, "ingestPhoto", e, isDuplicatePath(e));
    }
  }

  static boolean isDuplicatePath(DataIntegrityViolationException e) {
    String message = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
    return message != null
        && message.toLowerCase(Locale.ROOT).contains(PhotoStoreSchema.PHOTO_PATH_INDEX);
  }

  private Photo refresh(Photo photo, FileMetadata meta) {
    photo.refreshFileMetadata(
        meta.sizeBytes(), meta.format(), meta.width(), meta.height(), meta.processingModel());
    log.debug("Re-processing photo {} (id={})", photo.getFilePath(), photo.getId());
    return photoRepository.saveAndFlush(photo);
  }

  private void clearDependents(Long photoId) {
    exifAttributesRepository.deleteByPhotoId(photoId);
    objectSummaryRepository.deleteByPhotoId(photoId);
    objectDetectionRepository.deleteByPhotoId(photoId);
    faceSummaryRepository.deleteByPhotoId(photoId);
    faceDetectionRepository.deleteByPhotoId(photoId);
  }

  private List<RawObjectDetection> keepObjects(List<RawObjectDetection> detections) {
    if (detections == null) {
      return List.of();
    }
    double minConfidence = config.getIngestion().getMinConfidence();
    List<RawObjectDetection> kept =
        detections.stream().filter(d -> d.confidence() >= minConfidence).toList();
    if (kept.size() < detections.size()) {
      log.debug(
          "Dropped {} detections below confidence {}",
          detections.size() - kept.size(),
          minConfidence);
    }
    return kept;
  }

  /** Maps each matched name to the known face it binds to; unknown names fail the ingestion. */
  private Map<String, Long> resolveMatchedNames(String filePath, List<RawFaceDetection> faces) {
    Map<String, Long> ids = new HashMap<>();
    for (RawFaceDetection face : faces) {
      if (!face.isMatched()) {
        continue;
      }
      String name = face.matchedName().trim();
      if (ids.containsKey(name)) {
        continue;
      }
      Long id =
          knownFaceRepository
              .findFirstByNameOrderByIdAsc(name)
              .map(KnownFace::getId)
              .orElseThrow(
                  () ->
                      new PhotoValidationException(
                          filePath, "Matched name is not an enrolled known face: " + name));
      ids.put(name, id);
    }
    return ids;
  }

  private ObjectDetection toEntity(Long photoId, RawObjectDetection raw) {
    return ObjectDetection.builder()
        .photoId(photoId)
        .classLabel(raw.classLabel().trim())
        .classId(raw.classId())
        .confidence(raw.confidence())
        .box(raw.box().copy())
        .modelId(raw.modelId())
        .build();
  }

  private FaceDetection toEntity(
      Long photoId, RawFaceDetection raw, Map<String, Long> knownFaceIds) {
    Long knownFaceId = raw.isMatched() ? knownFaceIds.get(raw.matchedName().trim()) : null;
    return FaceDetection.builder()
        .photoId(photoId)
        .box(raw.box().copy())
        .knownFaceId(knownFaceId)
        .matchConfidence(knownFaceId != null ? raw.matchConfidence() : null)
        .encoding(raw.encoding() != null ? raw.encoding().clone() : null)
        .modelId(raw.modelId())
        .build();
  }

  static String fileName(String filePath) {
    int slash = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
    return slash >= 0 && slash < filePath.length() - 1 ? filePath.substring(slash + 1) : filePath;
  }
}
