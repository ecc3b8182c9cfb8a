package com.flamingo.ai.photostore.service.store;

import com.flamingo.ai.photostore.api.dto.response.StoreStatistics;
import com.flamingo.ai.photostore.domain.entity.KnownFace;
import com.flamingo.ai.photostore.domain.entity.Photo;
import com.flamingo.ai.photostore.exception.PhotoValidationException;
import com.flamingo.ai.photostore.exception.StorageException;
import com.flamingo.ai.photostore.schema.SchemaManager;
import com.flamingo.ai.photostore.service.ingestion.FileMetadata;
import com.flamingo.ai.photostore.service.ingestion.IngestionService;
import com.flamingo.ai.photostore.service.ingestion.IngestionValidator;
import com.flamingo.ai.photostore.service.ingestion.RawFaceDetection;
import com.flamingo.ai.photostore.service.ingestion.RawObjectDetection;
import com.flamingo.ai.photostore.service.query.PhotoDetail;
import com.flamingo.ai.photostore.service.query.PhotoQueryService;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Implementation of the PhotoMetadataStore.
 *
 * <p>Write operations are validated here, before a transaction is opened, and retried by the
 * {@code ingestion} retry instance when they lost a race against a concurrent writer. Each attempt
 * is a complete transaction of its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PhotoMetadataStoreImpl implements PhotoMetadataStore {

  private final SchemaManager schemaManager;
  private final IngestionValidator ingestionValidator;
  private final IngestionService ingestionService;
  private final PhotoQueryService photoQueryService;

  @Override
  @Retry(name = "ingestion")
  public Long ingestPhoto(
      String filePath,
      FileMetadata fileMetadata,
      Map<String, ?> exif,
      List<RawObjectDetection> objectDetections,
      List<RawFaceDetection> faceDetections) {
    schemaManager.requireReady();
    ingestionValidator.validatePhoto(filePath, fileMetadata, objectDetections, faceDetections);
    return execute(
        filePath,
        "ingestPhoto",
        () ->
            ingestionService.ingest(
                filePath, fileMetadata, exif, objectDetections, faceDetections));
  }

  @Override
  @Retry(name = "ingestion")
  public Long enrollKnownFace(String name, double[] encoding, String sourceImagePath) {
    schemaManager.requireReady();
    ingestionValidator.validateEnrollment(name, encoding, sourceImagePath);
    return execute(
        sourceImagePath,
        "enrollKnownFace",
        () -> ingestionService.enrollKnownFace(name, encoding, sourceImagePath));
  }

  @Override
  @Retry(name = "ingestion")
  public void deletePhoto(Long photoId) {
    schemaManager.requireReady();
    requireId(photoId, "Photo");
    execute(
        null,
        "deletePhoto",
        () -> {
          ingestionService.deletePhoto(photoId);
          return null;
        });
  }

  @Override
  @Retry(name = "ingestion")
  public void deleteKnownFace(Long knownFaceId) {
    schemaManager.requireReady();
    requireId(knownFaceId, "Known face");
    execute(
        null,
        "deleteKnownFace",
        () -> {
          ingestionService.deleteKnownFace(knownFaceId);
          return null;
        });
  }

  @Override
  public List<Long> searchByObjects(Collection<String> classNames, int minCount) {
    schemaManager.requireReady();
    return execute(
        null, "searchByObjects", () -> photoQueryService.searchByObjects(classNames, minCount));
  }

  @Override
  public List<Long> searchByFaces(Collection<String> names) {
    schemaManager.requireReady();
    return execute(null, "searchByFaces", () -> photoQueryService.searchByFaces(names));
  }

  @Override
  public List<Long> searchByCamera(String make, String model) {
    schemaManager.requireReady();
    return execute(null, "searchByCamera", () -> photoQueryService.searchByCamera(make, model));
  }

  @Override
  public PhotoDetail getPhotoInfo(Long photoId) {
    schemaManager.requireReady();
    requireId(photoId, "Photo");
    return execute(null, "getPhotoInfo", () -> photoQueryService.getPhotoInfo(photoId));
  }

  @Override
  public Optional<Photo> findPhotoByPath(String filePath) {
    schemaManager.requireReady();
    ingestionValidator.validatePath(filePath);
    return execute(filePath, "findPhotoByPath", () -> photoQueryService.findPhotoByPath(filePath));
  }

  @Override
  public StoreStatistics getStatistics() {
    schemaManager.requireReady();
    return execute(null, "getStatistics", photoQueryService::getStatistics);
  }

  @Override
  public Page<Photo> listPhotos(int page, int size) {
    schemaManager.requireReady();
    return execute(null, "listPhotos", () -> photoQueryService.listPhotos(page, size));
  }

  @Override
  public List<KnownFace> listKnownFaces() {
    schemaManager.requireReady();
    return execute(null, "listKnownFaces", photoQueryService::listKnownFaces);
  }

  /** Runs a store operation and translates Spring data access failures. */
  private <T> T execute(String filePath, String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (ConcurrencyFailureException e) {
      log.warn(
          "{} conflicted with a concurrent writer for {}: {}",
          operation,
          filePath,
          e.getMessage());
      throw new StorageException(filePath, operation, e, true);
    } catch (DataAccessException | TransactionException e) {
      log.error("{} failed for {}: {}", operation, filePath, e.getMessage());
      throw new StorageException(filePath, operation, e);
    }
  }

  private void requireId(Long id, String what) {
    if (id == null) {
      throw new PhotoValidationException(what + " ID is required");
    }
  }
}
