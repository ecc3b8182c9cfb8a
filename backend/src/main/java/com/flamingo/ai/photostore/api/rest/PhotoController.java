package com.flamingo.ai.photostore.api.rest;

import com.flamingo.ai.photostore.api.dto.request.IngestPhotoRequest;
import com.flamingo.ai.photostore.api.dto.response.IngestPhotoResponse;
import com.flamingo.ai.photostore.api.dto.response.PhotoDetailResponse;
import com.flamingo.ai.photostore.api.dto.response.PhotoPageResponse;
import com.flamingo.ai.photostore.api.dto.response.PhotoResponse;
import com.flamingo.ai.photostore.config.PhotoStoreConfig;
import com.flamingo.ai.photostore.service.store.PhotoMetadataStore;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for photo ingestion and queries. */
@RestController
@RequestMapping("/api/photos")
@RequiredArgsConstructor
public class PhotoController {

  private final PhotoMetadataStore photoMetadataStore;
  private final PhotoStoreConfig config;

  /** Ingests the analysis results of one photo, replacing any earlier results for its path. */
  @PostMapping
  public ResponseEntity<IngestPhotoResponse> ingestPhoto(
      @Valid @RequestBody IngestPhotoRequest request) {
    Long photoId =
        photoMetadataStore.ingestPhoto(
            request.getFilePath(),
            request.toFileMetadata(),
            request.getExif(),
            request.toObjectDetections(),
            request.toFaceDetections());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new IngestPhotoResponse(photoId, request.getFilePath()));
  }

  /** Lists photos ordered by ID. */
  @GetMapping
  public ResponseEntity<PhotoPageResponse> listPhotos(
      @RequestParam(defaultValue = "0") int page, @RequestParam(required = false) Integer size) {
    int pageSize = size != null ? size : config.getQuery().getDefaultPageSize();
    return ResponseEntity.ok(
        PhotoPageResponse.fromPage(photoMetadataStore.listPhotos(page, pageSize)));
  }

  /** Gets everything stored for a photo. */
  @GetMapping("/{photoId}")
  public ResponseEntity<PhotoDetailResponse> getPhoto(@PathVariable Long photoId) {
    return ResponseEntity.ok(
        PhotoDetailResponse.fromDetail(photoMetadataStore.getPhotoInfo(photoId)));
  }

  /** Deletes a photo and its metadata. */
  @DeleteMapping("/{photoId}")
  public ResponseEntity<Void> deletePhoto(@PathVariable Long photoId) {
    photoMetadataStore.deletePhoto(photoId);
    return ResponseEntity.noContent().build();
  }

  /** Finds photos containing all given object classes. */
  @GetMapping("/search/objects")
  public ResponseEntity<List<Long>> searchByObjects(
      @RequestParam List<String> classes, @RequestParam(defaultValue = "1") int minCount) {
    return ResponseEntity.ok(photoMetadataStore.searchByObjects(classes, minCount));
  }

  /** Finds photos showing any of the given people. */
  @GetMapping("/search/faces")
  public ResponseEntity<List<Long>> searchByFaces(@RequestParam List<String> names) {
    return ResponseEntity.ok(photoMetadataStore.searchByFaces(names));
  }

  /** Finds photos taken with a camera make and/or model. */
  @GetMapping("/search/camera")
  public ResponseEntity<List<Long>> searchByCamera(
      @RequestParam(required = false) String make, @RequestParam(required = false) String model) {
    return ResponseEntity.ok(photoMetadataStore.searchByCamera(make, model));
  }

  /** Looks up a photo by its path; 404 when the path has not been ingested. */
  @GetMapping("/lookup")
  public ResponseEntity<PhotoResponse> findByPath(@RequestParam String path) {
    return photoMetadataStore
        .findPhotoByPath(path)
        .map(photo -> ResponseEntity.ok(PhotoResponse.fromEntity(photo)))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }
}
