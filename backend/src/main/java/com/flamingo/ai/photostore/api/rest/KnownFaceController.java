package com.flamingo.ai.photostore.api.rest;

import com.flamingo.ai.photostore.api.dto.request.EnrollFaceRequest;
import com.flamingo.ai.photostore.api.dto.response.KnownFaceResponse;
import com.flamingo.ai.photostore.service.store.PhotoMetadataStore;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for known face enrollment. */
@RestController
@RequestMapping("/api/faces")
@RequiredArgsConstructor
public class KnownFaceController {

  private final PhotoMetadataStore photoMetadataStore;

  /** Enrolls a reference encoding for a person. */
  @PostMapping
  public ResponseEntity<Map<String, Long>> enroll(@Valid @RequestBody EnrollFaceRequest request) {
    Long id =
        photoMetadataStore.enrollKnownFace(
            request.getName(), request.getEncoding(), request.getImagePath());
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("knownFaceId", id));
  }

  /** Lists enrolled encodings ordered by ID. */
  @GetMapping
  public ResponseEntity<List<KnownFaceResponse>> listKnownFaces() {
    return ResponseEntity.ok(
        photoMetadataStore.listKnownFaces().stream().map(KnownFaceResponse::fromEntity).toList());
  }

  /** Deletes an enrolled encoding; faces matched to it become unrecognized. */
  @DeleteMapping("/{knownFaceId}")
  public ResponseEntity<Void> deleteKnownFace(@PathVariable Long knownFaceId) {
    photoMetadataStore.deleteKnownFace(knownFaceId);
    return ResponseEntity.noContent().build();
  }
}
