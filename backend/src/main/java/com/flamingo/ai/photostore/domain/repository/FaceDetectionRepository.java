package com.flamingo.ai.photostore.domain.repository;

import com.flamingo.ai.photostore.domain.entity.FaceDetection;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for FaceDetection entities. */
@Repository
public interface FaceDetectionRepository extends JpaRepository<FaceDetection, Long> {

  List<FaceDetection> findByPhotoIdOrderByIdAsc(Long photoId);

  long countByPhotoId(Long photoId);

  long countByKnownFaceIdIsNotNull();

  long countByKnownFaceId(Long knownFaceId);

  @Modifying
  @Query("DELETE FROM FaceDetection f WHERE f.photoId = :photoId")
  int deleteByPhotoId(@Param("photoId") Long photoId);

  /** Photos with at least one face matched to a known face of any of the given names. */
  @Query(
      "SELECT DISTINCT f.photoId FROM FaceDetection f, KnownFace k "
          + "WHERE f.knownFaceId = k.id AND k.name IN :names "
          + "ORDER BY f.photoId ASC")
  List<Long> findPhotoIdsMatchingAnyName(@Param("names") Collection<String> names);

  /** Photos that reference the given known face. */
  @Query(
      "SELECT DISTINCT f.photoId FROM FaceDetection f "
          + "WHERE f.knownFaceId = :knownFaceId ORDER BY f.photoId ASC")
  List<Long> findPhotoIdsByKnownFaceId(@Param("knownFaceId") Long knownFaceId);

  /** Unmatches every detection bound to the given known face and drops its confidence. */
  @Modifying
  @Query(
      "UPDATE FaceDetection f SET f.knownFaceId = NULL, f.matchConfidence = NULL"
          + " WHERE f.knownFaceId = :knownFaceId")
  int clearKnownFace(@Param("knownFaceId") Long knownFaceId);
}
