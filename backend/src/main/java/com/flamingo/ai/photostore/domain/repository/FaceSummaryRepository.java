package com.flamingo.ai.photostore.domain.repository;

import com.flamingo.ai.photostore.domain.entity.FaceSummary;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for FaceSummary entities. */
@Repository
public interface FaceSummaryRepository extends JpaRepository<FaceSummary, Long> {

  Optional<FaceSummary> findByPhotoId(Long photoId);

  @Modifying
  @Query("DELETE FROM FaceSummary s WHERE s.photoId = :photoId")
  int deleteByPhotoId(@Param("photoId") Long photoId);

  /**
   * Rebuilds the face summary row of a photo from its current face detection rows. Writes exactly
   * one row, with zero counts when the photo has no faces.
   */
  @Modifying
  @Query(
      value =
          "INSERT INTO face_summary "
              + "(photo_id, total_faces, recognized_faces, unrecognized_faces) "
              + "SELECT p.id, COUNT(f.id), COUNT(f.known_face_id), "
              + "COUNT(f.id) - COUNT(f.known_face_id) "
              + "FROM photos p LEFT JOIN face_detections f ON f.photo_id = p.id "
              + "WHERE p.id = :photoId GROUP BY p.id",
      nativeQuery = true)
  int rebuildForPhoto(@Param("photoId") Long photoId);
}
