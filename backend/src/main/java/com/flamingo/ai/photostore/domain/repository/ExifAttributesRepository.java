package com.flamingo.ai.photostore.domain.repository;

import com.flamingo.ai.photostore.domain.entity.ExifAttributes;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ExifAttributes entities. */
@Repository
public interface ExifAttributesRepository extends JpaRepository<ExifAttributes, Long> {

  Optional<ExifAttributes> findByPhotoId(Long photoId);

  /** Photo ids whose camera make matches, ignoring case. */
  @Query(
      "SELECT e.photoId FROM ExifAttributes e "
          + "WHERE LOWER(e.cameraMake) = LOWER(:make) ORDER BY e.photoId ASC")
  List<Long> findPhotoIdsByCameraMake(@Param("make") String make);

  /** Photo ids whose camera model matches, ignoring case. */
  @Query(
      "SELECT e.photoId FROM ExifAttributes e "
          + "WHERE LOWER(e.cameraModel) = LOWER(:model) ORDER BY e.photoId ASC")
  List<Long> findPhotoIdsByCameraModel(@Param("model") String model);

  /** Photo ids whose camera make and model both match, ignoring case. */
  @Query(
      "SELECT e.photoId FROM ExifAttributes e "
          + "WHERE LOWER(e.cameraMake) = LOWER(:make) AND LOWER(e.cameraModel) = LOWER(:model) "
          + "ORDER BY e.photoId ASC")
  List<Long> findPhotoIdsByCameraMakeAndModel(
      @Param("make") String make, @Param("model") String model);

  /** Counts photos that carry both GPS coordinates. */
  @Query(
      "SELECT COUNT(e) FROM ExifAttributes e "
          + "WHERE e.gpsLatitude IS NOT NULL AND e.gpsLongitude IS NOT NULL")
  long countWithGps();

  @Modifying
  @Query("DELETE FROM ExifAttributes e WHERE e.photoId = :photoId")
  int deleteByPhotoId(@Param("photoId") Long photoId);
}
