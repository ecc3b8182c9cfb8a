package com.flamingo.ai.photostore.domain.repository;

import com.flamingo.ai.photostore.domain.entity.ObjectDetection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ObjectDetection entities. */
@Repository
public interface ObjectDetectionRepository extends JpaRepository<ObjectDetection, Long> {

  List<ObjectDetection> findByPhotoIdOrderByIdAsc(Long photoId);

  long countByPhotoId(Long photoId);

  long countByPhotoIdAndClassLabel(Long photoId, String classLabel);

  @Modifying
  @Query("DELETE FROM ObjectDetection d WHERE d.photoId = :photoId")
  int deleteByPhotoId(@Param("photoId") Long photoId);
}
