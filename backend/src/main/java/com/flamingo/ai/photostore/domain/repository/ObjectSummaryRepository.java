package com.flamingo.ai.photostore.domain.repository;

import com.flamingo.ai.photostore.domain.entity.ObjectSummary;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ObjectSummary entities. */
@Repository
public interface ObjectSummaryRepository extends JpaRepository<ObjectSummary, Long> {

  List<ObjectSummary> findByPhotoIdOrderByClassLabelAsc(Long photoId);

  Optional<ObjectSummary> findByPhotoIdAndClassLabel(Long photoId, String classLabel);

  @Modifying
  @Query("DELETE FROM ObjectSummary s WHERE s.photoId = :photoId")
  int deleteByPhotoId(@Param("photoId") Long photoId);

  /**
   * Rebuilds the summary rows of a photo from its current detection rows.
   *
   * <p>The caller must have deleted the previous summary rows and flushed the detections in the
   * same transaction.
   *
   * @return number of summary rows written, one per distinct class label
   */
  @Modifying
  @Query(
      value =
          "INSERT INTO object_summary "
              + "(photo_id, class_label, total_count, avg_confidence, max_confidence) "
              + "SELECT photo_id, class_label, COUNT(*), AVG(confidence), MAX(confidence) "
              + "FROM object_detections WHERE photo_id = :photoId "
              + "GROUP BY photo_id, class_label",
      nativeQuery = true)
  int rebuildForPhoto(@Param("photoId") Long photoId);

  /**
   * Photo ids having every requested class at least {@code minCount} times.
   *
   * <p>{@code classCount} must equal the number of distinct labels in {@code classLabels}; a photo
   * qualifies only when all of them match.
   */
  @Query(
      "SELECT s.photoId FROM ObjectSummary s "
          + "WHERE s.classLabel IN :classLabels AND s.totalCount >= :minCount "
          + "GROUP BY s.photoId "
          + "HAVING COUNT(DISTINCT s.classLabel) = :classCount "
          + "ORDER BY s.photoId ASC")
  List<Long> findPhotoIdsContainingAll(
      @Param("classLabels") Collection<String> classLabels,
      @Param("minCount") int minCount,
      @Param("classCount") long classCount);

  /** Class labels ordered by their total detection count across all photos. */
  @Query(
      "SELECT s.classLabel AS classLabel, SUM(s.totalCount) AS total FROM ObjectSummary s "
          + "GROUP BY s.classLabel ORDER BY SUM(s.totalCount) DESC, s.classLabel ASC")
  List<ClassCountView> findTopClasses(Pageable pageable);
}
