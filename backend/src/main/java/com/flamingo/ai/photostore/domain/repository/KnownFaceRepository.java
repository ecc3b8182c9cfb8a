package com.flamingo.ai.photostore.domain.repository;

import com.flamingo.ai.photostore.domain.entity.KnownFace;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for KnownFace entities. */
@Repository
public interface KnownFaceRepository extends JpaRepository<KnownFace, Long> {

  List<KnownFace> findAllByOrderByIdAsc();

  Optional<KnownFace> findByImagePath(String imagePath);

  /** The lowest-id encoding enrolled under a name, used as the match target for that person. */
  Optional<KnownFace> findFirstByNameOrderByIdAsc(String name);

  /**
   * Finds a known face by id and takes a row-level write lock on it. While the lock is held no
   * other transaction can insert detections referencing the face.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT k FROM KnownFace k WHERE k.id = :id")
  Optional<KnownFace> findByIdForUpdate(@Param("id") Long id);

  /** Counts distinct enrolled identities. */
  @Query("SELECT COUNT(DISTINCT k.name) FROM KnownFace k")
  long countDistinctNames();
}
