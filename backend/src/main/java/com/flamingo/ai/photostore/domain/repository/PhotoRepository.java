package com.flamingo.ai.photostore.domain.repository;

import com.flamingo.ai.photostore.domain.entity.Photo;
import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Photo entities. */
@Repository
public interface PhotoRepository extends JpaRepository<Photo, Long> {

  /** Finds a photo by its file path without locking. */
  Optional<Photo> findByFilePath(String filePath);

  /**
   * Finds a photo by its file path and takes a row-level write lock on it.
   *
   * <p>Concurrent writers of the same path block here until the lock holder commits.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM Photo p WHERE p.filePath = :filePath")
  Optional<Photo> findByFilePathForUpdate(@Param("filePath") String filePath);

  /** Finds a photo by id and takes a row-level write lock on it. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM Photo p WHERE p.id = :id")
  Optional<Photo> findByIdForUpdate(@Param("id") Long id);

  /** Locks several photos, always in ascending id order. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM Photo p WHERE p.id IN :ids ORDER BY p.id ASC")
  List<Photo> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);
}
