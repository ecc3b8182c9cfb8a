package com.flamingo.ai.photostore.exception;

import java.util.function.Predicate;

/**
 * Retry predicate for the {@code ingestion} Resilience4j instance: only conflicts with a concurrent
 * writer are repeated.
 */
public class StorageConflictPredicate implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    return throwable instanceof StorageException storageException
        && storageException.isConflict();
  }
}
