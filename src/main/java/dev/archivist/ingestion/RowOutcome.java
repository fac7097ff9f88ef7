package dev.archivist.ingestion;

import org.jspecify.annotations.Nullable;

/**
 * Result of processing one row: either the number of chunks staged, or the failure that made the
 * row contribute nothing.
 *
 * @param url the row's source URL, for diagnostics
 * @param chunkCount chunks staged, 0 on failure
 * @param failure the row-scoped failure, null on success
 */
public record RowOutcome(String url, int chunkCount, @Nullable RuntimeException failure) {

  public static RowOutcome success(String url, int chunkCount) {
    return new RowOutcome(url, chunkCount, null);
  }

  public static RowOutcome failed(String url, RuntimeException failure) {
    return new RowOutcome(url, 0, failure);
  }

  public boolean succeeded() {
    return failure == null;
  }
}
