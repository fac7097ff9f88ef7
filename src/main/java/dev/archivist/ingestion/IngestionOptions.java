package dev.archivist.ingestion;

import org.jspecify.annotations.Nullable;

/**
 * Parameters of a single ingestion run.
 *
 * @param strategy chunking strategy name for answers
 * @param limit if set, only the first {@code limit} rows are ingested
 * @param progressInterval emit a progress event every this many rows
 * @param commitInterval commit every this many rows
 */
public record IngestionOptions(
    String strategy, @Nullable Integer limit, int progressInterval, int commitInterval) {

  public IngestionOptions {
    if (strategy == null || strategy.isBlank()) {
      throw new IllegalArgumentException("strategy must not be blank");
    }
    if (limit != null && limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
    }
    if (progressInterval <= 0) {
      throw new IllegalArgumentException("progressInterval must be > 0, got: " + progressInterval);
    }
    if (commitInterval <= 0) {
      throw new IllegalArgumentException("commitInterval must be > 0, got: " + commitInterval);
    }
  }
}
