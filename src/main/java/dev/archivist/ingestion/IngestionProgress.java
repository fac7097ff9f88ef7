package dev.archivist.ingestion;

import java.time.Duration;

/**
 * Snapshot of a running ingestion, emitted every progress interval.
 *
 * @param processedRows rows handed to the coordinator so far, failed ones included
 * @param totalRows rows in this run after the limit was applied
 * @param totalChunks chunks staged so far
 * @param elapsed time since the run started
 */
public record IngestionProgress(
    int processedRows, int totalRows, long totalChunks, Duration elapsed) {

  public double percentage() {
    return totalRows == 0 ? 100.0 : processedRows * 100.0 / totalRows;
  }

  public double rowsPerSecond() {
    double seconds = elapsed.toMillis() / 1000.0;
    return seconds > 0 ? processedRows / seconds : 0.0;
  }

  /** Estimated seconds until the last row, 0 when no rate is known yet. */
  public long etaSeconds() {
    double rate = rowsPerSecond();
    return rate > 0 ? Math.round((totalRows - processedRows) / rate) : 0;
  }
}
