package dev.archivist.ingestion;

import java.time.Duration;

/**
 * Outcome of an ingestion run.
 *
 * @param processedRows rows whose chunks were committed
 * @param failedRows rows skipped after a row-scoped failure
 * @param totalChunks chunks committed
 * @param elapsed wall time of the run
 */
public record IngestionSummary(
    int processedRows, int failedRows, long totalChunks, Duration elapsed) {

  public static IngestionSummary empty() {
    return new IngestionSummary(0, 0, 0, Duration.ZERO);
  }

  static IngestionSummary of(IngestionTally tally, Duration elapsed) {
    return new IngestionSummary(tally.succeeded(), tally.failed(), tally.chunks(), elapsed);
  }

  public double averageRowsPerSecond() {
    double seconds = elapsed.toMillis() / 1000.0;
    return seconds > 0 ? (processedRows + failedRows) / seconds : 0.0;
  }
}
