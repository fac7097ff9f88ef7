package dev.archivist.ingestion;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes ingestion telemetry to the application log. */
@Component
public class LoggingIngestionListener implements IngestionListener {

  private static final Logger log = LoggerFactory.getLogger(LoggingIngestionListener.class);

  private static final String RULE = "=".repeat(60);
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final Clock clock;

  public LoggingIngestionListener(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void onStart(int totalRows, String strategy) {
    log.info(RULE);
    log.info("Starting ingestion");
    log.info("Total rows: {}", String.format(Locale.ROOT, "%,d", totalRows));
    log.info("Chunking strategy: {}", strategy);
    log.info("Started at: {}", now());
    log.info(RULE);
  }

  @Override
  public void onProgress(IngestionProgress progress) {
    log.info(
        String.format(
            Locale.ROOT,
            "Progress: %,d/%,d (%.1f%%) | chunks: %,d | %.1f rows/sec | ETA: %ds",
            progress.processedRows(),
            progress.totalRows(),
            progress.percentage(),
            progress.totalChunks(),
            progress.rowsPerSecond(),
            progress.etaSeconds()));
  }

  @Override
  public void onCommit(int processedRows, long totalChunks) {
    log.info("Committed: {} rows, {} chunks", processedRows, totalChunks);
  }

  @Override
  public void onComplete(IngestionSummary summary) {
    log.info(RULE);
    log.info("Ingestion complete");
    log.info("Rows ingested: {}", summary.processedRows());
    log.info("Rows failed: {}", summary.failedRows());
    log.info("Chunks created: {}", summary.totalChunks());
    log.info(
        "Elapsed: {}s",
        String.format(Locale.ROOT, "%.2f", summary.elapsed().toMillis() / 1000.0));
    log.info(
        "Average rate: {} rows/sec",
        String.format(Locale.ROOT, "%.1f", summary.averageRowsPerSecond()));
    log.info("Finished at: {}", now());
    log.info(RULE);
  }

  @Override
  public void onError(Throwable error, String context) {
    log.error("Ingestion error ({}): {}", context, error.toString(), error);
  }

  private String now() {
    return LocalDateTime.now(clock).format(TIMESTAMP);
  }
}
