package dev.archivist.ingestion;

/** Receives telemetry events from {@link BatchCommitter}. */
public interface IngestionListener {

  void onStart(int totalRows, String strategy);

  void onProgress(IngestionProgress progress);

  void onCommit(int processedRows, long totalChunks);

  void onComplete(IngestionSummary summary);

  void onError(Throwable error, String context);
}
