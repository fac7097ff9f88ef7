package dev.archivist.ingestion;

/**
 * The ingesting thread was interrupted. The open transaction is rolled back and the last commit
 * remains the recovery point.
 */
public class IngestionCancelledException extends RuntimeException {

  public IngestionCancelledException(String message) {
    super(message);
  }

  public IngestionCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
