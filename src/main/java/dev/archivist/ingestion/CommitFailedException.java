package dev.archivist.ingestion;

/** A batch commit failed. The run is aborted; earlier commits stay durable. */
public class CommitFailedException extends RuntimeException {

  public CommitFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
