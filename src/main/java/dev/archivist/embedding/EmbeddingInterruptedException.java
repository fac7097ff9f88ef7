package dev.archivist.embedding;

/**
 * Thrown when the calling thread is interrupted while the client waits between attempts or
 * sub-batches. The interrupt flag is restored before this is thrown.
 */
public class EmbeddingInterruptedException extends RuntimeException {

  public EmbeddingInterruptedException(String message, Throwable cause) {
    super(message, cause);
  }
}
