package dev.archivist.embedding;

/**
 * Signals that the embedding provider could not produce vectors: retries were exhausted, the
 * client lost its provider handle, or the provider answered with a malformed response.
 *
 * <p>Fatal for the row being processed, not for the whole run.
 */
public class EmbeddingProviderUnavailableException extends RuntimeException {

  public EmbeddingProviderUnavailableException(String message) {
    super(message);
  }

  public EmbeddingProviderUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
