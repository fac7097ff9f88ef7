package dev.archivist.embedding;

/** Thrown when an embedding is requested before {@link EmbeddingClient#initialize()} succeeded. */
public class EmbeddingUninitializedException extends IllegalStateException {

  public EmbeddingUninitializedException(String message) {
    super(message);
  }
}
