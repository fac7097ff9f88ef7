package dev.archivist.ingestion;

import dev.archivist.chunk.ChunkMetadata;
import dev.archivist.chunk.EmbeddedChunk;

/**
 * A chunk whose text and metadata are final but whose embedding has not been requested yet.
 *
 * @param content the text to embed and store
 * @param metadata the metadata document stored alongside it
 */
public record ChunkDraft(String content, ChunkMetadata metadata) {

  public EmbeddedChunk withEmbedding(float[] embedding) {
    return new EmbeddedChunk(content, embedding, metadata);
  }
}
