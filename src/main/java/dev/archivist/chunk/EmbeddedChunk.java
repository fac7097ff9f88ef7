package dev.archivist.chunk;

/**
 * A chunk ready for insertion: its text, its embedding, and its metadata.
 *
 * @param content the chunk text
 * @param embedding the provider vector for {@code content}
 * @param metadata the JSONB metadata document
 */
public record EmbeddedChunk(String content, float[] embedding, ChunkMetadata metadata) {}
