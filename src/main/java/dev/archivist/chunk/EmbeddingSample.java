package dev.archivist.chunk;

/**
 * One stored chunk used to sanity-check embeddings after a run.
 *
 * @param dimension the stored vector's dimension
 * @param sampleText the first 100 characters of the chunk content, followed by an ellipsis
 */
public record EmbeddingSample(int dimension, String sampleText) {}
