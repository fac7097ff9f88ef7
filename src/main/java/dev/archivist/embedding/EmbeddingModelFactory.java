package dev.archivist.embedding;

import dev.langchain4j.model.embedding.EmbeddingModel;

/** Creates the provider-backed {@link EmbeddingModel} once credentials are known to be present. */
@FunctionalInterface
public interface EmbeddingModelFactory {

  EmbeddingModel create(EmbeddingProperties properties);
}
