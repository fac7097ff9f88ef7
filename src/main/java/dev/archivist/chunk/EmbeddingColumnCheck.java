package dev.archivist.chunk;

import dev.archivist.embedding.EmbeddingProperties;
import jakarta.annotation.PostConstruct;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fails startup when {@code archivist.embedding.dimensions} differs from the dimension of the
 * {@code chunks.embedding} column. The column is declared by the schema migration, so changing
 * the configured dimension also needs a migration.
 */
@Component
public class EmbeddingColumnCheck {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingColumnCheck.class);

  private final ChunkRepository chunkRepository;
  private final EmbeddingProperties properties;

  public EmbeddingColumnCheck(ChunkRepository chunkRepository, EmbeddingProperties properties) {
    this.chunkRepository = chunkRepository;
    this.properties = properties;
  }

  @PostConstruct
  void verify() {
    OptionalInt column = chunkRepository.embeddingColumnDimensions();
    if (column.isEmpty()) {
      log.warn("Could not read the dimension of chunks.embedding, skipping dimension check");
      return;
    }
    if (column.getAsInt() != properties.dimensions()) {
      throw new IllegalStateException(
          "archivist.embedding.dimensions is "
              + properties.dimensions()
              + " but chunks.embedding is vector("
              + column.getAsInt()
              + ")");
    }
    log.debug("chunks.embedding dimension matches configuration: {}", column.getAsInt());
  }
}
