package dev.archivist.runner;

import dev.archivist.chunk.ChunkRepository;
import dev.archivist.chunk.EmbeddingSample;
import dev.archivist.chunk.StoreStatistics;
import dev.archivist.dataset.DatasetProperties;
import dev.archivist.dataset.QaRow;
import dev.archivist.dataset.QaRowReader;
import dev.archivist.embedding.EmbeddingClient;
import dev.archivist.ingestion.BatchCommitter;
import dev.archivist.ingestion.IngestionSummary;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one ingestion on startup: load the dataset, initialize embeddings, ingest, report.
 *
 * <p>Disabled with {@code archivist.runner.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "archivist.runner.enabled", havingValue = "true")
public class IngestionRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

  private final QaRowReader reader;
  private final DatasetProperties datasetProperties;
  private final EmbeddingClient embeddingClient;
  private final BatchCommitter batchCommitter;
  private final ChunkRepository chunkRepository;

  public IngestionRunner(
      QaRowReader reader,
      DatasetProperties datasetProperties,
      EmbeddingClient embeddingClient,
      BatchCommitter batchCommitter,
      ChunkRepository chunkRepository) {
    this.reader = reader;
    this.datasetProperties = datasetProperties;
    this.embeddingClient = embeddingClient;
    this.batchCommitter = batchCommitter;
    this.chunkRepository = chunkRepository;
  }

  @Override
  public void run(ApplicationArguments args) {
    log.info("Loading dataset from {}", datasetProperties.location());
    List<QaRow> rows = reader.read(datasetProperties.location());

    if (!embeddingClient.initialize()) {
      log.error("Embedding service is not available, aborting ingestion");
      return;
    }
    log.info("Embedding service is available");

    IngestionSummary summary = batchCommitter.ingest(rows);
    log.info(
        "Ingested {} rows ({} failed) into {} chunks",
        summary.processedRows(),
        summary.failedRows(),
        summary.totalChunks());

    reportStatistics(chunkRepository.statistics());
    reportEmbeddings(chunkRepository.sampleEmbedding());
  }

  private void reportStatistics(StoreStatistics statistics) {
    log.info("Store statistics:");
    log.info("  - copyright_holders: {}", statistics.copyrightHolders());
    log.info("  - sources: {}", statistics.sources());
    log.info("  - chunks: {}", statistics.chunks());
  }

  private void reportEmbeddings(Optional<EmbeddingSample> sample) {
    if (sample.isEmpty()) {
      log.warn("No embeddings found in the store");
      return;
    }
    log.info("Embeddings generated successfully");
    log.info("  - Embedding dimension: {}", sample.get().dimension());
    log.info("  - Sample text: {}", sample.get().sampleText());
  }
}
