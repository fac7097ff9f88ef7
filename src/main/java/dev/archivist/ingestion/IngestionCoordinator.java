package dev.archivist.ingestion;

import dev.archivist.chunk.ChunkRepository;
import dev.archivist.chunk.EmbeddedChunk;
import dev.archivist.dataset.QaRow;
import dev.archivist.embedding.EmbeddingClient;
import dev.archivist.embedding.EmbeddingProviderUnavailableException;
import dev.archivist.provenance.ProvenanceInvariantViolationException;
import dev.archivist.provenance.ProvenanceStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Ingests one dataset row as an atomic unit of work.
 *
 * <p>For each row the coordinator resolves its copyright holder and source, assembles the question
 * chunk and the answer chunks, embeds all of them in one batched call and stages them for
 * insertion. The whole sequence runs inside a savepoint of the caller's transaction: if any step
 * fails, the row's work is rolled back, the failure is logged with the row's URL and a failed
 * {@link RowOutcome} is returned so that the run can continue.
 *
 * <p>Two failures are not row-scoped and propagate: a {@link
 * ProvenanceInvariantViolationException}, and an interrupt of the ingesting thread, reported as
 * {@link IngestionCancelledException}.
 */
@Service
public class IngestionCoordinator {

  private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);

  private final ProvenanceStore provenanceStore;
  private final RowChunkAssembler assembler;
  private final EmbeddingClient embeddingClient;
  private final ChunkRepository chunkRepository;
  private final Validator validator;
  private final TransactionOperations savepointTransaction;

  public IngestionCoordinator(
      ProvenanceStore provenanceStore,
      RowChunkAssembler assembler,
      EmbeddingClient embeddingClient,
      ChunkRepository chunkRepository,
      Validator validator,
      @Qualifier("savepointTransaction") TransactionOperations savepointTransaction) {
    this.provenanceStore = provenanceStore;
    this.assembler = assembler;
    this.embeddingClient = embeddingClient;
    this.chunkRepository = chunkRepository;
    this.validator = validator;
    this.savepointTransaction = savepointTransaction;
  }

  /**
   * Processes one row.
   *
   * @param row the dataset row
   * @param strategy chunking strategy for the answer
   * @return the number of chunks staged, or the row-scoped failure
   * @throws ProvenanceInvariantViolationException if provenance resolution hit a corrupted unique
   *     key
   * @throws IngestionCancelledException if the thread was interrupted while processing the row
   */
  public RowOutcome processRow(QaRow row, String strategy) {
    try {
      Integer staged = savepointTransaction.execute(status -> stage(row, strategy));
      return RowOutcome.success(row.url(), staged == null ? 0 : staged);
    } catch (ProvenanceInvariantViolationException | IngestionCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      if (Thread.currentThread().isInterrupted()) {
        throw new IngestionCancelledException("Ingestion interrupted at " + row.url(), e);
      }
      log.error("Failed to ingest row {}: {}", row.url(), e.getMessage(), e);
      return RowOutcome.failed(row.url(), e);
    }
  }

  private int stage(QaRow row, String strategy) {
    validate(row);

    long holderId = provenanceStore.resolveCopyrightHolder(row.copyright());
    long sourceId = provenanceStore.resolveSource(holderId, row.url());

    List<ChunkDraft> drafts = assembler.assemble(row, strategy);

    if (!embeddingClient.isAvailable()) {
      throw new EmbeddingProviderUnavailableException("Embedding client is not available");
    }
    List<float[]> vectors =
        embeddingClient.embedBatch(drafts.stream().map(ChunkDraft::content).toList());

    List<EmbeddedChunk> chunks = new ArrayList<>(drafts.size());
    for (int i = 0; i < drafts.size(); i++) {
      chunks.add(drafts.get(i).withEmbedding(vectors.get(i)));
    }
    chunkRepository.insertAll(sourceId, chunks);

    log.debug("Staged {} chunks for {}", chunks.size(), row.url());
    return chunks.size();
  }

  private void validate(QaRow row) {
    Set<ConstraintViolation<QaRow>> violations = validator.validate(row);
    if (!violations.isEmpty()) {
      String detail =
          violations.stream()
              .map(v -> v.getPropertyPath() + " " + v.getMessage())
              .sorted()
              .collect(Collectors.joining(", "));
      throw new IllegalArgumentException("Invalid row: " + detail);
    }
  }
}
