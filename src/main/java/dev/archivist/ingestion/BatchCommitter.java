package dev.archivist.ingestion;

import dev.archivist.dataset.QaRow;
import dev.archivist.embedding.EmbeddingClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * Drives an ingestion run over a row sequence and groups the staged work into transactions.
 *
 * <p>The committer owns one transaction at a time for the whole run. Each row is handed to the
 * {@link IngestionCoordinator}, which works inside a savepoint of that transaction. Every {@code
 * commitInterval} rows the transaction is committed and a new one is opened; a final commit
 * follows the last row. Row-scoped failures are counted and the run continues.
 *
 * <p>A failure that escapes the coordinator (an {@link Error} included), a failed commit or an
 * interrupt aborts the run: the open transaction is rolled back, an error event is emitted and
 * the exception propagates. Work committed before that point stays durable.
 */
@Service
public class BatchCommitter {

  private static final Logger log = LoggerFactory.getLogger(BatchCommitter.class);

  private final PlatformTransactionManager transactionManager;
  private final IngestionCoordinator coordinator;
  private final EmbeddingClient embeddingClient;
  private final IngestionListener listener;
  private final Clock clock;
  private final IngestionProperties properties;

  public BatchCommitter(
      PlatformTransactionManager transactionManager,
      IngestionCoordinator coordinator,
      EmbeddingClient embeddingClient,
      IngestionListener listener,
      Clock clock,
      IngestionProperties properties) {
    this.transactionManager = transactionManager;
    this.coordinator = coordinator;
    this.embeddingClient = embeddingClient;
    this.listener = listener;
    this.clock = clock;
    this.properties = properties;
  }

  /** Ingests rows with the configured {@code archivist.ingestion.*} options. */
  public IngestionSummary ingest(List<QaRow> rows) {
    return ingest(rows, properties.toOptions());
  }

  /**
   * Ingests rows.
   *
   * @param rows the dataset rows, in ingestion order
   * @param options strategy, limit and intervals for this run
   * @return counts of what was committed; all zero if the embedding client is unavailable
   * @throws CommitFailedException if a commit fails
   * @throws IngestionCancelledException if the thread is interrupted
   */
  public IngestionSummary ingest(List<QaRow> rows, IngestionOptions options) {
    List<QaRow> selected = applyLimit(rows, options);
    int totalRows = selected.size();
    listener.onStart(totalRows, options.strategy());

    if (!embeddingClient.isAvailable()) {
      log.error("Embedding client not available, aborting ingestion before the first row");
      return IngestionSummary.empty();
    }

    Instant startedAt = clock.instant();
    DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
    definition.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
    definition.setName("ingestion-batch");

    IngestionTally tally = IngestionTally.empty();
    TransactionStatus transaction = transactionManager.getTransaction(definition);
    try {
      for (QaRow row : selected) {
        if (Thread.currentThread().isInterrupted()) {
          throw new IngestionCancelledException(
              "Ingestion interrupted after " + tally.attempted() + " rows");
        }
        tally = tally.plus(coordinator.processRow(row, options.strategy()));

        if (tally.attempted() % options.commitInterval() == 0) {
          commit(transaction, tally);
          transaction = transactionManager.getTransaction(definition);
        }
        if (tally.attempted() % options.progressInterval() == 0) {
          listener.onProgress(
              new IngestionProgress(
                  tally.attempted(), totalRows, tally.chunks(), elapsedSince(startedAt)));
        }
      }
      commit(transaction, tally);
    } catch (RuntimeException | Error e) {
      if (!transaction.isCompleted()) {
        rollback(transaction, e);
      }
      listener.onError(e, "ingesting rows");
      throw e;
    }

    IngestionSummary summary = IngestionSummary.of(tally, elapsedSince(startedAt));
    listener.onComplete(summary);
    return summary;
  }

  private static List<QaRow> applyLimit(List<QaRow> rows, IngestionOptions options) {
    Integer limit = options.limit();
    if (limit == null || limit >= rows.size()) {
      return rows;
    }
    return rows.subList(0, limit);
  }

  private void commit(TransactionStatus transaction, IngestionTally tally) {
    try {
      transactionManager.commit(transaction);
    } catch (TransactionException e) {
      throw new CommitFailedException(
          "Commit failed after " + tally.attempted() + " rows", e);
    }
    listener.onCommit(tally.attempted(), tally.chunks());
  }

  private void rollback(TransactionStatus transaction, Throwable cause) {
    try {
      transactionManager.rollback(transaction);
    } catch (TransactionException e) {
      cause.addSuppressed(e);
      log.error("Rollback failed: {}", e.getMessage(), e);
    }
  }

  private Duration elapsedSince(Instant startedAt) {
    return Duration.between(startedAt, clock.instant());
  }
}
