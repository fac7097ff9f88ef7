package dev.archivist.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.archivist.dataset.QaRow;
import dev.archivist.embedding.EmbeddingClient;
import dev.archivist.fixture.QaRowBuilder;
import dev.archivist.provenance.ProvenanceInvariantViolationException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class BatchCommitterTest {

  private static final String STRATEGY = "token";

  @Mock private PlatformTransactionManager transactionManager;

  @Mock private IngestionCoordinator coordinator;

  @Mock private EmbeddingClient embeddingClient;

  @Mock private IngestionListener listener;

  private BatchCommitter committer;

  @BeforeEach
  void setUp() {
    committer =
        new BatchCommitter(
            transactionManager,
            coordinator,
            embeddingClient,
            listener,
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC),
            new IngestionProperties(STRATEGY, null, 500, 100));
  }

  @AfterEach
  void clearInterruptFlag() {
    Thread.interrupted();
  }

  private void stubOpenTransactions() {
    when(transactionManager.getTransaction(any())).thenAnswer(inv -> new SimpleTransactionStatus());
  }

  private void stubEveryRowSucceeds(int chunksPerRow) {
    when(coordinator.processRow(any(), eq(STRATEGY)))
        .thenAnswer(inv -> RowOutcome.success(inv.<QaRow>getArgument(0).url(), chunksPerRow));
  }

  @Test
  void commitsEveryIntervalPlusFinalCommit() {
    when(embeddingClient.isAvailable()).thenReturn(true);
    stubOpenTransactions();
    stubEveryRowSucceeds(3);

    IngestionSummary summary =
        committer.ingest(QaRowBuilder.rows(123), new IngestionOptions(STRATEGY, null, 500, 50));

    verify(transactionManager, times(3)).commit(any());
    verify(transactionManager, never()).rollback(any());
    InOrder order = inOrder(listener);
    order.verify(listener).onStart(123, STRATEGY);
    order.verify(listener).onCommit(50, 150L);
    order.verify(listener).onCommit(100, 300L);
    order.verify(listener).onCommit(123, 369L);
    order.verify(listener).onComplete(summary);

    assertThat(summary.processedRows()).isEqualTo(123);
    assertThat(summary.failedRows()).isZero();
    assertThat(summary.totalChunks()).isEqualTo(369L);
  }

  @Test
  void failedRowsAreCountedAndRunContinues() {
    when(embeddingClient.isAvailable()).thenReturn(true);
    stubOpenTransactions();
    when(coordinator.processRow(any(), eq(STRATEGY)))
        .thenAnswer(
            inv -> {
              QaRow row = inv.getArgument(0);
              return row.url().endsWith("/7")
                  ? RowOutcome.failed(row.url(), new IllegalStateException("bad row"))
                  : RowOutcome.success(row.url(), 2);
            });

    IngestionSummary summary =
        committer.ingest(QaRowBuilder.rows(123), new IngestionOptions(STRATEGY, null, 500, 50));

    assertThat(summary.processedRows()).isEqualTo(122);
    assertThat(summary.failedRows()).isEqualTo(1);
    assertThat(summary.totalChunks()).isEqualTo(244L);
    verify(coordinator, times(123)).processRow(any(), eq(STRATEGY));
    verify(transactionManager, times(3)).commit(any());
  }

  @Test
  void emitsProgressEveryInterval() {
    when(embeddingClient.isAvailable()).thenReturn(true);
    stubOpenTransactions();
    stubEveryRowSucceeds(1);

    committer.ingest(QaRowBuilder.rows(45), new IngestionOptions(STRATEGY, null, 20, 100));

    ArgumentCaptor<IngestionProgress> progress = ArgumentCaptor.forClass(IngestionProgress.class);
    verify(listener, times(2)).onProgress(progress.capture());
    assertThat(progress.getAllValues())
        .extracting(IngestionProgress::processedRows)
        .containsExactly(20, 40);
    assertThat(progress.getAllValues()).allSatisfy(p -> assertThat(p.totalRows()).isEqualTo(45));
  }

  @Test
  void limitIsAppliedBeforeProcessing() {
    when(embeddingClient.isAvailable()).thenReturn(true);
    stubOpenTransactions();
    stubEveryRowSucceeds(2);

    IngestionSummary summary =
        committer.ingest(QaRowBuilder.rows(30), new IngestionOptions(STRATEGY, 10, 500, 100));

    assertThat(summary.processedRows()).isEqualTo(10);
    verify(listener).onStart(10, STRATEGY);
    verify(coordinator, times(10)).processRow(any(), eq(STRATEGY));
    verify(transactionManager, times(1)).commit(any());
  }

  @Test
  void unavailableEmbeddingClientAbortsBeforeFirstRow() {
    when(embeddingClient.isAvailable()).thenReturn(false);

    IngestionSummary summary = committer.ingest(QaRowBuilder.rows(5));

    assertThat(summary).isEqualTo(IngestionSummary.empty());
    verifyNoInteractions(transactionManager, coordinator);
  }

  @Test
  void escapingFailureRollsBackOpenTransactionAndPropagates() {
    when(embeddingClient.isAvailable()).thenReturn(true);
    stubOpenTransactions();
    ProvenanceInvariantViolationException violation =
        new ProvenanceInvariantViolationException("source", "u", new RuntimeException());
    when(coordinator.processRow(any(), eq(STRATEGY)))
        .thenAnswer(
            inv -> {
              QaRow row = inv.getArgument(0);
              if (row.url().endsWith("/3")) {
                throw violation;
              }
              return RowOutcome.success(row.url(), 1);
            });

    assertThatThrownBy(
            () ->
                committer.ingest(
                    QaRowBuilder.rows(10), new IngestionOptions(STRATEGY, null, 500, 2)))
        .isSameAs(violation);

    verify(transactionManager, times(1)).commit(any());
    verify(transactionManager).rollback(any());
    verify(listener).onError(eq(violation), anyString());
    verify(listener, never()).onComplete(any());
  }

  @Test
  void errorEscapingRowRollsBackOpenTransactionAndPropagates() {
    when(embeddingClient.isAvailable()).thenReturn(true);
    stubOpenTransactions();
    StackOverflowError overflow = new StackOverflowError();
    when(coordinator.processRow(any(), eq(STRATEGY))).thenThrow(overflow);

    assertThatThrownBy(() -> committer.ingest(QaRowBuilder.rows(3)))
        .isSameAs(overflow);

    verify(transactionManager).rollback(any());
    verify(transactionManager, never()).commit(any());
    verify(listener).onError(eq(overflow), anyString());
    verify(listener, never()).onComplete(any());
  }

  @Test
  void commitFailureAbortsRun() {
    when(embeddingClient.isAvailable()).thenReturn(true);
    stubOpenTransactions();
    stubEveryRowSucceeds(1);
    doThrow(new TransactionSystemException("connection lost"))
        .when(transactionManager)
        .commit(any(TransactionStatus.class));

    assertThatThrownBy(
            () ->
                committer.ingest(QaRowBuilder.rows(5), new IngestionOptions(STRATEGY, null, 500, 2)))
        .isInstanceOf(CommitFailedException.class)
        .hasCauseInstanceOf(TransactionSystemException.class);

    verify(coordinator, times(2)).processRow(any(), eq(STRATEGY));
    verify(listener).onError(any(CommitFailedException.class), anyString());
    verify(listener, never()).onCommit(anyInt(), anyLong());
  }

  @Test
  void interruptCancelsRunAndRollsBackUncommittedWork() {
    when(embeddingClient.isAvailable()).thenReturn(true);
    stubOpenTransactions();
    when(coordinator.processRow(any(), eq(STRATEGY)))
        .thenAnswer(
            inv -> {
              QaRow row = inv.getArgument(0);
              if (row.url().endsWith("/4")) {
                Thread.currentThread().interrupt();
              }
              return RowOutcome.success(row.url(), 1);
            });

    assertThatThrownBy(
            () ->
                committer.ingest(
                    QaRowBuilder.rows(10), new IngestionOptions(STRATEGY, null, 500, 2)))
        .isInstanceOf(IngestionCancelledException.class);

    verify(coordinator, times(5)).processRow(any(), eq(STRATEGY));
    verify(transactionManager, times(2)).commit(any());
    verify(transactionManager).rollback(any());
  }
}
