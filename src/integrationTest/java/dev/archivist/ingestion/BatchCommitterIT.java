package dev.archivist.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.archivist.BaseIntegrationTest;
import dev.archivist.StubEmbeddingConfig;
import dev.archivist.dataset.QaRow;
import dev.archivist.fixture.QaRowBuilder;
import dev.archivist.ingestion.chunking.TextChunker;
import dev.archivist.provenance.SourceRepository;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class BatchCommitterIT extends BaseIntegrationTest {

  @Autowired private BatchCommitter batchCommitter;

  @Autowired private SourceRepository sourceRepository;

  @AfterEach
  void clearInterruptFlag() {
    Thread.interrupted();
  }

  private static List<QaRow> rows(int count, int markedRow, String marker) {
    List<QaRow> rows = new ArrayList<>(QaRowBuilder.rows(count));
    QaRow marked = rows.get(markedRow);
    rows.set(
        markedRow,
        new QaRowBuilder()
            .url(marked.url())
            .answer("This answer breaks the provider " + marker)
            .build());
    return rows;
  }

  @Test
  void ingestsRowsWithProvenanceAndEmbeddings() {
    IngestionSummary summary =
        batchCommitter.ingest(
            QaRowBuilder.rows(12), new IngestionOptions(TextChunker.TOKEN, null, 5, 5));

    assertThat(summary.processedRows()).isEqualTo(12);
    assertThat(summary.failedRows()).isZero();
    assertThat(summary.totalChunks()).isEqualTo(24);
    assertThat(countRows("copyright_holders")).isEqualTo(1);
    assertThat(countRows("sources")).isEqualTo(12);
    assertThat(countRows("chunks")).isEqualTo(24);

    Integer questionChunks =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM chunks WHERE (metadata->'chunk_info'->>'is_question')::boolean"
                + " AND (metadata->'chunk_info'->>'chunk_index')::int = 0",
            Integer.class);
    assertThat(questionChunks).isEqualTo(12);
  }

  @Test
  void failingRowLeavesNoTraceAndRunContinues() {
    List<QaRow> rows = rows(10, 4, StubEmbeddingConfig.FAIL_MARKER);

    IngestionSummary summary =
        batchCommitter.ingest(rows, new IngestionOptions(TextChunker.TOKEN, null, 100, 3));

    assertThat(summary.processedRows()).isEqualTo(9);
    assertThat(summary.failedRows()).isEqualTo(1);
    assertThat(countRows("chunks")).isEqualTo(18);
    assertThat(sourceRepository.findIdByUrl(rows.get(4).url())).isEmpty();
    assertThat(sourceRepository.findIdByUrl(rows.get(5).url())).isPresent();
  }

  @Test
  void reingestingTheSameRowsReusesProvenance() {
    List<QaRow> rows = QaRowBuilder.rows(4);
    IngestionOptions options = new IngestionOptions(TextChunker.RECURSIVE, null, 100, 100);

    batchCommitter.ingest(rows, options);
    batchCommitter.ingest(rows, options);

    assertThat(countRows("copyright_holders")).isEqualTo(1);
    assertThat(countRows("sources")).isEqualTo(4);
    assertThat(countRows("chunks")).isEqualTo(16);
  }

  @Test
  void cancellationKeepsLastCommitAndDiscardsOpenBatch() {
    List<QaRow> rows = rows(10, 7, StubEmbeddingConfig.INTERRUPT_MARKER);

    assertThatThrownBy(
            () -> batchCommitter.ingest(rows, new IngestionOptions(TextChunker.TOKEN, null, 100, 3)))
        .isInstanceOf(IngestionCancelledException.class);
    Thread.interrupted();

    assertThat(countRows("sources")).isEqualTo(6);
    assertThat(countRows("chunks")).isEqualTo(12);
    assertThat(sourceRepository.findIdByUrl(rows.get(6).url())).isEmpty();
  }
}
