package dev.archivist.ingestion;

import dev.archivist.chunk.ChunkMetadata;
import dev.archivist.dataset.QaRow;
import dev.archivist.ingestion.chunking.TextChunker;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns one dataset row into its chunk drafts.
 *
 * <p>Chunk 0 is always the full question, recorded with chunk method {@code "single"}. The answer
 * is split with the run's strategy into chunks 1..N, each recording the strategy name as given,
 * the total N and the answer's original length. An empty answer yields the question chunk alone.
 */
@Component
public class RowChunkAssembler {

  private final TextChunker chunker;

  public RowChunkAssembler(TextChunker chunker) {
    this.chunker = chunker;
  }

  public List<ChunkDraft> assemble(QaRow row, String strategy) {
    List<String> answerSegments = chunker.chunk(row.answer(), strategy);

    List<ChunkDraft> drafts = new ArrayList<>(answerSegments.size() + 1);
    drafts.add(
        new ChunkDraft(row.question(), ChunkMetadata.forQuestion(row.question(), row.answer())));
    for (int i = 0; i < answerSegments.size(); i++) {
      String segment = answerSegments.get(i);
      drafts.add(
          new ChunkDraft(
              segment,
              ChunkMetadata.forAnswer(
                  row.question(), row.answer(), segment, strategy, i + 1, answerSegments.size())));
    }
    return drafts;
  }
}
