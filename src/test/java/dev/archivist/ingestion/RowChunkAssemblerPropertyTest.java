package dev.archivist.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import dev.archivist.chunk.ChunkMetadata;
import dev.archivist.dataset.QaRow;
import dev.archivist.ingestion.chunking.TextChunker;
import java.util.List;
import java.util.stream.IntStream;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for the chunk numbering of an assembled row: chunk 0 is the question and the
 * answer chunks are numbered 1..k with {@code total_answer_chunks = k}, whatever the answer looks
 * like.
 */
class RowChunkAssemblerPropertyTest {

  private final TextChunker chunker = new TextChunker();
  private final RowChunkAssembler assembler = new RowChunkAssembler(chunker);

  @Provide
  Arbitrary<String> answers() {
    Arbitrary<String> words =
        Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(12);
    Arbitrary<String> sentences =
        words.list().ofMinSize(1).ofMaxSize(30).map(w -> String.join(" ", w) + ".");
    return sentences.list().ofMinSize(0).ofMaxSize(25).map(s -> String.join("\n\n", s));
  }

  @Provide
  Arbitrary<String> strategies() {
    return Arbitraries.of(TextChunker.RECURSIVE, TextChunker.TOKEN, TextChunker.CHARACTER);
  }

  @Property(tries = 50)
  void answerChunksAreNumberedOneToK(
      @ForAll("answers") String answer, @ForAll("strategies") String strategy) {
    QaRow row = new QaRow("Holder", "https://example.org/faq", "Question?", answer);

    List<ChunkDraft> drafts = assembler.assemble(row, strategy);
    int k = drafts.size() - 1;

    assertThat(k).isEqualTo(chunker.chunk(answer, strategy).size());
    assertThat(drafts.get(0).metadata().chunkInfo().chunkIndex()).isZero();
    assertThat(drafts.get(0).metadata().chunkInfo().isQuestion()).isTrue();

    List<ChunkMetadata.ChunkInfo> answerInfo =
        drafts.subList(1, drafts.size()).stream().map(d -> d.metadata().chunkInfo()).toList();
    assertThat(answerInfo)
        .extracting(ChunkMetadata.ChunkInfo::chunkIndex)
        .containsExactlyElementsOf(IntStream.rangeClosed(1, k).boxed().toList());
    assertThat(answerInfo)
        .allSatisfy(
            info -> {
              assertThat(info.isQuestion()).isFalse();
              assertThat(info.totalAnswerChunks()).isEqualTo(k);
            });
  }

  @Property(tries = 30)
  void assemblyIsDeterministic(
      @ForAll("answers") String answer, @ForAll("strategies") String strategy) {
    QaRow row = new QaRow("Holder", "https://example.org/faq", "Question?", answer);

    assertThat(assembler.assemble(row, strategy)).isEqualTo(assembler.assemble(row, strategy));
  }
}
