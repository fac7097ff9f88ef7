package dev.archivist.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import java.util.List;
import org.junit.jupiter.api.Test;

class TextChunkerTest {

  private static final String LONG_ANSWER =
      String.join(
          "\n\n",
          "Passports can be renewed at any prefectural passport office. Bring your current"
              + " passport, one photograph taken within the last six months and the application"
              + " form, which is available at the counter or online.",
          "If your passport has expired you must also bring a certified copy of your family"
              + " register issued within six months. Processing usually takes one week,"
              + " excluding weekends and public holidays.",
          "Applicants living abroad should contact the nearest embassy or consulate. Fees are"
              + " payable in local currency and differ by validity period. Ten-year passports"
              + " are only issued to applicants aged eighteen or over.",
          "Lost or stolen passports must be reported to the police before a new passport can"
              + " be issued. The report receipt number is required on the application form.");

  private static final String MULTI_SEGMENT_ANSWER =
      String.join("\n\n", LONG_ANSWER, LONG_ANSWER, LONG_ANSWER, LONG_ANSWER);

  private final TextChunker chunker = new TextChunker();

  private static int sharedBoundary(String previous, String next) {
    int shared = 0;
    for (int k = 1; k <= Math.min(previous.length(), next.length()); k++) {
      if (previous.endsWith(next.substring(0, k))) {
        shared = k;
      }
    }
    return shared;
  }

  @Test
  void registersBuiltInStrategies() {
    assertThat(chunker.availableStrategies())
        .containsExactlyInAnyOrder(TextChunker.RECURSIVE, TextChunker.TOKEN, TextChunker.CHARACTER);
    assertThat(chunker.defaultStrategy()).isEqualTo(TextChunker.RECURSIVE);
  }

  @Test
  void shortTextIsSingleSegment() {
    assertThat(chunker.chunk("Bring your passport.", TextChunker.RECURSIVE))
        .containsExactly("Bring your passport.");
  }

  @Test
  void nullOrBlankTextYieldsNoSegments() {
    assertThat(chunker.chunk(null, TextChunker.RECURSIVE)).isEmpty();
    assertThat(chunker.chunk("", TextChunker.TOKEN)).isEmpty();
    assertThat(chunker.chunk("  \n ", TextChunker.CHARACTER)).isEmpty();
  }

  @Test
  void unknownStrategyFallsBackToDefault() {
    assertThat(chunker.chunk(LONG_ANSWER, "semantic"))
        .isEqualTo(chunker.chunk(LONG_ANSWER, TextChunker.RECURSIVE));
  }

  @Test
  void splittingIsDeterministic() {
    for (String strategy : chunker.availableStrategies()) {
      assertThat(chunker.chunk(LONG_ANSWER, strategy))
          .as(strategy)
          .isEqualTo(chunker.chunk(LONG_ANSWER, strategy));
    }
  }

  @Test
  void recursiveSegmentsRespectCharacterBound() {
    List<String> segments = chunker.chunk(LONG_ANSWER, TextChunker.RECURSIVE);

    assertThat(segments).hasSizeGreaterThan(1);
    assertThat(segments).allSatisfy(s -> assertThat(s.length()).isLessThanOrEqualTo(500));
  }

  @Test
  void tokenSegmentsRespectTokenBound() {
    TextChunker small =
        new TextChunker(
            new ChunkingProperties(
                TextChunker.RECURSIVE,
                "text-embedding-3-small",
                new ChunkingProperties.SegmentSize(500, 50),
                new ChunkingProperties.SegmentSize(40, 5),
                new ChunkingProperties.SegmentSize(600, 60)));
    OpenAiTokenCountEstimator estimator = new OpenAiTokenCountEstimator("text-embedding-3-small");

    List<String> segments = small.chunk(LONG_ANSWER, TextChunker.TOKEN);

    assertThat(segments).hasSizeGreaterThan(1);
    assertThat(segments)
        .allSatisfy(s -> assertThat(estimator.estimateTokenCountInText(s)).isLessThanOrEqualTo(40));
  }

  @Test
  void characterSegmentsRespectCharacterBound() {
    List<String> segments = chunker.chunk(LONG_ANSWER, TextChunker.CHARACTER);

    assertThat(segments).isNotEmpty();
    assertThat(segments).allSatisfy(s -> assertThat(s.length()).isLessThanOrEqualTo(600));
  }

  @Test
  void consecutiveSegmentsShareTextForEveryBuiltInStrategy() {
    for (String strategy :
        List.of(TextChunker.RECURSIVE, TextChunker.TOKEN, TextChunker.CHARACTER)) {
      List<String> segments = chunker.chunk(MULTI_SEGMENT_ANSWER, strategy);

      assertThat(segments).as(strategy).hasSizeGreaterThan(1);
      for (int i = 1; i < segments.size(); i++) {
        assertThat(sharedBoundary(segments.get(i - 1), segments.get(i)))
            .as("%s segments %d and %d", strategy, i - 1, i)
            .isGreaterThanOrEqualTo(20);
      }
    }
  }

  @Test
  void textWithoutWhitespaceStillOverlaps() {
    String answer = "パスポートの更新は各都道府県の旅券窓口で受け付けています。".repeat(30);

    List<String> segments = chunker.chunk(answer, TextChunker.RECURSIVE);

    assertThat(segments).hasSizeGreaterThan(1);
    assertThat(segments).allSatisfy(s -> assertThat(s.length()).isLessThanOrEqualTo(500));
    for (int i = 1; i < segments.size(); i++) {
      assertThat(sharedBoundary(segments.get(i - 1), segments.get(i))).isGreaterThanOrEqualTo(20);
    }
  }

  @Test
  void overlapMustBePositiveAndBelowHalfTheSegmentSize() {
    ChunkingProperties defaults = ChunkingProperties.defaults();

    assertThatThrownBy(
            () ->
                new TextChunker(
                    new ChunkingProperties(
                        defaults.defaultStrategy(),
                        defaults.tokenizerModel(),
                        new ChunkingProperties.SegmentSize(500, 0),
                        defaults.token(),
                        defaults.character())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("maxOverlap");
    assertThatThrownBy(
            () ->
                new TextChunker(
                    new ChunkingProperties(
                        defaults.defaultStrategy(),
                        defaults.tokenizerModel(),
                        defaults.recursive(),
                        defaults.token(),
                        new ChunkingProperties.SegmentSize(100, 50))))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void customStrategyCanBeRegistered() {
    chunker.register("tiny", DocumentSplitters.recursive(80, 10));

    assertThat(chunker.availableStrategies()).contains("tiny");
    assertThat(chunker.chunk(LONG_ANSWER, "tiny"))
        .allSatisfy(s -> assertThat(s.length()).isLessThanOrEqualTo(80));
  }

  @Test
  void existingStrategyCannotBeReplaced() {
    assertThatThrownBy(
            () -> chunker.register(TextChunker.RECURSIVE, DocumentSplitters.recursive(10, 1)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("already registered");
  }

  @Test
  void unknownDefaultStrategyIsRejected() {
    ChunkingProperties defaults = ChunkingProperties.defaults();

    assertThatThrownBy(
            () ->
                new TextChunker(
                    new ChunkingProperties(
                        "semantic",
                        defaults.tokenizerModel(),
                        defaults.recursive(),
                        defaults.token(),
                        defaults.character())))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
