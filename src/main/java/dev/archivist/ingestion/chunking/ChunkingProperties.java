package dev.archivist.ingestion.chunking;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the built-in chunking strategies, bound from {@code archivist.chunking.*}.
 *
 * @param defaultStrategy strategy used when an unknown name is requested
 * @param tokenizerModel OpenAI model whose tokenizer bounds the {@code token} strategy
 * @param recursive sizes for the {@code recursive} strategy, in characters
 * @param token sizes for the {@code token} strategy, in tokens
 * @param character sizes for the {@code character} strategy, in characters
 */
@Validated
@ConfigurationProperties(prefix = "archivist.chunking")
public record ChunkingProperties(
    @DefaultValue(TextChunker.RECURSIVE) @NotBlank String defaultStrategy,
    @DefaultValue("text-embedding-3-small") @NotBlank String tokenizerModel,
    @Valid @NotNull SegmentSize recursive,
    @Valid @NotNull SegmentSize token,
    @Valid @NotNull SegmentSize character) {

  public static ChunkingProperties defaults() {
    return new ChunkingProperties(
        TextChunker.RECURSIVE,
        "text-embedding-3-small",
        new SegmentSize(500, 50),
        new SegmentSize(400, 40),
        new SegmentSize(600, 60));
  }

  /**
   * Segment bounds of one strategy.
   *
   * @param maxSegmentSize upper bound of a segment
   * @param maxOverlap upper bound of the text shared by consecutive segments, below half of {@code
   *     maxSegmentSize}
   */
  public record SegmentSize(@Positive int maxSegmentSize, @Positive int maxOverlap) {}
}
