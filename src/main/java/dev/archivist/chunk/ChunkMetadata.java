package dev.archivist.chunk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * JSONB metadata stored with every chunk.
 *
 * <p>Both question and answer chunks carry the full question and answer text so that a retrieved
 * chunk can be shown with its context. {@code answerChunk} is only present on answer chunks.
 *
 * @param type {@code "question"} or {@code "answer"}
 * @param question the row's full question text
 * @param answer the row's full answer text
 * @param answerChunk the answer segment this chunk holds, null for the question chunk
 * @param chunkInfo position and chunking details
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChunkMetadata(
    String type,
    String question,
    String answer,
    @JsonProperty("answer_chunk") @Nullable String answerChunk,
    @JsonProperty("chunk_info") ChunkInfo chunkInfo) {

  public static final String TYPE_QUESTION = "question";
  public static final String TYPE_ANSWER = "answer";

  /** Chunk method recorded for the question chunk, which is never split. */
  public static final String QUESTION_CHUNK_METHOD = "single";

  public static ChunkMetadata forQuestion(String question, String answer) {
    return new ChunkMetadata(
        TYPE_QUESTION,
        question,
        answer,
        null,
        new ChunkInfo(QUESTION_CHUNK_METHOD, 0, true, null, null));
  }

  public static ChunkMetadata forAnswer(
      String question,
      String answer,
      String answerChunk,
      String chunkMethod,
      int chunkIndex,
      int totalAnswerChunks) {
    return new ChunkMetadata(
        TYPE_ANSWER,
        question,
        answer,
        answerChunk,
        new ChunkInfo(
            chunkMethod,
            chunkIndex,
            false,
            totalAnswerChunks,
            answer.codePointCount(0, answer.length())));
  }

  /**
   * Chunk position details.
   *
   * @param chunkMethod strategy name, {@code "single"} for the question
   * @param chunkIndex 0 for the question, 1..N for answer chunks
   * @param isQuestion whether this is the question chunk
   * @param totalAnswerChunks N, answer chunks only
   * @param originalLength code point length of the full answer, answer chunks only
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ChunkInfo(
      @JsonProperty("chunk_method") String chunkMethod,
      @JsonProperty("chunk_index") int chunkIndex,
      @JsonProperty("is_question") boolean isQuestion,
      @JsonProperty("total_answer_chunks") @Nullable Integer totalAnswerChunks,
      @JsonProperty("original_length") @Nullable Integer originalLength) {}
}
