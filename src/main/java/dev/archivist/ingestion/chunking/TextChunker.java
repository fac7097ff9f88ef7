package dev.archivist.ingestion.chunking;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentByLineSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits text into bounded, overlapping segments using a named strategy.
 *
 * <p>Three strategies are registered at construction, all backed by LangChain4j splitters:
 *
 * <ul>
 *   <li>{@code recursive}: paragraph, then line, sentence, word and character boundaries,
 *       bounded in characters
 *   <li>{@code token}: the same hierarchy bounded in tokens of the embedding model's tokenizer
 *   <li>{@code character}: newline-separated pieces merged up to a character bound
 * </ul>
 *
 * <p>Consecutive segments of a built-in strategy always share text: each one after the first
 * starts with up to {@code maxOverlap} units of its predecessor's tail, cut at a word boundary
 * where there is one.
 *
 * <p>An unknown strategy name falls back to the configured default instead of failing. Splitting
 * is deterministic, which re-ingestion relies on. Further strategies can be added with {@link
 * #register(String, DocumentSplitter)}; existing ones cannot be replaced.
 */
@Component
public class TextChunker {

  public static final String RECURSIVE = "recursive";
  public static final String TOKEN = "token";
  public static final String CHARACTER = "character";

  private static final Logger log = LoggerFactory.getLogger(TextChunker.class);

  private final Map<String, DocumentSplitter> splitters = new ConcurrentHashMap<>();
  private final String defaultStrategy;

  public TextChunker() {
    this(ChunkingProperties.defaults());
  }

  @Autowired
  public TextChunker(ChunkingProperties properties) {
    ChunkingProperties.SegmentSize recursive = properties.recursive();
    ChunkingProperties.SegmentSize token = properties.token();
    ChunkingProperties.SegmentSize character = properties.character();

    OpenAiTokenCountEstimator tokenizer =
        new OpenAiTokenCountEstimator(properties.tokenizerModel());

    splitters.put(
        RECURSIVE,
        OverlappingSplitter.of(
            recursive, String::length, max -> DocumentSplitters.recursive(max, 0)));
    splitters.put(
        TOKEN,
        OverlappingSplitter.of(
            token,
            tokenizer::estimateTokenCountInText,
            max -> DocumentSplitters.recursive(max, 0, tokenizer)));
    splitters.put(
        CHARACTER,
        OverlappingSplitter.of(
            character, String::length, max -> new DocumentByLineSplitter(max, 0)));

    if (!splitters.containsKey(properties.defaultStrategy())) {
      throw new IllegalArgumentException(
          "Unknown default chunking strategy: " + properties.defaultStrategy());
    }
    this.defaultStrategy = properties.defaultStrategy();
  }

  /**
   * Splits text with the named strategy.
   *
   * @param text the text to split
   * @param strategy a registered strategy name; unknown names use the default strategy
   * @return segments in text order, empty for null or blank text
   */
  public List<String> chunk(@Nullable String text, String strategy) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    DocumentSplitter splitter = splitters.get(strategy);
    if (splitter == null) {
      log.debug("Unknown chunking strategy '{}', using '{}'", strategy, defaultStrategy);
      splitter = splitters.get(defaultStrategy);
    }
    return splitter.split(Document.from(text)).stream().map(TextSegment::text).toList();
  }

  /**
   * Registers a custom strategy.
   *
   * @param name strategy name, must not already be registered
   * @param splitter the splitter to use for that name
   * @throws IllegalArgumentException if the name is blank or already taken
   */
  public void register(String name, DocumentSplitter splitter) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Strategy name must not be blank");
    }
    if (splitters.putIfAbsent(name, splitter) != null) {
      throw new IllegalArgumentException("Chunking strategy already registered: " + name);
    }
    log.info("Registered chunking strategy '{}'", name);
  }

  public Set<String> availableStrategies() {
    return Set.copyOf(splitters.keySet());
  }

  public String defaultStrategy() {
    return defaultStrategy;
  }
}
