package dev.archivist.ingestion.chunking;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.segment.TextSegment;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import java.util.function.ToIntFunction;

/**
 * Carries the tail of each segment into the start of the next one.
 *
 * <p>The delegate produces segments of at most {@code maxSegmentSize - maxOverlap - 1} units
 * without overlap. Every segment after the first is then prefixed with the longest tail of its
 * predecessor that fits {@code maxOverlap}, joined by a single space. Tails start on a word
 * boundary where the text has one.
 */
final class OverlappingSplitter implements DocumentSplitter {

  private static final String JOINER = " ";

  private final DocumentSplitter delegate;
  private final ToIntFunction<String> size;
  private final int maxSegmentSize;
  private final int maxOverlap;

  private OverlappingSplitter(
      DocumentSplitter delegate, ToIntFunction<String> size, int maxSegmentSize, int maxOverlap) {
    this.delegate = delegate;
    this.size = size;
    this.maxSegmentSize = maxSegmentSize;
    this.maxOverlap = maxOverlap;
  }

  /**
   * Builds an overlapping splitter.
   *
   * @param bounds segment and overlap bounds, in the units {@code size} measures
   * @param size measures text, in characters or tokens
   * @param delegateFactory builds the delegate from its segment bound
   * @throws IllegalArgumentException if the overlap is not positive or not below half the segment
   *     size
   */
  static OverlappingSplitter of(
      ChunkingProperties.SegmentSize bounds,
      ToIntFunction<String> size,
      IntFunction<DocumentSplitter> delegateFactory) {
    int max = bounds.maxSegmentSize();
    int overlap = bounds.maxOverlap();
    if (overlap <= 0 || overlap >= max / 2) {
      throw new IllegalArgumentException(
          "maxOverlap must be positive and below half of maxSegmentSize, got "
              + overlap
              + " for "
              + max);
    }
    return new OverlappingSplitter(
        delegateFactory.apply(max - overlap - JOINER.length()), size, max, overlap);
  }

  @Override
  public List<TextSegment> split(Document document) {
    List<TextSegment> segments = new ArrayList<>();
    String previous = null;
    for (TextSegment segment : delegate.split(document)) {
      String text = segment.text();
      if (previous != null) {
        text = prefixWithTail(tailOf(previous), text);
      }
      segments.add(TextSegment.from(text, segment.metadata()));
      previous = segment.text();
    }
    return segments;
  }

  private String prefixWithTail(String tail, String text) {
    String remaining = tail;
    while (!remaining.isEmpty()) {
      String joined = remaining + JOINER + text;
      if (size.applyAsInt(joined) <= maxSegmentSize) {
        return joined;
      }
      remaining = remaining.substring(remaining.offsetByCodePoints(0, 1)).stripLeading();
    }
    return text;
  }

  private String tailOf(String text) {
    int low = 0;
    int high = text.codePointCount(0, text.length());
    while (low < high) {
      int mid = (low + high + 1) >>> 1;
      if (size.applyAsInt(lastCodePoints(text, mid)) <= maxOverlap) {
        low = mid;
      } else {
        high = mid - 1;
      }
    }
    String tail = lastCodePoints(text, low);
    int start = text.length() - tail.length();
    if (start > 0 && !Character.isWhitespace(text.charAt(start - 1))) {
      int boundary = firstWhitespace(tail);
      if (boundary >= 0 && !tail.substring(boundary).isBlank()) {
        tail = tail.substring(boundary);
      }
    }
    return tail.strip();
  }

  private static String lastCodePoints(String text, int count) {
    return text.substring(text.offsetByCodePoints(text.length(), -count));
  }

  private static int firstWhitespace(String text) {
    for (int i = 0; i < text.length(); i++) {
      if (Character.isWhitespace(text.charAt(i))) {
        return i;
      }
    }
    return -1;
  }
}
