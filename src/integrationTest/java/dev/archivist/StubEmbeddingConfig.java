package dev.archivist;

import dev.archivist.embedding.EmbeddingModelFactory;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.List;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Replaces the OpenAI provider with a deterministic in-process model.
 *
 * <p>Texts containing {@link #FAIL_MARKER} make the provider call fail; texts containing {@link
 * #INTERRUPT_MARKER} additionally interrupt the calling thread, as a shutdown would.
 */
@TestConfiguration
public class StubEmbeddingConfig {

  public static final String FAIL_MARKER = "[provider-error]";
  public static final String INTERRUPT_MARKER = "[interrupt]";

  @Bean
  @Primary
  EmbeddingModelFactory stubEmbeddingModelFactory() {
    return properties -> new StubEmbeddingModel(properties.dimensions());
  }

  static final class StubEmbeddingModel implements EmbeddingModel {

    private final int dimensions;

    StubEmbeddingModel(int dimensions) {
      this.dimensions = dimensions;
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
      for (TextSegment segment : segments) {
        if (segment.text().contains(INTERRUPT_MARKER)) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("provider call aborted");
        }
        if (segment.text().contains(FAIL_MARKER)) {
          throw new IllegalStateException("429 Too Many Requests");
        }
      }
      return Response.from(segments.stream().map(s -> vectorFor(s.text())).toList());
    }

    @Override
    public int dimension() {
      return dimensions;
    }

    private Embedding vectorFor(String text) {
      float[] vector = new float[dimensions];
      vector[0] = 1f;
      vector[1 + Math.floorMod(text.hashCode(), dimensions - 1)] = 1f;
      return Embedding.from(vector);
    }
  }
}
