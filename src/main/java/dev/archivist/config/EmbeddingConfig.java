package dev.archivist.config;

import dev.archivist.embedding.EmbeddingModelFactory;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * Configures the embedding provider used by {@link dev.archivist.embedding.EmbeddingClient}.
 *
 * <p>The provider is OpenAI's {@code text-embedding-3-small} through LangChain4j. Provider-side
 * retries are disabled: the client wraps every call in its own retry policy, and stacking both
 * would multiply the attempt count.
 */
@Configuration
public class EmbeddingConfig {

  /**
   * Creates OpenAI embedding models on demand, once the API key has been checked.
   *
   * @return a factory building a model from the bound embedding properties
   */
  @Bean
  public EmbeddingModelFactory embeddingModelFactory() {
    return properties ->
        OpenAiEmbeddingModel.builder()
            .apiKey(properties.apiKey())
            .modelName(properties.modelName())
            .dimensions(properties.dimensions())
            .timeout(properties.timeout())
            .maxRetries(0)
            .build();
  }

  /** Sleeper used for retry backoff and for pacing between provider sub-batches. */
  @Bean
  public Sleeper embeddingSleeper() {
    return new ThreadWaitSleeper();
  }
}
