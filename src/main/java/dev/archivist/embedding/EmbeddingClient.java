package dev.archivist.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Converts texts into embedding vectors through the configured provider.
 *
 * <p>The client must be {@linkplain #initialize() initialized} before use. Batches larger than
 * {@link EmbeddingProperties#maxBatchSize()} are split into sequential sub-batches separated by a
 * short pause so that a single large request does not burst the provider's rate limit. Every
 * provider call, single or batched, goes through the same {@link EmbeddingRetryPolicy}; once its
 * attempts are exhausted an {@link EmbeddingProviderUnavailableException} is thrown.
 *
 * <p>Returned vectors are in input order and always have exactly {@link
 * EmbeddingProperties#dimensions()} components.
 */
@Service
public class EmbeddingClient {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingClient.class);

  private final EmbeddingProperties properties;
  private final EmbeddingModelFactory modelFactory;
  private final Sleeper sleeper;
  private final RetryTemplate retryTemplate;

  private volatile @Nullable EmbeddingModel model;

  public EmbeddingClient(
      EmbeddingProperties properties, EmbeddingModelFactory modelFactory, Sleeper sleeper) {
    this.properties = properties;
    this.modelFactory = modelFactory;
    this.sleeper = sleeper;
    this.retryTemplate = properties.retry().toRetryTemplate(sleeper, new AttemptLogger());
  }

  /**
   * Checks credentials and creates the provider handle.
   *
   * @return {@code true} if the client is ready to embed
   */
  public boolean initialize() {
    if (!properties.hasApiKey()) {
      log.warn("Embedding API key not configured (archivist.embedding.api-key)");
      return false;
    }
    try {
      model = modelFactory.create(properties);
      log.info(
          "Embedding client initialized: model={}, dimensions={}",
          properties.modelName(),
          properties.dimensions());
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to initialize embedding client: {}", e.getMessage(), e);
      model = null;
      return false;
    }
  }

  /** Whether the client holds a live provider handle. */
  public boolean isAvailable() {
    return model != null;
  }

  public int dimensions() {
    return properties.dimensions();
  }

  /**
   * Embeds a single text.
   *
   * @param text the text to embed
   * @return its embedding vector
   */
  public float[] embed(String text) {
    EmbeddingModel current = requireModel();
    return call(current, List.of(text), 0).get(0);
  }

  /**
   * Embeds a batch of texts, splitting it into provider-sized sub-batches when necessary.
   *
   * @param texts the texts to embed
   * @return one vector per text, {@code vectors.get(i)} belonging to {@code texts.get(i)}
   */
  public List<float[]> embedBatch(List<String> texts) {
    EmbeddingModel current = requireModel();
    if (texts.isEmpty()) {
      return List.of();
    }
    int batchSize = properties.maxBatchSize();
    if (texts.size() <= batchSize) {
      return call(current, texts, 0);
    }

    log.debug(
        "Large batch detected ({} texts), splitting into sub-batches of {}",
        texts.size(),
        batchSize);
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (int start = 0; start < texts.size(); start += batchSize) {
      if (start > 0) {
        pause();
      }
      int end = Math.min(start + batchSize, texts.size());
      vectors.addAll(call(current, texts.subList(start, end), start));
    }
    return List.copyOf(vectors);
  }

  private EmbeddingModel requireModel() {
    EmbeddingModel current = model;
    if (current == null) {
      throw new EmbeddingUninitializedException(
          "Embedding client not initialized; call initialize() first");
    }
    return current;
  }

  private List<float[]> call(EmbeddingModel current, List<String> texts, int offset) {
    List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
    List<Embedding> embeddings;
    try {
      embeddings =
          retryTemplate.execute(
              context -> {
                Response<List<Embedding>> response = current.embedAll(segments);
                if (response == null || response.content() == null) {
                  throw new EmbeddingProviderUnavailableException("Provider returned no content");
                }
                return response.content();
              },
              context -> {
                throw new EmbeddingProviderUnavailableException(
                    "Embedding failed for batch ["
                        + offset
                        + ".."
                        + (offset + texts.size() - 1)
                        + "] after "
                        + context.getRetryCount()
                        + " attempts",
                    context.getLastThrowable());
              });
    } catch (BackOffInterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EmbeddingInterruptedException("Interrupted while backing off", e);
    }
    return toVectors(embeddings, texts.size(), offset);
  }

  private List<float[]> toVectors(List<Embedding> embeddings, int expectedCount, int offset) {
    if (embeddings.size() != expectedCount) {
      throw new EmbeddingProviderUnavailableException(
          "Embedding response count mismatch: expected "
              + expectedCount
              + " but received "
              + embeddings.size()
              + " for batch starting at "
              + offset);
    }
    List<float[]> vectors = new ArrayList<>(expectedCount);
    for (int i = 0; i < embeddings.size(); i++) {
      float[] vector = embeddings.get(i).vector();
      if (vector.length != properties.dimensions()) {
        throw new EmbeddingProviderUnavailableException(
            "Embedding "
                + (offset + i)
                + " has dimension "
                + vector.length
                + ", expected "
                + properties.dimensions());
      }
      vectors.add(vector);
    }
    return vectors;
  }

  private void pause() {
    long millis = properties.batchPause().toMillis();
    if (millis <= 0) {
      return;
    }
    try {
      sleeper.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EmbeddingInterruptedException("Interrupted between embedding sub-batches", e);
    }
  }

  /** Logs each failed provider attempt before the backoff sleep. */
  private final class AttemptLogger implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(
        RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
      log.warn(
          "Embedding provider call failed (attempt {}/{}): {}",
          context.getRetryCount(),
          properties.retry().maxAttempts(),
          throwable.toString());
    }
  }
}
