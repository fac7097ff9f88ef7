package dev.archivist.embedding;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Embedding provider settings bound from {@code archivist.embedding.*}.
 *
 * @param apiKey provider API key; blank or absent leaves the client unavailable
 * @param modelName provider model name
 * @param dimensions vector dimension every returned embedding must have
 * @param timeout per-request provider timeout
 * @param maxBatchSize largest number of texts sent in one provider call
 * @param batchPause pause between consecutive sub-batches of one request
 * @param retry retry policy applied to every provider call
 */
@Validated
@ConfigurationProperties(prefix = "archivist.embedding")
public record EmbeddingProperties(
    @Nullable String apiKey,
    @DefaultValue("text-embedding-3-small") @NotBlank String modelName,
    @DefaultValue("1536") @Positive int dimensions,
    @DefaultValue("30s") @NotNull Duration timeout,
    @DefaultValue("100") @Positive int maxBatchSize,
    @DefaultValue("100ms") @NotNull Duration batchPause,
    @DefaultValue @Valid @NotNull EmbeddingRetryPolicy retry) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
