package dev.archivist.ingestion;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Run settings bound from {@code archivist.ingestion.*}.
 *
 * @param chunkStrategy chunking strategy applied to answers
 * @param limit optional cap on the number of rows ingested
 * @param progressInterval rows between progress events
 * @param commitInterval rows between commits
 */
@Validated
@ConfigurationProperties(prefix = "archivist.ingestion")
public record IngestionProperties(
    @DefaultValue("token") @NotBlank String chunkStrategy,
    @Nullable @PositiveOrZero Integer limit,
    @DefaultValue("500") @Positive int progressInterval,
    @DefaultValue("100") @Positive int commitInterval) {

  public IngestionOptions toOptions() {
    return new IngestionOptions(chunkStrategy, limit, progressInterval, commitInterval);
  }
}
