package dev.archivist.ingestion;

/**
 * Running totals of an ingestion run, folded over the row outcomes.
 *
 * @param attempted rows handed to the coordinator
 * @param succeeded rows whose chunks were staged
 * @param failed rows that failed at row scope
 * @param chunks chunks staged across all succeeded rows
 */
public record IngestionTally(int attempted, int succeeded, int failed, long chunks) {

  public static IngestionTally empty() {
    return new IngestionTally(0, 0, 0, 0);
  }

  public IngestionTally plus(RowOutcome outcome) {
    if (outcome.succeeded()) {
      return new IngestionTally(attempted + 1, succeeded + 1, failed, chunks + outcome.chunkCount());
    }
    return new IngestionTally(attempted + 1, succeeded, failed + 1, chunks);
  }
}
