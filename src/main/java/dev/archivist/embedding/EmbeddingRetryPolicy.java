package dev.archivist.embedding;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for embedding provider calls: a bounded number of attempts with exponential backoff
 * capped at {@code maxDelay}.
 *
 * <p>Every exception is retried, rate-limit responses and other transient provider errors alike.
 *
 * @param maxAttempts total attempts including the first call
 * @param initialDelay backoff before the second attempt
 * @param multiplier growth factor applied to the backoff after each failed attempt
 * @param maxDelay upper bound for a single backoff
 * @param jitter whether to randomize each backoff (still bounded by {@code maxDelay})
 */
public record EmbeddingRetryPolicy(
    @DefaultValue("5") @Positive int maxAttempts,
    @DefaultValue("4s") @NotNull Duration initialDelay,
    @DefaultValue("2.0") @DecimalMin("1.0") double multiplier,
    @DefaultValue("60s") @NotNull Duration maxDelay,
    @DefaultValue("false") boolean jitter) {

  /** Policy used when nothing is configured: 5 attempts, 4s doubling up to 60s, no jitter. */
  public static EmbeddingRetryPolicy defaults() {
    return new EmbeddingRetryPolicy(5, Duration.ofSeconds(4), 2.0, Duration.ofSeconds(60), false);
  }

  /**
   * Builds a {@link RetryTemplate} enforcing this policy.
   *
   * @param sleeper performs the backoff waits
   * @param listener notified of every failed attempt
   * @return a template that throws the last failure once attempts are exhausted
   */
  public RetryTemplate toRetryTemplate(Sleeper sleeper, RetryListener listener) {
    ExponentialBackOffPolicy backOff =
        jitter ? new ExponentialRandomBackOffPolicy() : new ExponentialBackOffPolicy();
    backOff.setInitialInterval(initialDelay.toMillis());
    backOff.setMultiplier(multiplier);
    backOff.setMaxInterval(maxDelay.toMillis());
    backOff.setSleeper(sleeper);

    RetryTemplate template = new RetryTemplate();
    template.setRetryPolicy(new SimpleRetryPolicy(maxAttempts));
    template.setBackOffPolicy(backOff);
    template.registerListener(listener);
    return template;
  }
}
