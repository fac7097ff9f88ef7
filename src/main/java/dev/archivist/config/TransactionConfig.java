package dev.archivist.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction and time infrastructure shared by the ingestion pipeline.
 *
 * <p>The batch committer owns the outer transaction. Everything that must be undone on its own
 * (a single row's work, a single provenance insert) runs through the {@code savepointTransaction}
 * template, which maps to a JDBC savepoint inside the outer transaction.
 */
@Configuration
public class TransactionConfig {

  /**
   * Nested transaction template backed by JDBC savepoints.
   *
   * <p>Outside an active transaction it behaves like {@code PROPAGATION_REQUIRED} and commits on
   * its own.
   *
   * @param transactionManager the JDBC transaction manager (savepoints enabled by default)
   * @return a template that rolls back to its savepoint when the callback throws
   */
  @Bean
  public TransactionTemplate savepointTransaction(PlatformTransactionManager transactionManager) {
    TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    template.setName("savepoint");
    return template;
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
