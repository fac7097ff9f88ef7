package dev.archivist.provenance;

import static org.assertj.core.api.Assertions.assertThat;

import dev.archivist.BaseIntegrationTest;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

class ProvenanceStoreIT extends BaseIntegrationTest {

  @Autowired private ProvenanceStore provenanceStore;

  @Autowired private CopyrightHolderRepository copyrightHolderRepository;

  @Autowired private SourceRepository sourceRepository;

  @Autowired private PlatformTransactionManager transactionManager;

  @Autowired private TransactionOperations savepointTransaction;

  @Test
  void resolvingTheSameHolderTwiceYieldsOneRow() {
    long first = provenanceStore.resolveCopyrightHolder("Acme");
    long second = provenanceStore.resolveCopyrightHolder("Acme");

    assertThat(second).isEqualTo(first);
    assertThat(copyrightHolderRepository.count()).isEqualTo(1);
  }

  @Test
  void sourceIsCreatedUnderItsHolderOnce() {
    long holder = provenanceStore.resolveCopyrightHolder("Acme");
    long other = provenanceStore.resolveCopyrightHolder("Globex");

    long source = provenanceStore.resolveSource(holder, "https://acme.example/faq");
    long again = provenanceStore.resolveSource(other, "https://acme.example/faq");

    assertThat(again).isEqualTo(source);
    assertThat(sourceRepository.count()).isEqualTo(1);
    Long owner =
        jdbcTemplate.queryForObject(
            "SELECT copyright_holder_id FROM sources WHERE id = ?", Long.class, source);
    assertThat(owner).isEqualTo(holder);
  }

  @Test
  void concurrentResolversAgreeOnOneHolder() throws Exception {
    int workers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(workers);
    CountDownLatch start = new CountDownLatch(1);
    TransactionTemplate perWorker = new TransactionTemplate(transactionManager);
    try {
      List<Future<Long>> results = new ArrayList<>();
      for (int i = 0; i < workers; i++) {
        results.add(
            pool.submit(
                () -> {
                  start.await();
                  return perWorker.execute(
                      status -> provenanceStore.resolveCopyrightHolder("Acme"));
                }));
      }
      start.countDown();

      Set<Long> ids = new HashSet<>();
      for (Future<Long> result : results) {
        ids.add(result.get(30, TimeUnit.SECONDS));
      }
      assertThat(ids).hasSize(1);
      assertThat(copyrightHolderRepository.count()).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void duplicateInsertOnlyRollsBackItsSavepoint() {
    long existing = copyrightHolderRepository.insert("Acme");
    TransactionTemplate batch = new TransactionTemplate(transactionManager);

    Long resolved =
        batch.execute(
            status -> {
              copyrightHolderRepository.insert("Initech");
              try {
                savepointTransaction.execute(s -> copyrightHolderRepository.insert("Acme"));
              } catch (DuplicateKeyException expected) {
                // the enclosing transaction must still be usable
              }
              return copyrightHolderRepository.findIdByName("Acme").orElseThrow();
            });

    assertThat(resolved).isEqualTo(existing);
    assertThat(copyrightHolderRepository.findIdByName("Initech")).isPresent();
    assertThat(copyrightHolderRepository.count()).isEqualTo(2);
  }
}
