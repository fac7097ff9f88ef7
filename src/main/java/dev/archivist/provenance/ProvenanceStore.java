package dev.archivist.provenance;

import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Resolves copyright holders and sources to their ids, creating them on first sighting.
 *
 * <p>Resolution is a two-step protocol that does not rely on vendor upsert syntax:
 *
 * <ol>
 *   <li>look the row up by its unique key and return its id if present;
 *   <li>otherwise insert it inside a savepoint. If the insert hits the unique constraint (another
 *       writer got there first), only that savepoint is rolled back and the lookup is repeated.
 * </ol>
 *
 * <p>A miss on the repeated lookup means the unique constraint lied, which is reported as a
 * {@link ProvenanceInvariantViolationException}. Calls are idempotent for identical inputs and
 * safe under concurrent callers racing on the same key.
 */
@Service
public class ProvenanceStore {

  private static final Logger log = LoggerFactory.getLogger(ProvenanceStore.class);

  private final CopyrightHolderRepository copyrightHolderRepository;
  private final SourceRepository sourceRepository;
  private final TransactionOperations savepointTransaction;

  public ProvenanceStore(
      CopyrightHolderRepository copyrightHolderRepository,
      SourceRepository sourceRepository,
      @Qualifier("savepointTransaction") TransactionOperations savepointTransaction) {
    this.copyrightHolderRepository = copyrightHolderRepository;
    this.sourceRepository = sourceRepository;
    this.savepointTransaction = savepointTransaction;
  }

  /**
   * Returns the id of the copyright holder with this name, creating it if absent.
   *
   * @param name the holder name (unique)
   * @return the holder id
   */
  public long resolveCopyrightHolder(String name) {
    return resolve(
        "copyright holder",
        name,
        () -> copyrightHolderRepository.findIdByName(name),
        () -> copyrightHolderRepository.insert(name));
  }

  /**
   * Returns the id of the source with this URL, creating it under the given holder if absent.
   *
   * <p>An existing source keeps its original holder.
   *
   * @param copyrightHolderId the owning holder for a newly created source
   * @param url the source URL (unique)
   * @return the source id
   */
  public long resolveSource(long copyrightHolderId, String url) {
    return resolve(
        "source",
        url,
        () -> sourceRepository.findIdByUrl(url),
        () -> sourceRepository.insert(copyrightHolderId, url));
  }

  private long resolve(
      String kind, String key, Supplier<Optional<Long>> lookup, LongSupplier insert) {
    Optional<Long> existing = lookup.get();
    if (existing.isPresent()) {
      return existing.get();
    }
    try {
      Long id = savepointTransaction.execute(status -> insert.getAsLong());
      return Objects.requireNonNull(id, "insert returned no id");
    } catch (DuplicateKeyException e) {
      log.debug("Concurrent insert of {} '{}' detected, re-reading existing row", kind, key);
      return lookup.get().orElseThrow(() -> new ProvenanceInvariantViolationException(kind, key, e));
    }
  }
}
