package dev.archivist.provenance;

/**
 * A unique-key insert conflicted, yet the conflicting row could not be read back afterwards.
 *
 * <p>The unique constraint no longer guarantees what the pipeline relies on, so this aborts the
 * whole run instead of being absorbed at row scope.
 */
public class ProvenanceInvariantViolationException extends IllegalStateException {

  public ProvenanceInvariantViolationException(String kind, String key, Throwable cause) {
    super("Insert of " + kind + " '" + key + "' conflicted but no existing row was found", cause);
  }
}
