package io.b2mash.credits.ledger;

/**
 * A grant the ledger did not apply. Transient failures (network, 5xx, 408, 429) may succeed on
 * retry; permanent ones (other 4xx) will not.
 */
public class LedgerGrantException extends RuntimeException {

  private final boolean transientFailure;

  public LedgerGrantException(String message, boolean transientFailure) {
    super(message);
    this.transientFailure = transientFailure;
  }

  public LedgerGrantException(String message, boolean transientFailure, Throwable cause) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
