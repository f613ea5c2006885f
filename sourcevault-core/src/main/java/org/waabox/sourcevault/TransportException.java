package org.waabox.sourcevault;

import java.util.Objects;

/**
 * Thrown by a source fetcher when remote content cannot be retrieved.
 *
 * <p>{@link Kind#INVALID_URL} and {@link Kind#UNSUPPORTED_SCHEME} are
 * properties of the resource spec, retrying them is pointless until the
 * spec changes. {@link Kind#TLS} and {@link Kind#NETWORK} are transient.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TransportException extends SourceVaultException {

  private static final long serialVersionUID = 1L;

  /** The failure kinds a source fetcher reports. */
  public enum Kind {

    /** The URL could not be parsed, or has no scheme or host. */
    INVALID_URL(false),

    /** The URL scheme is not served by the fetcher. */
    UNSUPPORTED_SCHEME(false),

    /** The TLS handshake failed, or the TLS material is unusable. */
    TLS(true),

    /** Connection, timeout, I/O or HTTP status failure. */
    NETWORK(true);

    /** Whether a later attempt may succeed without a spec change. */
    private final boolean retryable;

    Kind(final boolean isRetryable) {
      retryable = isRetryable;
    }

    /** Returns whether a later attempt may succeed.
     *
     * @return true for transient failures.
     */
    public boolean retryable() {
      return retryable;
    }
  }

  /** The kind of failure, never null. */
  private final Kind kind;

  /** Creates a new exception.
   *
   * @param theKind the failure kind, cannot be null.
   * @param message the detail message, cannot be null.
   */
  public TransportException(final Kind theKind, final String message) {
    super(message);
    kind = Objects.requireNonNull(theKind, "kind must not be null");
  }

  /** Creates a new exception with a cause.
   *
   * @param theKind the failure kind, cannot be null.
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public TransportException(final Kind theKind, final String message,
      final Throwable cause) {
    super(message, cause);
    kind = Objects.requireNonNull(theKind, "kind must not be null");
  }

  /** Returns the kind of failure.
   *
   * @return the kind, never null.
   */
  public Kind kind() {
    return kind;
  }

  /** Returns whether a later attempt may succeed without a spec change.
   *
   * @return true for TLS and network failures.
   */
  public boolean retryable() {
    return kind.retryable();
  }
}
