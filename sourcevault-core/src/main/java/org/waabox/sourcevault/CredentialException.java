package org.waabox.sourcevault;

import java.util.Objects;

/**
 * Thrown when the credentials referenced by a resource cannot be turned
 * into fetch options.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CredentialException extends SourceVaultException {

  private static final long serialVersionUID = 1L;

  /** The failure kinds a credential resolver reports. */
  public enum Kind {

    /** The referenced secret does not exist or could not be read. */
    NOT_FOUND,

    /** The secret exists but its data is incomplete or invalid. */
    MALFORMED
  }

  /** The kind of failure, never null. */
  private final Kind kind;

  /** Creates a new exception.
   *
   * @param theKind the failure kind, cannot be null.
   * @param message the detail message, cannot be null.
   */
  public CredentialException(final Kind theKind, final String message) {
    super(message);
    kind = Objects.requireNonNull(theKind, "kind must not be null");
  }

  /** Creates a new exception with a cause.
   *
   * @param theKind the failure kind, cannot be null.
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public CredentialException(final Kind theKind, final String message,
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
}
