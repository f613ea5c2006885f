package org.waabox.sourcevault;

/**
 * Thrown when the artifact storage fails to create, write, rename, link or
 * delete a file under its root directory.
 *
 * <p>A storage failure always fails the reconciliation pass and leaves the
 * previously recorded artifact untouched.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StorageIOException extends SourceVaultException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public StorageIOException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public StorageIOException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
