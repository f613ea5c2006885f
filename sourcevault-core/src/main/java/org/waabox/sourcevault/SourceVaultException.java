package org.waabox.sourcevault;

/**
 * Base exception for all SourceVault errors.
 *
 * <p>This is an unchecked exception. The reconciler converts every subtype
 * into a condition on the resource status, so none of them escapes a
 * reconciliation pass.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SourceVaultException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public SourceVaultException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public SourceVaultException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
