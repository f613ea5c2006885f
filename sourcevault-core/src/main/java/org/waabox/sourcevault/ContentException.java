package org.waabox.sourcevault;

/**
 * Thrown when fetched content cannot be turned into an artifact: an empty
 * or unparseable repository index, a chart or version missing from the
 * index, or a download that does not match the digest the index declares.
 *
 * <p>Retrying does not help until the remote source changes.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ContentException extends SourceVaultException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ContentException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ContentException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
