package org.waabox.sourcevault.storage;

/**
 * A held exclusive lock over one artifact directory.
 *
 * <p>Obtained from {@link ArtifactStorage#lock}; closing it releases the
 * lock. Closing twice is a no-op.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ArtifactLock extends AutoCloseable {

  /** Releases the lock. */
  @Override
  void close();
}
