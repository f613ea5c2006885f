package org.waabox.sourcevault.storage;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.List;

import org.waabox.sourcevault.model.Artifact;
import org.waabox.sourcevault.model.ResourceKey;

/**
 * A content-versioned artifact cache rooted at one directory.
 *
 * <p>Every revision of a resource lives in that resource's own directory
 * (see {@link ArtifactPaths}). Writers must hold {@link #lock(Artifact)}
 * across the ensure-directory, write, link and garbage collection sequence
 * for the same resource. Readers never need the lock: writes are atomic
 * renames, so a reader sees either the previous file or the complete new
 * one.
 *
 * <p>Implementations are shared by all concurrent reconciliations and must
 * be thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ArtifactStorage {

  /** The default permission bits of written artifacts, {@code rw-r--r--}. */
  int DEFAULT_FILE_MODE = 0644;

  /**
   * Returns the hostname used to derive artifact URLs.
   *
   * @return the hostname, never null
   */
  String hostname();

  /**
   * Creates an artifact record for a new revision of the given resource.
   *
   * <p>Nothing is written. The returned artifact carries its path and URL,
   * but no checksum until it is persisted.
   *
   * @param key      the owning resource, never null
   * @param revision the revision, never null
   * @param fileName the revision-qualified file name, never null
   * @return the artifact record, never null
   */
  default Artifact newArtifactFor(final ResourceKey key,
      final String revision, final String fileName) {
    final String path = ArtifactPaths.path(key, fileName);
    return new Artifact(path, revision, null, urlFor(path), null);
  }

  /**
   * Creates every parent directory of the artifact path. Idempotent.
   *
   * @param artifact the artifact, never null
   *
   * @throws org.waabox.sourcevault.StorageIOException on I/O failures
   */
  void ensureDirectory(Artifact artifact);

  /**
   * Writes the data to the artifact path through a temporary file in the
   * same directory and a single atomic rename.
   *
   * <p>The temporary file is removed on failure. The stream is consumed
   * but not closed.
   *
   * @param artifact the artifact, never null
   * @param data     the content, never null
   * @param mode     the POSIX permission bits, e.g. {@code 0644}; ignored on
   *                 file systems without POSIX attributes
   *
   * @throws org.waabox.sourcevault.StorageIOException on I/O failures
   */
  void atomicWrite(Artifact artifact, InputStream data, int mode);

  /**
   * Writes the bytes with {@link #DEFAULT_FILE_MODE}.
   *
   * @param artifact the artifact, never null
   * @param data     the content, never null
   *
   * @throws org.waabox.sourcevault.StorageIOException on I/O failures
   */
  default void atomicWrite(final Artifact artifact, final byte[] data) {
    atomicWrite(artifact, new ByteArrayInputStream(data), DEFAULT_FILE_MODE);
  }

  /**
   * Computes the content digest used for artifact checksums.
   *
   * @param data the content, never null
   * @return the SHA-256 hex digest, never null
   */
  default String checksum(final byte[] data) {
    return Checksums.sha256(data);
  }

  /**
   * Returns whether a regular file backs the given artifact.
   *
   * @param artifact the artifact, never null
   * @return true if the file exists
   */
  boolean exists(Artifact artifact);

  /**
   * Reads the content of a stored artifact.
   *
   * @param artifact the artifact, never null
   * @return the content, never null
   *
   * @throws org.waabox.sourcevault.StorageIOException if the file is missing
   *         or cannot be read
   */
  byte[] read(Artifact artifact);

  /**
   * Acquires the exclusive lock of the artifact's directory, blocking
   * until it is available.
   *
   * @param artifact the artifact, never null
   * @return the held lock, never null
   *
   * @throws org.waabox.sourcevault.StorageIOException if the lock cannot
   *         be acquired
   */
  ArtifactLock lock(Artifact artifact);

  /**
   * Deletes every regular file in the artifact's directory except the one
   * backing {@code current}.
   *
   * <p>Links are kept. Files already gone are ignored.
   *
   * @param current the artifact to keep, never null
   * @return the storage-relative paths removed, never null
   *
   * @throws org.waabox.sourcevault.StorageIOException on unexpected
   *         failures such as denied permissions
   */
  List<String> removeAllButCurrent(Artifact current);

  /**
   * Deletes the whole directory of the given resource.
   *
   * <p>Takes the directory lock, so it waits for a write in progress and
   * is not interleaved with one.
   *
   * @param key the resource, never null
   * @return whether anything was removed
   *
   * @throws org.waabox.sourcevault.StorageIOException on I/O failures
   */
  boolean removeAll(ResourceKey key);

  /**
   * Points a stable-named link in the artifact's directory at the
   * artifact, replacing any previous link atomically.
   *
   * @param target   the artifact to point at, never null
   * @param linkName the link file name, never null
   * @return the public URL of the link, never null
   *
   * @throws org.waabox.sourcevault.StorageIOException on I/O failures
   */
  String symlink(Artifact target, String linkName);

  /**
   * Returns the public URL of a storage-relative path under the current
   * hostname.
   *
   * @param path the path, never null
   * @return the URL, never null
   */
  default String urlFor(final String path) {
    return ArtifactPaths.url(hostname(), path);
  }

  /**
   * Returns the artifact with its URL derived from the current hostname.
   *
   * @param artifact the artifact, never null
   * @return the artifact with an up to date URL, never null
   */
  default Artifact setUrl(final Artifact artifact) {
    return artifact.withUrl(urlFor(artifact.path()));
  }
}
