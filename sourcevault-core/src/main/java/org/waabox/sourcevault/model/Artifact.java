package org.waabox.sourcevault.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One persisted revision of a resource's fetched content.
 *
 * <p>An artifact is never mutated in storage. A newer persistence produces
 * a new artifact that supersedes this one in the resource status. The only
 * field recomputed for an existing artifact is the {@code url}, which
 * follows the configured hostname.
 *
 * @param path           the storage-relative path, POSIX separators and no
 *                       leading slash, never null
 * @param revision       the opaque content version, never null
 * @param checksum       the SHA-256 hex digest of the file, may be null for
 *                       an artifact that has not been written yet
 * @param url            the public address of the file, may be null until
 *                       derived by the storage
 * @param lastUpdateTime when the file was last persisted, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Artifact(
    String path,
    String revision,
    String checksum,
    String url,
    Instant lastUpdateTime
) {

  /** Validates required fields. */
  public Artifact {
    Objects.requireNonNull(path, "path must not be null");
    Objects.requireNonNull(revision, "revision must not be null");
  }

  /**
   * Returns a copy of this artifact with the given url.
   *
   * @param theUrl the new url, may be null
   * @return a new artifact, never null
   */
  public Artifact withUrl(final String theUrl) {
    return new Artifact(path, revision, checksum, theUrl, lastUpdateTime);
  }

  /**
   * Returns a copy of this artifact with the given checksum and update time.
   *
   * @param theChecksum the digest of the written bytes, never null
   * @param theTime     the persistence time, never null
   * @return a new artifact, never null
   */
  public Artifact persisted(final String theChecksum, final Instant theTime) {
    Objects.requireNonNull(theChecksum, "checksum must not be null");
    Objects.requireNonNull(theTime, "time must not be null");
    return new Artifact(path, revision, theChecksum, url, theTime);
  }

  /**
   * Returns the last path segment, the file name of this artifact.
   *
   * @return the file name, never null
   */
  public String fileName() {
    final int slash = path.lastIndexOf('/');
    return slash < 0 ? path : path.substring(slash + 1);
  }

  /**
   * Returns the storage-relative directory holding every revision of the
   * owning resource.
   *
   * @return the directory path, empty for a root-level file, never null
   */
  public String directory() {
    final int slash = path.lastIndexOf('/');
    return slash < 0 ? "" : path.substring(0, slash);
  }
}
