package org.waabox.sourcevault.index;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One chart version entry of a repository index.
 *
 * @param name     the chart name, never null
 * @param version  the chart version, never null
 * @param created  when the package was created, may be null
 * @param digest   the SHA-256 hex digest of the package, may be null
 * @param urls     the download URLs, never null, may be empty
 * @param position the zero-based position of the entry in the index
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChartVersion(
    String name,
    String version,
    Instant created,
    String digest,
    List<String> urls,
    int position
) {

  /** Validates required fields and copies the url list. */
  public ChartVersion {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(version, "version must not be null");
    Objects.requireNonNull(urls, "urls must not be null");
    urls = List.copyOf(urls);
  }

  /**
   * Returns the declared package digest.
   *
   * @return the digest, or empty if the index does not declare one
   */
  public Optional<String> declaredDigest() {
    return Optional.ofNullable(digest);
  }

  /**
   * Returns whether this entry is newer than the other.
   *
   * <p>Semantic versions are compared first. When either version is not
   * semantic, the creation times decide, and when those are missing too
   * the entry listed later in the index wins.
   *
   * @param other the entry to compare with, never null
   * @return true if this entry is newer
   */
  public boolean isNewerThan(final ChartVersion other) {
    final Optional<SemanticVersion> mine = SemanticVersion.parse(version);
    final Optional<SemanticVersion> theirs =
        SemanticVersion.parse(other.version);
    if (mine.isPresent() && theirs.isPresent()) {
      final int result = mine.get().compareTo(theirs.get());
      if (result != 0) {
        return result > 0;
      }
    }
    if (created != null && other.created != null
        && !created.equals(other.created)) {
      return created.isAfter(other.created);
    }
    return position > other.position;
  }
}
