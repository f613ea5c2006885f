package org.waabox.sourcevault.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The observed state of a managed source.
 *
 * @param artifact   the current artifact, may be null
 * @param url        the public URL of the stable link, may be null
 * @param conditions the condition set, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SourceStatus(
    Artifact artifact,
    String url,
    Conditions conditions
) {

  /** The status of a resource that has never been reconciled. */
  private static final SourceStatus EMPTY =
      new SourceStatus(null, null, Conditions.empty());

  /** Validates required fields. */
  public SourceStatus {
    Objects.requireNonNull(conditions, "conditions must not be null");
  }

  /**
   * Returns the empty status.
   *
   * @return a status without artifact and conditions, never null
   */
  public static SourceStatus empty() {
    return EMPTY;
  }

  /**
   * Returns the current artifact.
   *
   * @return the artifact, or empty if none is recorded
   */
  public Optional<Artifact> currentArtifact() {
    return Optional.ofNullable(artifact);
  }

  /**
   * Returns a copy with the given artifact and link URL.
   *
   * @param theArtifact the artifact, may be null
   * @param theUrl      the link URL, may be null
   * @return a new status, never null
   */
  public SourceStatus withArtifact(final Artifact theArtifact,
      final String theUrl) {
    return new SourceStatus(theArtifact, theUrl, conditions);
  }

  /**
   * Returns a copy with the given conditions.
   *
   * @param theConditions the conditions, never null
   * @return a new status, never null
   */
  public SourceStatus withConditions(final Conditions theConditions) {
    return new SourceStatus(artifact, url, theConditions);
  }
}
