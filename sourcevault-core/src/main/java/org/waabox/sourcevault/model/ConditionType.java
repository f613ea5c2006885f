package org.waabox.sourcevault.model;

/**
 * The condition types a reconciliation pass publishes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConditionType {

  /** The current artifact is stored and healthy. */
  public static final String READY = "Ready";

  /** A newer revision is known but not yet persisted. */
  public static final String ARTIFACT_OUTDATED = "ArtifactOutdated";

  /** The recorded artifact has no backing file in storage. */
  public static final String ARTIFACT_UNAVAILABLE = "ArtifactUnavailable";

  /** The last fetch or persistence attempt failed. */
  public static final String FETCH_FAILED = "FetchFailed";

  private ConditionType() {
    throw new UnsupportedOperationException("Utility class");
  }
}
