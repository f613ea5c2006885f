package org.waabox.sourcevault.model;

/**
 * Machine-readable reasons attached to conditions.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConditionReason {

  public static final String SUCCEEDED = "Succeeded";

  public static final String NEW_REVISION = "NewRevision";

  public static final String NO_ARTIFACT = "NoArtifact";

  public static final String AUTHENTICATION_FAILED = "AuthenticationFailed";

  public static final String URL_INVALID = "URLInvalid";

  public static final String UNSUPPORTED_SCHEME = "UnsupportedScheme";

  public static final String TRANSPORT_FAILED = "TransportFailed";

  public static final String CONTENT_INVALID = "ContentInvalid";

  public static final String STORAGE_OPERATION_FAILED =
      "StorageOperationFailed";

  private ConditionReason() {
    throw new UnsupportedOperationException("Utility class");
  }
}
