package org.waabox.sourcevault.model;

import java.util.Locale;

/**
 * The kinds of managed sources.
 *
 * <p>The kind decides the top-level storage directory and the name of the
 * stable link published next to the revisioned files.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SourceKind {

  /** A chart repository, the artifact is its index. */
  HELM_REPOSITORY("HelmRepository", "yaml"),

  /** A single packaged chart pulled from a repository. */
  HELM_CHART("HelmChart", "tgz");

  /** The kind name as it appears in resource manifests. */
  private final String kindName;

  /** The extension of the stable link. */
  private final String extension;

  SourceKind(final String theKindName, final String theExtension) {
    kindName = theKindName;
    extension = theExtension;
  }

  /**
   * Returns the kind name, e.g. {@code HelmChart}.
   *
   * @return the kind name, never null
   */
  public String kindName() {
    return kindName;
  }

  /**
   * Returns the top-level storage directory for this kind.
   *
   * @return the lower-cased kind name, never null
   */
  public String directory() {
    return kindName.toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the name of the stable link, e.g. {@code helmchart-latest.tgz}.
   *
   * @return the link name, never null
   */
  public String latestLinkName() {
    return directory() + "-latest." + extension;
  }
}
