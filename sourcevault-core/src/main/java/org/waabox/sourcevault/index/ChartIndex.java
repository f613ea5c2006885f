package org.waabox.sourcevault.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import org.semver4j.Semver;
import org.semver4j.SemverException;
import org.waabox.sourcevault.ContentException;

/**
 * A parsed chart repository index.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChartIndex {

  /** The constraint used when no version is requested. */
  private static final String ANY = "*";

  /** A version with a pre-release part inside a constraint. */
  private static final Pattern PRE_RELEASE =
      Pattern.compile("\\d-[0-9A-Za-z]");

  /** The chart versions, keyed by chart name, in index order. */
  private final Map<String, List<ChartVersion>> entries;

  /**
   * Creates a new index.
   *
   * @param theEntries the entries keyed by chart name, never null
   */
  public ChartIndex(final Map<String, List<ChartVersion>> theEntries) {
    Objects.requireNonNull(theEntries, "entries must not be null");
    final Map<String, List<ChartVersion>> copy = new LinkedHashMap<>();
    theEntries.forEach((name, versions) -> copy.put(name,
        List.copyOf(versions)));
    entries = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the entries keyed by chart name.
   *
   * @return an unmodifiable map, never null
   */
  public Map<String, List<ChartVersion>> entries() {
    return entries;
  }

  /**
   * Returns whether the index resolves no chart version at all.
   *
   * @return true if there is no entry with at least one version
   */
  public boolean isEmpty() {
    return entries.values().stream().allMatch(List::isEmpty);
  }

  /**
   * Selects a version of a chart.
   *
   * <p>A version string equal to an indexed version selects that entry.
   * Otherwise the version is read as a constraint, such as {@code ^1.2},
   * {@code ~1.2.3}, {@code 1.2.x} or {@code >=1.0.0 <2.0.0} (commas are
   * accepted as separators), and the highest matching semantic version wins.
   * No version means any version. Pre-releases only match constraints that
   * name a pre-release themselves, and entries whose version is not a
   * semantic version only match exactly.
   *
   * @param chart      the chart name, never null
   * @param version    the version or constraint, null for any version
   * @param repository the repository name, used in messages, never null
   * @return the selected entry, never null
   *
   * @throws ContentException if the chart is not indexed, the constraint is
   *         invalid or no version matches
   */
  public ChartVersion get(final String chart, final String version,
      final String repository) {
    Objects.requireNonNull(chart, "chart must not be null");
    final List<ChartVersion> versions = entries.get(chart);
    if (versions == null || versions.isEmpty()) {
      throw new ContentException("chart '" + chart
          + "' could not be found in Helm repository '" + repository + "'");
    }
    if (version != null) {
      for (final ChartVersion candidate : versions) {
        if (candidate.version().equals(version)) {
          return candidate;
        }
      }
    }

    final String constraint = version == null ? ANY : normalize(version);
    final boolean preReleases = PRE_RELEASE.matcher(constraint).find();
    ChartVersion selected = null;
    for (final ChartVersion candidate : versions) {
      final Optional<SemanticVersion> parsed =
          SemanticVersion.parse(candidate.version());
      if (parsed.isEmpty() || (parsed.get().isPreRelease() && !preReleases)) {
        continue;
      }
      if (matches(parsed.get(), constraint, version)
          && (selected == null || candidate.isNewerThan(selected))) {
        selected = candidate;
      }
    }
    if (selected == null) {
      throw new ContentException(version == null
          ? "no released version found for '" + chart + "'"
          : "no chart with version '" + version + "' found for '" + chart
              + "'");
    }
    return selected;
  }

  /** Checks a version against a constraint.
   *
   * @param version the candidate.
   * @param constraint the normalized constraint.
   * @param original the constraint as given, for messages.
   * @return true if the version satisfies the constraint.
   */
  private static boolean matches(final SemanticVersion version,
      final String constraint, final String original) {
    try {
      return new Semver(version.toString()).satisfies(constraint);
    } catch (final SemverException e) {
      throw new ContentException("invalid version constraint '" + original
          + "': " + e.getMessage(), e);
    }
  }

  /** Turns comma separated constraints into space separated ones.
   *
   * @param constraint the constraint.
   * @return the normalized form, never null.
   */
  private static String normalize(final String constraint) {
    return constraint.replace(',', ' ').trim().replaceAll("\\s+", " ");
  }
}
