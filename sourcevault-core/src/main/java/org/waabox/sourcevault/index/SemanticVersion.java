package org.waabox.sourcevault.index;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed semantic version, used to order chart versions.
 *
 * <p>Accepts an optional leading {@code v}, and missing minor or patch
 * numbers. Pre-release identifiers must be non-empty, and numeric ones must
 * not have leading zeros. Build metadata is ignored for ordering.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {

  /** major[.minor[.patch]][-prerelease][+build]. */
  private static final Pattern PATTERN = Pattern.compile(
      "^v?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?"
          + "(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?"
          + "(?:\\+[0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*)?$");

  private final long major;

  private final long minor;

  private final long patch;

  /** The pre-release identifiers, null for a release. */
  private final String preRelease;

  private SemanticVersion(final long theMajor, final long theMinor,
      final long thePatch, final String thePreRelease) {
    major = theMajor;
    minor = theMinor;
    patch = thePatch;
    preRelease = thePreRelease;
  }

  /**
   * Parses a version string.
   *
   * @param value the version, never null
   * @return the version, or empty if it is not a semantic version
   */
  public static Optional<SemanticVersion> parse(final String value) {
    Objects.requireNonNull(value, "value must not be null");
    final Matcher matcher = PATTERN.matcher(value.trim());
    if (!matcher.matches() || hasLeadingZero(matcher.group(4))) {
      return Optional.empty();
    }
    try {
      return Optional.of(new SemanticVersion(
          Long.parseLong(matcher.group(1)),
          matcher.group(2) == null ? 0 : Long.parseLong(matcher.group(2)),
          matcher.group(3) == null ? 0 : Long.parseLong(matcher.group(3)),
          matcher.group(4)));
    } catch (final NumberFormatException e) {
      return Optional.empty();
    }
  }

  /**
   * Returns whether this is a pre-release.
   *
   * @return true if the version carries pre-release identifiers
   */
  public boolean isPreRelease() {
    return preRelease != null;
  }

  /** Whether a numeric pre-release identifier starts with zero.
   *
   * @param preRelease the identifiers, may be null.
   * @return true if one of them is invalid.
   */
  private static boolean hasLeadingZero(final String preRelease) {
    if (preRelease == null) {
      return false;
    }
    for (final String identifier : preRelease.split("\\.")) {
      if (identifier.length() > 1 && identifier.charAt(0) == '0'
          && identifier.chars().allMatch(Character::isDigit)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public int compareTo(final SemanticVersion other) {
    int result = Long.compare(major, other.major);
    if (result == 0) {
      result = Long.compare(minor, other.minor);
    }
    if (result == 0) {
      result = Long.compare(patch, other.patch);
    }
    if (result == 0) {
      result = comparePreRelease(preRelease, other.preRelease);
    }
    return result;
  }

  /** A release orders after any of its pre-releases.
   *
   * @param a the first pre-release, may be null.
   * @param b the second pre-release, may be null.
   * @return the comparison result.
   */
  private static int comparePreRelease(final String a, final String b) {
    if (a == null || b == null) {
      return a == null ? (b == null ? 0 : 1) : -1;
    }
    final String[] left = a.split("\\.");
    final String[] right = b.split("\\.");
    for (int i = 0; i < Math.min(left.length, right.length); i++) {
      final boolean leftNumeric = left[i].chars().allMatch(Character::isDigit);
      final boolean rightNumeric =
          right[i].chars().allMatch(Character::isDigit);
      final int result;
      if (leftNumeric && rightNumeric) {
        result = new BigInteger(left[i])
            .compareTo(new BigInteger(right[i]));
      } else if (leftNumeric != rightNumeric) {
        result = leftNumeric ? -1 : 1;
      } else {
        result = left[i].compareTo(right[i]);
      }
      if (result != 0) {
        return result;
      }
    }
    return Integer.compare(left.length, right.length);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SemanticVersion that)) {
      return false;
    }
    return compareTo(that) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(major, minor, patch, preRelease);
  }

  @Override
  public String toString() {
    return major + "." + minor + "." + patch
        + (preRelease == null ? "" : "-" + preRelease);
  }
}
