package org.waabox.sourcevault.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SemanticVersion}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SemanticVersionTest {

  @Test
  void whenComparing_givenNumericParts_shouldCompareNumerically() {
    assertTrue(version("1.10.0").compareTo(version("1.9.3")) > 0);
    assertTrue(version("2.0.0").compareTo(version("10.0.0")) < 0);
  }

  @Test
  void whenComparing_givenPreRelease_shouldSortBeforeRelease() {
    assertTrue(version("1.0.0-rc.1").compareTo(version("1.0.0")) < 0);
    assertTrue(version("1.0.0-alpha").compareTo(version("1.0.0-beta")) < 0);
    assertTrue(version("1.0.0-rc.2").compareTo(version("1.0.0-rc.10")) < 0);
  }

  @Test
  void whenParsing_givenPrefixAndShortForm_shouldFillMissingParts() {
    assertEquals(0, version("v1.2").compareTo(version("1.2.0")));
  }

  @Test
  void whenParsing_givenNonVersion_shouldReturnEmpty() {
    assertTrue(SemanticVersion.parse("latest").isEmpty());
    assertTrue(SemanticVersion.parse("").isEmpty());
  }

  @Test
  void whenParsing_givenEmptyPreReleaseIdentifier_shouldReturnEmpty() {
    assertTrue(SemanticVersion.parse("1.0.0-a..b").isEmpty());
    assertTrue(SemanticVersion.parse("1.0.0-").isEmpty());
    assertTrue(SemanticVersion.parse("1.0.0-a.").isEmpty());
    assertTrue(SemanticVersion.parse("1.0.0+").isEmpty());
  }

  @Test
  void whenParsing_givenNumericIdentifierWithLeadingZero_shouldReturnEmpty() {
    assertTrue(SemanticVersion.parse("1.0.0-rc.01").isEmpty());
    assertTrue(version("1.0.0-rc.0").isPreRelease());
    assertTrue(version("1.0.0-0a").isPreRelease());
  }

  private static SemanticVersion version(final String value) {
    return SemanticVersion.parse(value).orElseThrow();
  }
}
