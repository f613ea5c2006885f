package org.waabox.sourcevault.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SourceSpec} and {@link ResourceKey}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SourceSpecTest {

  @Test
  void whenBuilding_givenRepositoryFields_shouldLeaveChartEmpty() {
    final SourceSpec spec = SourceSpec.builder()
        .url("https://charts.example.com")
        .interval(Duration.ofMinutes(5))
        .build();

    assertEquals("https://charts.example.com", spec.url());
    assertEquals(Duration.ofMinutes(5), spec.interval());
    assertTrue(spec.chart().isEmpty());
    assertTrue(spec.version().isEmpty());
    assertTrue(spec.secretRef().isEmpty());
    assertTrue(spec.timeout().isEmpty());
  }

  @Test
  void whenBuilding_givenZeroInterval_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        SourceSpec.builder().url("https://x").interval(Duration.ZERO)
            .build());
  }

  @Test
  void whenBuilding_givenMissingUrl_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        SourceSpec.builder().interval(Duration.ofMinutes(1)).build());
  }

  @Test
  void whenBuilding_givenRepositoryReference_shouldNotRequireUrl() {
    final SourceSpec spec = SourceSpec.builder()
        .repositoryRef("stable")
        .chart("podinfo")
        .version("^6.0.0")
        .interval(Duration.ofMinutes(1))
        .build();

    assertNull(spec.url());
    assertEquals(Optional.of("stable"), spec.repositoryRef());
    assertEquals("HelmRepository 'stable'", spec.origin());
    assertEquals(spec, spec.toBuilder().build());
    assertNotEquals(spec, spec.toBuilder().repositoryRef("other").build());
  }

  @Test
  void whenBuilding_givenBlankRepositoryReference_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        SourceSpec.builder().repositoryRef(" ").chart("podinfo")
            .interval(Duration.ofMinutes(1)).build());
  }

  @Test
  void whenDescribingOrigin_givenUrl_shouldReturnUrl() {
    final SourceSpec spec = SourceSpec.builder()
        .url("https://charts.example.com")
        .interval(Duration.ofMinutes(1))
        .build();

    assertEquals("https://charts.example.com", spec.origin());
    assertTrue(spec.repositoryRef().isEmpty());
  }

  @Test
  void whenCopying_givenChangedVersion_shouldNotBeEqual() {
    final SourceSpec spec = SourceSpec.builder()
        .url("https://charts.example.com")
        .chart("podinfo")
        .version("6.5.0")
        .interval(Duration.ofMinutes(1))
        .build();

    final SourceSpec copy = spec.toBuilder().build();
    final SourceSpec changed = spec.toBuilder().version("6.5.1").build();

    assertEquals(spec, copy);
    assertNotEquals(spec, changed);
    assertEquals("6.5.1", changed.version().get());
  }

  @Test
  void whenCreatingKey_givenBlankName_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        new ResourceKey(SourceKind.HELM_CHART, "default", " "));
  }

  @Test
  void whenPrintingKey_shouldUseKindNamespaceAndName() {
    final ResourceKey key = new ResourceKey(SourceKind.HELM_REPOSITORY,
        "flux-system", "podinfo");

    assertEquals("HelmRepository/flux-system/podinfo", key.toString());
  }

  @Test
  void whenNamingLink_givenKind_shouldUseLowercaseKindAndExtension() {
    assertEquals("helmchart-latest.tgz",
        SourceKind.HELM_CHART.latestLinkName());
    assertEquals("helmrepository-latest.yaml",
        SourceKind.HELM_REPOSITORY.latestLinkName());
  }
}
