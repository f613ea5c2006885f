package org.waabox.sourcevault.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Conditions}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ConditionsTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private static final Instant T1 = Instant.parse("2026-01-01T00:05:00Z");

  @Test
  void whenUpserting_givenNewType_shouldAppendInOrder() {
    final Conditions conditions = Conditions.empty()
        .markTrue(ConditionType.ARTIFACT_OUTDATED, "NewRevision", "r2", T0)
        .markTrue(ConditionType.READY, "Succeeded", "ok", T0);

    final List<Condition> items = conditions.asList();
    assertEquals(2, items.size());
    assertEquals(ConditionType.ARTIFACT_OUTDATED, items.get(0).type());
    assertEquals(ConditionType.READY, items.get(1).type());
  }

  @Test
  void whenUpserting_givenExistingType_shouldReplaceInPlace() {
    final Conditions conditions = Conditions.empty()
        .markTrue(ConditionType.READY, "Succeeded", "first", T0)
        .markTrue(ConditionType.FETCH_FAILED, "TransportFailed", "x", T0)
        .markFalse(ConditionType.READY, "TransportFailed", "second", T1);

    assertEquals(2, conditions.asList().size());
    final Condition ready = conditions.asList().get(0);
    assertEquals(ConditionType.READY, ready.type());
    assertEquals(ConditionStatus.FALSE, ready.status());
    assertEquals("second", ready.message());
    assertEquals(T1, ready.lastTransitionTime());
  }

  @Test
  void whenUpserting_givenSameStatus_shouldKeepTransitionTime() {
    final Conditions conditions = Conditions.empty()
        .markTrue(ConditionType.READY, "Succeeded", "rev a", T0)
        .markTrue(ConditionType.READY, "Succeeded", "rev b", T1);

    final Condition ready = conditions.get(ConditionType.READY).get();
    assertEquals("rev b", ready.message());
    assertEquals(T0, ready.lastTransitionTime());
  }

  @Test
  void whenRemoving_givenPresentTypes_shouldDropThemOnly() {
    final Conditions conditions = Conditions.empty()
        .markTrue(ConditionType.ARTIFACT_OUTDATED, "NewRevision", "r", T0)
        .markTrue(ConditionType.ARTIFACT_UNAVAILABLE, "NoArtifact", "m", T0)
        .markTrue(ConditionType.READY, "Succeeded", "ok", T0)
        .remove(ConditionType.ARTIFACT_OUTDATED,
            ConditionType.ARTIFACT_UNAVAILABLE);

    assertEquals(1, conditions.asList().size());
    assertTrue(conditions.isTrue(ConditionType.READY));
    assertTrue(conditions.get(ConditionType.ARTIFACT_OUTDATED).isEmpty());
  }

  @Test
  void whenRemoving_givenAbsentType_shouldReturnSameInstance() {
    final Conditions conditions = Conditions.empty()
        .markTrue(ConditionType.READY, "Succeeded", "ok", T0);

    assertSame(conditions, conditions.remove(ConditionType.FETCH_FAILED));
  }

  @Test
  void whenCheckingIsTrue_givenFalseOrMissing_shouldReturnFalse() {
    final Conditions conditions = Conditions.empty()
        .markFalse(ConditionType.READY, "TransportFailed", "down", T0);

    assertFalse(conditions.isTrue(ConditionType.READY));
    assertFalse(conditions.isTrue(ConditionType.FETCH_FAILED));
  }

  @Test
  void whenComparing_givenSameUpdates_shouldBeEqual() {
    final Conditions a = Conditions.empty()
        .markTrue(ConditionType.READY, "Succeeded", "ok", T0);
    final Conditions b = Conditions.of(List.of(new Condition(
        ConditionType.READY, ConditionStatus.TRUE, "Succeeded", "ok", T0)));

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }
}
