package org.waabox.sourcevault.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A named status flag with a reason and a human readable message.
 *
 * @param type               the condition type, see {@link ConditionType},
 *                           never null
 * @param status             the condition value, never null
 * @param reason             a machine-readable reason, see
 *                           {@link ConditionReason}, never null
 * @param message            a human readable message, never null
 * @param lastTransitionTime when {@code status} last changed, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Condition(
    String type,
    ConditionStatus status,
    String reason,
    String message,
    Instant lastTransitionTime
) {

  /** Validates required fields. */
  public Condition {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(reason, "reason must not be null");
    Objects.requireNonNull(message, "message must not be null");
    Objects.requireNonNull(lastTransitionTime,
        "lastTransitionTime must not be null");
  }

  /**
   * Returns whether this condition is asserted.
   *
   * @return true if the status is {@link ConditionStatus#TRUE}
   */
  public boolean isTrue() {
    return status == ConditionStatus.TRUE;
  }
}
