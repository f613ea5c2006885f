package org.waabox.sourcevault.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable, ordered set of {@link Condition conditions} keyed by type.
 *
 * <p>{@link #upsert(Condition)} replaces a condition of the same type in
 * place, or appends it when the type is not present, so the order of the
 * set is deterministic. When the replacement keeps the same status, the
 * original transition time is retained, which makes re-asserting an
 * unchanged condition a no-op.
 *
 * <p>Transient markers are cleared with {@link #remove(String...)} rather than
 * being set to false.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Conditions {

  /** The shared empty set. */
  private static final Conditions EMPTY = new Conditions(List.of());

  /** The conditions, in insertion order, unmodifiable. */
  private final List<Condition> items;

  private Conditions(final List<Condition> theItems) {
    items = List.copyOf(theItems);
  }

  /**
   * Returns the empty condition set.
   *
   * @return the empty set, never null
   */
  public static Conditions empty() {
    return EMPTY;
  }

  /**
   * Creates a condition set from the given conditions.
   *
   * <p>Later conditions replace earlier ones of the same type.
   *
   * @param conditions the conditions, never null
   * @return a new condition set, never null
   */
  public static Conditions of(final List<Condition> conditions) {
    Objects.requireNonNull(conditions, "conditions must not be null");
    Conditions result = EMPTY;
    for (final Condition condition : conditions) {
      result = result.upsert(condition);
    }
    return result;
  }

  /**
   * Returns the condition of the given type.
   *
   * @param type the condition type, never null
   * @return the condition, or empty if not present
   */
  public Optional<Condition> get(final String type) {
    Objects.requireNonNull(type, "type must not be null");
    for (final Condition condition : items) {
      if (condition.type().equals(type)) {
        return Optional.of(condition);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns whether the condition of the given type is present and true.
   *
   * @param type the condition type, never null
   * @return true if asserted
   */
  public boolean isTrue(final String type) {
    return get(type).map(Condition::isTrue).orElse(false);
  }

  /**
   * Inserts or replaces the condition with the same type.
   *
   * @param condition the condition, never null
   * @return the updated set, never null
   */
  public Conditions upsert(final Condition condition) {
    Objects.requireNonNull(condition, "condition must not be null");
    final List<Condition> result = new ArrayList<>(items.size() + 1);
    boolean replaced = false;
    for (final Condition existing : items) {
      if (existing.type().equals(condition.type())) {
        result.add(merge(existing, condition));
        replaced = true;
      } else {
        result.add(existing);
      }
    }
    if (!replaced) {
      result.add(condition);
    }
    return new Conditions(result);
  }

  /**
   * Asserts the condition of the given type.
   *
   * @param type    the condition type, never null
   * @param reason  the reason, never null
   * @param message the message, never null
   * @param now     the transition time if the status changes, never null
   * @return the updated set, never null
   */
  public Conditions markTrue(final String type, final String reason,
      final String message, final Instant now) {
    return upsert(new Condition(type, ConditionStatus.TRUE, reason, message,
        now));
  }

  /**
   * Sets the condition of the given type to false.
   *
   * @param type    the condition type, never null
   * @param reason  the reason, never null
   * @param message the message, never null
   * @param now     the transition time if the status changes, never null
   * @return the updated set, never null
   */
  public Conditions markFalse(final String type, final String reason,
      final String message, final Instant now) {
    return upsert(new Condition(type, ConditionStatus.FALSE, reason, message,
        now));
  }

  /**
   * Removes the conditions of the given types.
   *
   * @param types the condition types to remove, never null
   * @return the updated set, never null
   */
  public Conditions remove(final String... types) {
    Objects.requireNonNull(types, "types must not be null");
    final List<Condition> result = new ArrayList<>(items.size());
    for (final Condition existing : items) {
      boolean drop = false;
      for (final String type : types) {
        if (existing.type().equals(type)) {
          drop = true;
          break;
        }
      }
      if (!drop) {
        result.add(existing);
      }
    }
    return result.size() == items.size() ? this : new Conditions(result);
  }

  /**
   * Returns the conditions in order.
   *
   * @return an unmodifiable list, never null
   */
  public List<Condition> asList() {
    return items;
  }

  /**
   * Returns whether the set has no conditions.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return items.isEmpty();
  }

  /** Keeps the original transition time when the status does not change.
   *
   * @param existing the current condition.
   * @param update the replacement.
   * @return the merged condition, never null.
   */
  private static Condition merge(final Condition existing,
      final Condition update) {
    if (existing.status() == update.status()) {
      return new Condition(update.type(), update.status(), update.reason(),
          update.message(), existing.lastTransitionTime());
    }
    return update;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Conditions that)) {
      return false;
    }
    return items.equals(that.items);
  }

  @Override
  public int hashCode() {
    return items.hashCode();
  }

  @Override
  public String toString() {
    return "Conditions" + items;
  }
}
