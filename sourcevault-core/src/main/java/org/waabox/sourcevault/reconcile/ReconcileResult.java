package org.waabox.sourcevault.reconcile;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of one reconciliation pass.
 *
 * <p>The requeue delay is absent when the resource must not be scheduled
 * again until something else triggers it, and zero for an immediate rerun.
 *
 * @param requeueAfter the delay before the next pass, may be null
 * @param error        the failure of the pass, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ReconcileResult(Duration requeueAfter, RuntimeException error) {

  /** The result of a pass that needs no rerun. */
  private static final ReconcileResult DONE = new ReconcileResult(null, null);

  /**
   * Returns a successful result without requeue.
   *
   * @return the result, never null
   */
  public static ReconcileResult done() {
    return DONE;
  }

  /**
   * Returns a result that reruns the pass immediately.
   *
   * @return the result, never null
   */
  public static ReconcileResult requeueNow() {
    return new ReconcileResult(Duration.ZERO, null);
  }

  /**
   * Returns a successful result that reruns the pass after a delay.
   *
   * @param delay the delay, never null
   * @return the result, never null
   */
  public static ReconcileResult requeueAfter(final Duration delay) {
    Objects.requireNonNull(delay, "delay must not be null");
    return new ReconcileResult(delay, null);
  }

  /**
   * Returns a failed result that reruns the pass after a delay.
   *
   * @param error the failure, never null
   * @param delay the delay, never null
   * @return the result, never null
   */
  public static ReconcileResult failed(final RuntimeException error,
      final Duration delay) {
    Objects.requireNonNull(error, "error must not be null");
    Objects.requireNonNull(delay, "delay must not be null");
    return new ReconcileResult(delay, error);
  }

  /**
   * Returns the requeue delay.
   *
   * @return the delay, or empty for no requeue
   */
  public Optional<Duration> delay() {
    return Optional.ofNullable(requeueAfter);
  }

  /**
   * Returns the failure of the pass.
   *
   * @return the error, or empty on success
   */
  public Optional<RuntimeException> failure() {
    return Optional.ofNullable(error);
  }

  /**
   * Returns whether the pass ended without an error.
   *
   * @return true on success
   */
  public boolean isSuccess() {
    return error == null;
  }
}
