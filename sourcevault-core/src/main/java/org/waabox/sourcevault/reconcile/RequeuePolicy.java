package org.waabox.sourcevault.reconcile;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines the scheduling constants shared by every reconciliation pass.
 *
 * <p>The retry interval applies after retryable failures, the default
 * timeout bounds fetches of resources that do not declare their own. The
 * default policy retries after 10 seconds and times out after 60 seconds.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RequeuePolicy {

  /** The default retry interval. */
  private static final Duration DEFAULT_RETRY_INTERVAL =
      Duration.ofSeconds(10);

  /** The default fetch timeout. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  /** The delay before retrying a failed pass. */
  private final Duration retryInterval;

  /** The fetch timeout for resources without one. */
  private final Duration defaultTimeout;

  /**
   * Creates a new requeue policy.
   *
   * @param theRetryInterval  the retry delay, never null
   * @param theDefaultTimeout the default timeout, never null
   */
  private RequeuePolicy(final Duration theRetryInterval,
      final Duration theDefaultTimeout) {
    retryInterval = theRetryInterval;
    defaultTimeout = theDefaultTimeout;
  }

  /**
   * Creates a requeue policy with the given parameters.
   *
   * @param retryInterval  the delay before retrying a failed pass, must be
   *                       positive
   * @param defaultTimeout the default fetch timeout, must be positive
   * @return a new policy, never null
   *
   * @throws IllegalArgumentException if either duration is not positive
   * @throws NullPointerException if either duration is null
   */
  public static RequeuePolicy of(final Duration retryInterval,
      final Duration defaultTimeout) {
    Objects.requireNonNull(retryInterval, "retryInterval must not be null");
    Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
    if (retryInterval.isNegative() || retryInterval.isZero()) {
      throw new IllegalArgumentException(
          "retryInterval must be positive, got: " + retryInterval);
    }
    if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
      throw new IllegalArgumentException(
          "defaultTimeout must be positive, got: " + defaultTimeout);
    }
    return new RequeuePolicy(retryInterval, defaultTimeout);
  }

  /**
   * Creates a requeue policy with the defaults.
   *
   * @return the default policy, never null
   */
  public static RequeuePolicy defaultPolicy() {
    return new RequeuePolicy(DEFAULT_RETRY_INTERVAL, DEFAULT_TIMEOUT);
  }

  /**
   * Returns the delay before retrying a failed pass.
   *
   * @return the retry interval, never null
   */
  public Duration retryInterval() {
    return retryInterval;
  }

  /**
   * Returns the fetch timeout for resources that do not declare one.
   *
   * @return the default timeout, never null
   */
  public Duration defaultTimeout() {
    return defaultTimeout;
  }
}
