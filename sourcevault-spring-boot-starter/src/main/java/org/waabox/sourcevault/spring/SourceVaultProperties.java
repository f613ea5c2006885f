package org.waabox.sourcevault.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for SourceVault, mapped from the
 * {@code sourcevault.*} prefix in application.yml or
 * application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code sourcevault.storage-path} - the artifact root directory.</li>
 *   <li>{@code sourcevault.hostname} - the base of artifact URLs.</li>
 *   <li>{@code sourcevault.retry-interval} - the delay before retrying a
 *       failed pass.</li>
 *   <li>{@code sourcevault.default-timeout} - the fetch timeout of sources
 *       that do not declare one.</li>
 *   <li>{@code sourcevault.max-concurrent-reconciles} - the size of the
 *       worker pool.</li>
 *   <li>{@code sourcevault.artifact-file-mode} - the octal permission bits
 *       of artifacts.</li>
 *   <li>{@code sourcevault.kubernetes-secrets} - whether secret references
 *       are resolved from the Kubernetes API.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "sourcevault")
public class SourceVaultProperties {

  /** The artifact root directory. */
  private String storagePath = "/data";

  /** The base of artifact URLs. */
  private String hostname = "http://localhost:9090";

  /** The delay before retrying a failed pass. */
  private Duration retryInterval = Duration.ofSeconds(10);

  /** The default fetch timeout. */
  private Duration defaultTimeout = Duration.ofSeconds(60);

  /** The size of the worker pool. */
  private int maxConcurrentReconciles = 2;

  /** The octal permission bits of artifacts. */
  private String artifactFileMode = "0644";

  /** Whether secrets are read from the Kubernetes API. */
  private boolean kubernetesSecrets = false;

  /**
   * Returns the artifact root directory.
   *
   * @return the path, never null
   */
  public String getStoragePath() {
    return storagePath;
  }

  /**
   * Sets the artifact root directory.
   *
   * @param storagePath the path, never null
   */
  public void setStoragePath(final String storagePath) {
    this.storagePath = storagePath;
  }

  /**
   * Returns the base of artifact URLs.
   *
   * @return the hostname, never null
   */
  public String getHostname() {
    return hostname;
  }

  /**
   * Sets the base of artifact URLs.
   *
   * <p>Changing it rewrites the URLs of stored artifacts on their next
   * pass.
   *
   * @param hostname the hostname, never null
   */
  public void setHostname(final String hostname) {
    this.hostname = hostname;
  }

  /**
   * Returns the delay before retrying a failed pass.
   *
   * @return the delay, never null
   */
  public Duration getRetryInterval() {
    return retryInterval;
  }

  /**
   * Sets the delay before retrying a failed pass.
   *
   * @param retryInterval the delay, never null
   */
  public void setRetryInterval(final Duration retryInterval) {
    this.retryInterval = retryInterval;
  }

  /**
   * Returns the default fetch timeout.
   *
   * @return the timeout, never null
   */
  public Duration getDefaultTimeout() {
    return defaultTimeout;
  }

  /**
   * Sets the default fetch timeout.
   *
   * @param defaultTimeout the timeout, never null
   */
  public void setDefaultTimeout(final Duration defaultTimeout) {
    this.defaultTimeout = defaultTimeout;
  }

  /**
   * Returns the size of the worker pool.
   *
   * @return the number of concurrent passes
   */
  public int getMaxConcurrentReconciles() {
    return maxConcurrentReconciles;
  }

  /**
   * Sets the size of the worker pool.
   *
   * @param maxConcurrentReconciles the number of concurrent passes
   */
  public void setMaxConcurrentReconciles(final int maxConcurrentReconciles) {
    this.maxConcurrentReconciles = maxConcurrentReconciles;
  }

  /**
   * Returns the octal permission bits of artifacts, e.g. {@code 0644}.
   *
   * @return the mode, never null
   */
  public String getArtifactFileMode() {
    return artifactFileMode;
  }

  /**
   * Sets the octal permission bits of artifacts.
   *
   * @param artifactFileMode the mode, e.g. {@code 0640}
   */
  public void setArtifactFileMode(final String artifactFileMode) {
    this.artifactFileMode = artifactFileMode;
  }

  /**
   * Returns whether secrets are read from the Kubernetes API.
   *
   * @return true to use the Kubernetes resolver
   */
  public boolean isKubernetesSecrets() {
    return kubernetesSecrets;
  }

  /**
   * Sets whether secrets are read from the Kubernetes API.
   *
   * @param kubernetesSecrets true to use the Kubernetes resolver
   */
  public void setKubernetesSecrets(final boolean kubernetesSecrets) {
    this.kubernetesSecrets = kubernetesSecrets;
  }

  /**
   * Parses the artifact file mode.
   *
   * @return the permission bits
   *
   * @throws IllegalStateException if the mode is not an octal number
   */
  int fileModeBits() {
    try {
      return Integer.parseInt(artifactFileMode, 8);
    } catch (final NumberFormatException e) {
      throw new IllegalStateException("sourcevault.artifact-file-mode must "
          + "be an octal number, got: " + artifactFileMode, e);
    }
  }
}
