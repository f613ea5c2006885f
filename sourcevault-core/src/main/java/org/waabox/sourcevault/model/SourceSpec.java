package org.waabox.sourcevault.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * The desired state of a managed source.
 *
 * <p>Instances are created via the {@link Builder} returned by
 * {@link #builder()}. Required fields: {@code interval}, and {@code url}
 * unless a chart reads its index from a repository reference.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SourceSpec {

  /** The repository URL, null only with a repository reference. */
  private final String url;

  /** The chart name, null for repositories. */
  private final String chart;

  /** The exact chart version, null selects the latest. */
  private final String version;

  /** The polling interval, never null. */
  private final Duration interval;

  /** The name of the credential secret, may be null. */
  private final String secretRef;

  /** The fetch timeout, null uses the default. */
  private final Duration timeout;

  /** The name of the chart repository resource, may be null. */
  private final String repositoryRef;

  /** Creates a spec from the builder.
   *
   * @param builder the builder to construct from, never null
   */
  private SourceSpec(final Builder builder) {
    repositoryRef = builder.repositoryRef;
    if (repositoryRef == null) {
      Objects.requireNonNull(builder.url, "url must not be null");
    } else if (repositoryRef.isBlank()) {
      throw new IllegalArgumentException("repositoryRef must not be blank");
    }
    url = builder.url;
    interval = Objects.requireNonNull(builder.interval,
        "interval must not be null");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException(
          "interval must be positive, got: " + interval);
    }
    chart = builder.chart;
    version = builder.version;
    secretRef = builder.secretRef;
    timeout = builder.timeout;
  }

  /**
   * Returns the repository URL.
   *
   * @return the url, null only when {@link #repositoryRef()} is set
   */
  public String url() {
    return url;
  }

  /**
   * Returns the chart name.
   *
   * @return the chart name, or empty for repository sources
   */
  public Optional<String> chart() {
    return Optional.ofNullable(chart);
  }

  /**
   * Returns the chart version or version constraint to pull.
   *
   * @return the version, or empty to select the latest release
   */
  public Optional<String> version() {
    return Optional.ofNullable(version);
  }

  /**
   * Returns the polling interval.
   *
   * @return the interval, never null
   */
  public Duration interval() {
    return interval;
  }

  /**
   * Returns the name of the secret holding credentials.
   *
   * @return the secret name, or empty when the source is public
   */
  public Optional<String> secretRef() {
    return Optional.ofNullable(secretRef);
  }

  /**
   * Returns the fetch timeout.
   *
   * @return the timeout, or empty to use the default
   */
  public Optional<Duration> timeout() {
    return Optional.ofNullable(timeout);
  }

  /**
   * Returns the name of the chart repository resource, in the same
   * namespace, whose stored index a chart reads instead of fetching one.
   *
   * @return the repository name, or empty to fetch the index from the url
   */
  public Optional<String> repositoryRef() {
    return Optional.ofNullable(repositoryRef);
  }

  /**
   * Returns where the content comes from, for messages.
   *
   * @return the url, or the referenced repository name, never null
   */
  public String origin() {
    return url != null ? url : "HelmRepository '" + repositoryRef + "'";
  }

  /**
   * Returns a builder initialised with the values of this spec.
   *
   * @return a new builder, never null
   */
  public Builder toBuilder() {
    return new Builder()
        .url(url)
        .chart(chart)
        .version(version)
        .interval(interval)
        .secretRef(secretRef)
        .timeout(timeout)
        .repositoryRef(repositoryRef);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SourceSpec that)) {
      return false;
    }
    return Objects.equals(url, that.url)
        && Objects.equals(chart, that.chart)
        && Objects.equals(version, that.version)
        && interval.equals(that.interval)
        && Objects.equals(secretRef, that.secretRef)
        && Objects.equals(timeout, that.timeout)
        && Objects.equals(repositoryRef, that.repositoryRef);
  }

  @Override
  public int hashCode() {
    return Objects.hash(url, chart, version, interval, secretRef, timeout,
        repositoryRef);
  }

  @Override
  public String toString() {
    return "SourceSpec{url='" + url + "', chart=" + chart
        + ", version=" + version + ", interval=" + interval
        + ", repositoryRef=" + repositoryRef + "}";
  }

  /**
   * A builder for {@link SourceSpec} instances.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    private String url;

    private String chart;

    private String version;

    private Duration interval;

    private String secretRef;

    private Duration timeout;

    private String repositoryRef;

    private Builder() {
    }

    /**
     * Sets the repository URL.
     *
     * @param theUrl the url, may be null with a repository reference
     * @return this builder
     */
    public Builder url(final String theUrl) {
      url = theUrl;
      return this;
    }

    /**
     * Sets the chart name.
     *
     * @param theChart the chart name, may be null
     * @return this builder
     */
    public Builder chart(final String theChart) {
      chart = theChart;
      return this;
    }

    /**
     * Sets the chart version or version constraint, e.g. {@code 1.2.3} or
     * {@code ^1.2}.
     *
     * @param theVersion the version, may be null
     * @return this builder
     */
    public Builder version(final String theVersion) {
      version = theVersion;
      return this;
    }

    /**
     * Sets the polling interval.
     *
     * @param theInterval the interval, never null
     * @return this builder
     */
    public Builder interval(final Duration theInterval) {
      interval = theInterval;
      return this;
    }

    /**
     * Sets the credential secret name.
     *
     * @param theSecretRef the secret name, may be null
     * @return this builder
     */
    public Builder secretRef(final String theSecretRef) {
      secretRef = theSecretRef;
      return this;
    }

    /**
     * Sets the fetch timeout.
     *
     * @param theTimeout the timeout, may be null
     * @return this builder
     */
    public Builder timeout(final Duration theTimeout) {
      timeout = theTimeout;
      return this;
    }

    /**
     * Sets the chart repository resource to read the index from.
     *
     * @param theRepositoryRef the repository name, may be null
     * @return this builder
     */
    public Builder repositoryRef(final String theRepositoryRef) {
      repositoryRef = theRepositoryRef;
      return this;
    }

    /**
     * Builds the spec.
     *
     * @return a new spec, never null
     *
     * @throws NullPointerException if interval is missing, or url is missing
     *         without a repository reference
     * @throws IllegalArgumentException if the interval is not positive or
     *         the repository reference is blank
     */
    public SourceSpec build() {
      return new SourceSpec(this);
    }
  }
}
