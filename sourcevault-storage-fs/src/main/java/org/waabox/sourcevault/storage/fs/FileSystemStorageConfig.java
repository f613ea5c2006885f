package org.waabox.sourcevault.storage.fs;

import java.nio.file.Path;
import java.util.Objects;

import org.waabox.sourcevault.storage.ArtifactStorage;

/**
 * Immutable configuration holder for the file system artifact storage.
 *
 * <p>Holds the storage root, the hostname artifact URLs are derived from
 * and the permission bits of written artifacts.
 *
 * <p>Instances are created via the {@link Builder} returned by
 * {@link #builder()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemStorageConfig {

  /** The storage root, never null. */
  private final Path root;

  /** The public hostname, never null. */
  private final String hostname;

  /** The POSIX permission bits of artifacts. */
  private final int fileMode;

  /** Creates a config from the builder.
   *
   * @param builder the builder to construct from, never null
   */
  private FileSystemStorageConfig(final Builder builder) {
    root = Objects.requireNonNull(builder.root, "root must not be null")
        .toAbsolutePath().normalize();
    hostname = Objects.requireNonNull(builder.hostname,
        "hostname must not be null");
    if (hostname.isBlank()) {
      throw new IllegalArgumentException("hostname must not be blank");
    }
    if (builder.fileMode < 0 || builder.fileMode > 0777) {
      throw new IllegalArgumentException("fileMode must be between 0 and "
          + "0777, got: " + Integer.toOctalString(builder.fileMode));
    }
    fileMode = builder.fileMode;
  }

  /**
   * Returns the absolute storage root.
   *
   * @return the root, never null
   */
  public Path root() {
    return root;
  }

  /**
   * Returns the hostname artifact URLs are derived from, for example
   * {@code http://source-controller.flux-system.svc}.
   *
   * @return the hostname, never null
   */
  public String hostname() {
    return hostname;
  }

  /**
   * Returns the permission bits of written artifacts.
   *
   * <p>Defaults to {@link ArtifactStorage#DEFAULT_FILE_MODE}.
   *
   * @return the mode, between 0 and 0777
   */
  public int fileMode() {
    return fileMode;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder instance, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * A builder for {@link FileSystemStorageConfig} instances.
   *
   * <p>Required fields: {@code root} and {@code hostname}.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    /** The storage root. */
    private Path root;

    /** The public hostname. */
    private String hostname;

    /** The artifact permission bits. */
    private int fileMode = ArtifactStorage.DEFAULT_FILE_MODE;

    /** Creates a new builder. */
    private Builder() {
    }

    /**
     * Sets the storage root.
     *
     * @param theRoot the root directory, never null
     * @return this builder, never null
     */
    public Builder root(final Path theRoot) {
      root = theRoot;
      return this;
    }

    /**
     * Sets the public hostname.
     *
     * @param theHostname the hostname, never null
     * @return this builder, never null
     */
    public Builder hostname(final String theHostname) {
      hostname = theHostname;
      return this;
    }

    /**
     * Sets the permission bits of written artifacts.
     *
     * @param theFileMode the mode, e.g. {@code 0644}
     * @return this builder, never null
     */
    public Builder fileMode(final int theFileMode) {
      fileMode = theFileMode;
      return this;
    }

    /**
     * Builds the config.
     *
     * @return the config, never null
     *
     * @throws NullPointerException if root or hostname is missing
     * @throws IllegalArgumentException if hostname is blank or the mode is
     *         out of range
     */
    public FileSystemStorageConfig build() {
      return new FileSystemStorageConfig(this);
    }
  }
}
