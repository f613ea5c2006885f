package org.waabox.sourcevault.storage;

import java.util.Objects;

import org.waabox.sourcevault.model.ResourceKey;

/**
 * Maps resource identities to storage-relative paths, and paths to public
 * URLs.
 *
 * <p>Layout: {@code <kind>/<namespace>/<name>/<fileName>}, POSIX
 * separators, no leading slash. Every segment is validated so a resource
 * can never address a path outside its own directory.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ArtifactPaths {

  private ArtifactPaths() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Returns the directory holding every revision of the given resource.
   *
   * @param key the resource identity, never null
   * @return the relative directory, never null
   *
   * @throws IllegalArgumentException if a segment is not a plain name
   */
  public static String directory(final ResourceKey key) {
    Objects.requireNonNull(key, "key must not be null");
    return key.kind().directory()
        + "/" + segment(key.namespace())
        + "/" + segment(key.name());
  }

  /**
   * Returns the path of a file inside the resource directory.
   *
   * @param key      the resource identity, never null
   * @param fileName the file name, never null
   * @return the relative path, never null
   *
   * @throws IllegalArgumentException if a segment is not a plain name
   */
  public static String path(final ResourceKey key, final String fileName) {
    return directory(key) + "/" + segment(fileName);
  }

  /**
   * Returns the public URL of a storage-relative path.
   *
   * <p>A trailing slash on the hostname and a leading slash on the path are
   * collapsed, so {@code http://host/} and {@code /a/b} give
   * {@code http://host/a/b}.
   *
   * @param hostname the configured base, e.g. {@code http://host:9090},
   *                 never null
   * @param path     the storage-relative path, never null
   * @return the URL, never null
   */
  public static String url(final String hostname, final String path) {
    Objects.requireNonNull(hostname, "hostname must not be null");
    Objects.requireNonNull(path, "path must not be null");
    String base = hostname;
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String relative = path;
    while (relative.startsWith("/")) {
      relative = relative.substring(1);
    }
    return base + "/" + relative;
  }

  /**
   * Strips leading slashes from a path.
   *
   * @param path the path, never null
   * @return the relative form, never null
   */
  public static String relative(final String path) {
    Objects.requireNonNull(path, "path must not be null");
    String relative = path;
    while (relative.startsWith("/")) {
      relative = relative.substring(1);
    }
    return relative;
  }

  /**
   * Returns whether a value can be used as one path segment, i.e. as a
   * file or directory name.
   *
   * @param value the value, never null
   * @return true if the value is a plain name
   */
  public static boolean isSegment(final String value) {
    Objects.requireNonNull(value, "value must not be null");
    return !value.isEmpty() && !value.equals(".") && !value.equals("..")
        && value.indexOf('/') < 0 && value.indexOf('\\') < 0
        && value.indexOf('\0') < 0;
  }

  /** Validates a single path segment.
   *
   * @param value the segment.
   * @return the same value.
   */
  private static String segment(final String value) {
    Objects.requireNonNull(value, "segment must not be null");
    if (!isSegment(value)) {
      throw new IllegalArgumentException(
          "Invalid path segment: '" + value + "'");
    }
    return value;
  }
}
