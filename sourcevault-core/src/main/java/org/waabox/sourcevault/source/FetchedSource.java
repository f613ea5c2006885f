package org.waabox.sourcevault.source;

import java.util.Arrays;
import java.util.Objects;

/**
 * The candidate content of one reconciliation pass.
 *
 * @param revision the content revision, never null
 * @param fileName the revision-qualified file name, never null
 * @param linkName the stable link name, never null
 * @param data     the content, never null
 * @param checksum the SHA-256 hex digest of {@code data}, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FetchedSource(
    String revision,
    String fileName,
    String linkName,
    byte[] data,
    String checksum
) {

  /** Validates the fields and copies the content. */
  public FetchedSource {
    Objects.requireNonNull(revision, "revision must not be null");
    Objects.requireNonNull(fileName, "fileName must not be null");
    Objects.requireNonNull(linkName, "linkName must not be null");
    Objects.requireNonNull(data, "data must not be null");
    Objects.requireNonNull(checksum, "checksum must not be null");
    data = data.clone();
  }

  /**
   * Returns a copy of the content.
   *
   * @return the content, never null
   */
  @Override
  public byte[] data() {
    return data.clone();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FetchedSource that)) {
      return false;
    }
    return revision.equals(that.revision)
        && fileName.equals(that.fileName)
        && linkName.equals(that.linkName)
        && checksum.equals(that.checksum)
        && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(revision, fileName, linkName, checksum)
        * 31 + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "FetchedSource[revision=" + revision + ", fileName=" + fileName
        + ", size=" + data.length + ", checksum=" + checksum + "]";
  }
}
