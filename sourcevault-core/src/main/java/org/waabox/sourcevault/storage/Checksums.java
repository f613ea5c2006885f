package org.waabox.sourcevault.storage;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

import org.waabox.sourcevault.StorageIOException;

/**
 * SHA-256 content digests, as lowercase hex strings.
 *
 * <p>The digest is used both to deduplicate fetched content against the
 * stored artifact and by clients to verify downloaded artifacts.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Checksums {

  /** The digest algorithm. */
  private static final String ALGORITHM = "SHA-256";

  /** The read buffer size for streams. */
  private static final int BUFFER_SIZE = 8192;

  private Checksums() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Computes the digest of the given bytes.
   *
   * @param data the bytes, never null
   * @return the 64 character hex digest, never null
   */
  public static String sha256(final byte[] data) {
    Objects.requireNonNull(data, "data must not be null");
    return HexFormat.of().formatHex(newDigest().digest(data));
  }

  /**
   * Computes the digest of the remaining bytes of a stream.
   *
   * <p>The stream is consumed but not closed.
   *
   * @param in the stream, never null
   * @return the 64 character hex digest, never null
   *
   * @throws StorageIOException if reading the stream fails
   */
  public static String sha256(final InputStream in) {
    Objects.requireNonNull(in, "in must not be null");
    final MessageDigest digest = newDigest();
    final byte[] buffer = new byte[BUFFER_SIZE];
    try {
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
      }
    } catch (final IOException e) {
      throw new StorageIOException("Failed to read stream for checksum", e);
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  /** Creates a new digest instance.
   *
   * @return the digest, never null.
   */
  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(ALGORITHM);
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException(ALGORITHM + " is not available", e);
    }
  }
}
