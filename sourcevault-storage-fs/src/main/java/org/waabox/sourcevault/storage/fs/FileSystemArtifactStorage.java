package org.waabox.sourcevault.storage.fs;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.sourcevault.StorageIOException;
import org.waabox.sourcevault.model.Artifact;
import org.waabox.sourcevault.model.ResourceKey;
import org.waabox.sourcevault.storage.ArtifactLock;
import org.waabox.sourcevault.storage.ArtifactPaths;
import org.waabox.sourcevault.storage.ArtifactStorage;

/**
 * An {@link ArtifactStorage} on the local file system.
 *
 * <p>Artifacts are stored under a root directory, one directory per
 * resource, next to a stable link pointing at the current revision:
 * <pre>
 * {root}/
 *   helmrepository/{namespace}/{name}/
 *     index-{checksum}.yaml
 *     helmrepository-latest.yaml -&gt; index-{checksum}.yaml
 *   helmchart/{namespace}/{name}/
 *     {chart}-{version}-{checksum}.tgz
 *     helmchart-latest.tgz -&gt; {chart}-{version}-{checksum}.tgz
 *   .locks/
 * </pre>
 *
 * <p>Writes go to a temporary file in the destination directory and are
 * renamed into place, so a reader sees the previous file or the complete
 * new one. On file systems without symbolic links, the stable link is a
 * {@code <linkName>.ref} file holding the target file name.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemArtifactStorage implements ArtifactStorage {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FileSystemArtifactStorage.class);

  /** The suffix of link records written instead of symbolic links. */
  static final String LINK_RECORD_SUFFIX = ".ref";

  /** The name of the lock file directory under the root. */
  static final String LOCK_DIR = ".locks";

  /** The permission bits, in the order of their octal digits. */
  private static final PosixFilePermission[] PERMISSIONS = {
      PosixFilePermission.OWNER_READ,
      PosixFilePermission.OWNER_WRITE,
      PosixFilePermission.OWNER_EXECUTE,
      PosixFilePermission.GROUP_READ,
      PosixFilePermission.GROUP_WRITE,
      PosixFilePermission.GROUP_EXECUTE,
      PosixFilePermission.OTHERS_READ,
      PosixFilePermission.OTHERS_WRITE,
      PosixFilePermission.OTHERS_EXECUTE
  };

  /** The configuration, never null. */
  private final FileSystemStorageConfig config;

  /** The directory locks, never null. */
  private final FileLockManager lockManager;

  /**
   * Creates a new storage.
   *
   * <p>The root directory is created with any missing parents.
   *
   * @param theConfig the configuration, never null
   *
   * @throws StorageIOException if the root cannot be created
   */
  public FileSystemArtifactStorage(final FileSystemStorageConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    try {
      Files.createDirectories(config.root());
    } catch (final IOException e) {
      throw new StorageIOException(
          "Failed to create storage root: " + config.root(), e);
    }
    lockManager = new FileLockManager(config.root().resolve(LOCK_DIR));
  }

  /** {@inheritDoc} */
  @Override
  public String hostname() {
    return config.hostname();
  }

  /**
   * Returns the absolute file of a storage-relative path.
   *
   * @param path the storage-relative path, never null
   * @return the file, never null
   *
   * @throws IllegalArgumentException if the path escapes the root
   */
  public Path resolve(final String path) {
    Objects.requireNonNull(path, "path must not be null");
    final Path file = config.root().resolve(ArtifactPaths.relative(path))
        .normalize();
    if (!file.startsWith(config.root()) || file.equals(config.root())) {
      throw new IllegalArgumentException("path '" + path
          + "' is outside of the storage root");
    }
    return file;
  }

  /** {@inheritDoc} */
  @Override
  public void ensureDirectory(final Artifact artifact) {
    Objects.requireNonNull(artifact, "artifact must not be null");
    final Path dir = resolve(artifact.path()).getParent();
    try {
      Files.createDirectories(dir);
    } catch (final IOException e) {
      throw new StorageIOException("Failed to create directory: " + dir, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void atomicWrite(final Artifact artifact, final InputStream data,
      final int mode) {
    Objects.requireNonNull(artifact, "artifact must not be null");
    Objects.requireNonNull(data, "data must not be null");

    final Path target = resolve(artifact.path());
    Path temp = null;
    try {
      temp = Files.createTempFile(target.getParent(),
          "." + target.getFileName() + ".", ".tmp");
      Files.copy(data, temp, StandardCopyOption.REPLACE_EXISTING);
      applyMode(temp, mode);
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
      temp = null;
    } catch (final IOException e) {
      throw new StorageIOException("Failed to write artifact: " + target, e);
    } finally {
      deleteTemp(temp);
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>Uses the file mode of the configuration.
   */
  @Override
  public void atomicWrite(final Artifact artifact, final byte[] data) {
    Objects.requireNonNull(data, "data must not be null");
    atomicWrite(artifact, new ByteArrayInputStream(data), config.fileMode());
  }

  /** {@inheritDoc} */
  @Override
  public boolean exists(final Artifact artifact) {
    Objects.requireNonNull(artifact, "artifact must not be null");
    return Files.isRegularFile(resolve(artifact.path()));
  }

  /** {@inheritDoc} */
  @Override
  public byte[] read(final Artifact artifact) {
    Objects.requireNonNull(artifact, "artifact must not be null");
    final Path file = resolve(artifact.path());
    try {
      return Files.readAllBytes(file);
    } catch (final IOException e) {
      throw new StorageIOException("Failed to read artifact: " + file, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public ArtifactLock lock(final Artifact artifact) {
    Objects.requireNonNull(artifact, "artifact must not be null");
    return lockManager.acquire(artifact.directory());
  }

  /** {@inheritDoc} */
  @Override
  public List<String> removeAllButCurrent(final Artifact current) {
    Objects.requireNonNull(current, "current must not be null");

    final Path keep = resolve(current.path());
    final Path dir = keep.getParent();
    final List<String> removed = new ArrayList<>();
    if (!Files.isDirectory(dir)) {
      return removed;
    }

    try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
      for (final Path entry : entries) {
        if (entry.getFileName().equals(keep.getFileName())
            || !Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)
            || entry.getFileName().toString().endsWith(LINK_RECORD_SUFFIX)) {
          continue;
        }
        if (Files.deleteIfExists(entry)) {
          removed.add(relative(entry));
        }
      }
    } catch (final NoSuchFileException e) {
      log.debug("Directory {} vanished during garbage collection", dir);
    } catch (final IOException e) {
      throw new StorageIOException(
          "Failed to garbage collect directory: " + dir, e);
    }
    return removed;
  }

  /** {@inheritDoc} */
  @Override
  public boolean removeAll(final ResourceKey key) {
    Objects.requireNonNull(key, "key must not be null");

    final String directory = ArtifactPaths.directory(key);
    final Path dir = resolve(directory);
    try (ArtifactLock lock = lockManager.acquire(directory)) {
      if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
        return false;
      }
      try (Stream<Path> tree = Files.walk(dir)) {
        final List<Path> paths = new ArrayList<>();
        tree.forEach(paths::add);
        paths.sort(Comparator.reverseOrder());
        for (final Path path : paths) {
          Files.deleteIfExists(path);
        }
        return true;
      } catch (final IOException e) {
        throw new StorageIOException("Failed to remove directory: " + dir, e);
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public String symlink(final Artifact target, final String linkName) {
    Objects.requireNonNull(target, "target must not be null");
    Objects.requireNonNull(linkName, "linkName must not be null");

    final Path file = resolve(target.path());
    final Path dir = file.getParent();
    final Path link = resolve(target.directory() + "/" + linkName);
    final Path temp = dir.resolve("." + linkName + ".tmp");

    try {
      Files.deleteIfExists(temp);
      if (createLink(temp, file.getFileName())) {
        Files.move(temp, link, StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } else {
        writeLinkRecord(dir.resolve(linkName + LINK_RECORD_SUFFIX),
            file.getFileName().toString());
      }
    } catch (final IOException e) {
      throw new StorageIOException("Failed to link " + link + " to "
          + file.getFileName(), e);
    }
    return urlFor(target.directory() + "/" + linkName);
  }

  /**
   * Creates a relative symbolic link.
   *
   * @param link   the link to create, never null
   * @param target the relative target, never null
   * @return false if the file system does not support symbolic links
   *
   * @throws IOException on other failures
   */
  private boolean createLink(final Path link, final Path target)
      throws IOException {
    try {
      Files.createSymbolicLink(link, target);
      return true;
    } catch (final UnsupportedOperationException e) {
      log.warn("Symbolic links unsupported, writing link record for {}",
          link.getFileName());
      return false;
    } catch (final FileSystemException e) {
      if (e instanceof NoSuchFileException) {
        throw e;
      }
      log.warn("Symbolic link {} refused ({}), writing link record",
          link.getFileName(), e.getReason());
      return false;
    }
  }

  /**
   * Atomically writes a link record.
   *
   * @param record the record file, never null
   * @param target the target file name, never null
   *
   * @throws IOException on failures
   */
  private void writeLinkRecord(final Path record, final String target)
      throws IOException {
    final Path temp = record.resolveSibling("." + record.getFileName()
        + ".tmp");
    Files.writeString(temp, target + "\n", StandardCharsets.UTF_8);
    Files.move(temp, record, StandardCopyOption.ATOMIC_MOVE,
        StandardCopyOption.REPLACE_EXISTING);
  }

  /**
   * Applies permission bits where POSIX attributes are supported.
   *
   * @param file the file, never null
   * @param mode the permission bits
   *
   * @throws IOException on failures
   */
  private static void applyMode(final Path file, final int mode)
      throws IOException {
    if (!Files.getFileStore(file)
        .supportsFileAttributeView(PosixFileAttributeView.class)) {
      return;
    }
    Files.setPosixFilePermissions(file, permissions(mode));
  }

  /**
   * Converts permission bits to a permission set.
   *
   * @param mode the bits, e.g. {@code 0644}
   * @return the permissions, never null
   */
  static Set<PosixFilePermission> permissions(final int mode) {
    final Set<PosixFilePermission> result =
        EnumSet.noneOf(PosixFilePermission.class);
    for (int i = 0; i < PERMISSIONS.length; i++) {
      if ((mode & (1 << (PERMISSIONS.length - 1 - i))) != 0) {
        result.add(PERMISSIONS[i]);
      }
    }
    return result;
  }

  /**
   * Removes a temporary file left by a failed write.
   *
   * @param temp the file, may be null
   */
  private static void deleteTemp(final Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (final IOException e) {
      log.warn("Failed to remove temporary file {}: {}", temp,
          e.getMessage());
    }
  }

  /**
   * Returns the storage-relative form of a file.
   *
   * @param file the absolute file, never null
   * @return the relative path with {@code /} separators, never null
   */
  private String relative(final Path file) {
    final Path relative = config.root().relativize(file);
    final StringBuilder result = new StringBuilder();
    for (final Path segment : relative) {
      if (result.length() > 0) {
        result.append('/');
      }
      result.append(segment);
    }
    return result.toString();
  }
}
