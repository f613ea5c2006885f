package org.waabox.sourcevault.storage.fs;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.sourcevault.StorageIOException;
import org.waabox.sourcevault.storage.ArtifactLock;
import org.waabox.sourcevault.storage.Checksums;

/**
 * Exclusive locks keyed by artifact directory.
 *
 * <p>Each directory maps to an in-process {@link ReentrantLock}, which
 * serializes threads, and to an OS file lock on
 * {@code <lockDir>/<sha256(directory)>.lock}, which serializes processes
 * sharing the storage root. The OS lock is taken on the outermost
 * acquisition only and is released by the kernel if the process dies.
 *
 * <p>In-process locks are counted by their users and dropped once the last
 * user releases them, so directories of deleted resources leave nothing
 * behind.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class FileLockManager {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FileLockManager.class);

  /** Where lock files live, never null. */
  private final Path lockDir;

  /** The in-process locks by directory, present while in use. */
  private final Map<String, Entry> locks = new ConcurrentHashMap<>();

  /**
   * Creates a new lock manager.
   *
   * @param theLockDir the lock file directory, never null
   */
  FileLockManager(final Path theLockDir) {
    lockDir = theLockDir;
  }

  /**
   * Acquires the lock of a directory, blocking until it is free.
   *
   * @param directory the storage-relative directory, never null
   * @return the held lock, never null
   *
   * @throws StorageIOException if the lock file cannot be locked
   */
  ArtifactLock acquire(final String directory) {
    final ReentrantLock local = locks.compute(directory, (d, existing) -> {
      final Entry entry = existing == null ? new Entry() : existing;
      entry.users++;
      return entry;
    }).lock;
    local.lock();
    if (local.getHoldCount() > 1) {
      return new Held(directory, local, null, null);
    }

    final Path lockFile = lockDir.resolve(Checksums.sha256(
        directory.getBytes(StandardCharsets.UTF_8)) + ".lock");
    FileChannel channel = null;
    try {
      Files.createDirectories(lockDir);
      channel = FileChannel.open(lockFile, StandardOpenOption.CREATE,
          StandardOpenOption.WRITE);
      final FileLock fileLock = channel.lock();
      log.trace("Locked '{}'", directory);
      return new Held(directory, local, channel, fileLock);
    } catch (final IOException | OverlappingFileLockException e) {
      closeQuietly(channel);
      local.unlock();
      release(directory);
      throw new StorageIOException("Failed to lock '" + directory
          + "' through " + lockFile + ": " + e.getMessage(), e);
    }
  }

  /**
   * Returns the number of directories with an in-process lock in use.
   *
   * @return the number of tracked directories
   */
  int size() {
    return locks.size();
  }

  /** Drops one user of a directory lock, removing it after the last.
   *
   * @param directory the directory.
   */
  private void release(final String directory) {
    locks.computeIfPresent(directory,
        (d, entry) -> --entry.users == 0 ? null : entry);
  }

  /** Closes a channel after a failed lock, keeping the original error.
   *
   * @param channel the channel, may be null.
   */
  private static void closeQuietly(final FileChannel channel) {
    if (channel == null) {
      return;
    }
    try {
      channel.close();
    } catch (final IOException e) {
      log.debug("Failed to close lock channel: {}", e.getMessage());
    }
  }

  /** An in-process lock and its user count, guarded by the map. */
  private static final class Entry {

    /** The lock. */
    private final ReentrantLock lock = new ReentrantLock();

    /** Threads holding or waiting for the lock. */
    private int users;
  }

  /** A held lock. Closing it more than once does nothing. */
  private final class Held implements ArtifactLock {

    /** The locked directory. */
    private final String directory;

    /** The in-process lock. */
    private final ReentrantLock local;

    /** The lock file channel, null for nested acquisitions. */
    private final FileChannel channel;

    /** The OS lock, null for nested acquisitions. */
    private final FileLock fileLock;

    /** Whether the lock has been released. */
    private final AtomicBoolean released = new AtomicBoolean(false);

    /** Creates a held lock.
     *
     * @param theDirectory the directory.
     * @param theLocal the in-process lock.
     * @param theChannel the channel, may be null.
     * @param theFileLock the OS lock, may be null.
     */
    private Held(final String theDirectory, final ReentrantLock theLocal,
        final FileChannel theChannel, final FileLock theFileLock) {
      directory = theDirectory;
      local = theLocal;
      channel = theChannel;
      fileLock = theFileLock;
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
      if (!released.compareAndSet(false, true)) {
        return;
      }
      try {
        if (fileLock != null) {
          try {
            fileLock.release();
          } finally {
            channel.close();
          }
        }
      } catch (final IOException e) {
        throw new StorageIOException("Failed to release lock of '"
            + directory + "': " + e.getMessage(), e);
      } finally {
        local.unlock();
        release(directory);
      }
    }
  }
}
