package org.waabox.sourcevault.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.waabox.sourcevault.StorageIOException;
import org.waabox.sourcevault.model.Artifact;
import org.waabox.sourcevault.model.ResourceKey;

/**
 * An {@link ArtifactStorage} kept in memory, for reconciler tests.
 *
 * <p>Links are recorded by their storage-relative path. Writes can be made
 * to fail to exercise storage error handling.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class InMemoryArtifactStorage implements ArtifactStorage {

  private final Map<String, byte[]> files = new TreeMap<>();

  private final Map<String, String> links = new TreeMap<>();

  private final AtomicInteger writes = new AtomicInteger();

  private final AtomicInteger locks = new AtomicInteger();

  private volatile String hostname;

  private volatile boolean failWrites;

  public InMemoryArtifactStorage(final String theHostname) {
    hostname = theHostname;
  }

  @Override
  public String hostname() {
    return hostname;
  }

  public void hostname(final String theHostname) {
    hostname = theHostname;
  }

  public void failWrites(final boolean fail) {
    failWrites = fail;
  }

  public synchronized void put(final String path, final byte[] data) {
    files.put(path, data.clone());
  }

  public synchronized void delete(final String path) {
    files.remove(path);
  }

  public synchronized List<String> paths() {
    return new ArrayList<>(files.keySet());
  }

  public synchronized byte[] read(final String path) {
    final byte[] data = files.get(path);
    return data == null ? null : data.clone();
  }

  public synchronized String linkTarget(final String linkPath) {
    return links.get(linkPath);
  }

  public int writes() {
    return writes.get();
  }

  public int locks() {
    return locks.get();
  }

  @Override
  public void ensureDirectory(final Artifact artifact) {
  }

  @Override
  public synchronized void atomicWrite(final Artifact artifact,
      final InputStream data, final int mode) {
    if (failWrites) {
      throw new StorageIOException("disk full writing " + artifact.path());
    }
    try {
      files.put(artifact.path(), data.readAllBytes());
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
    writes.incrementAndGet();
  }

  @Override
  public synchronized boolean exists(final Artifact artifact) {
    return files.containsKey(artifact.path());
  }

  @Override
  public synchronized byte[] read(final Artifact artifact) {
    final byte[] data = files.get(artifact.path());
    if (data == null) {
      throw new StorageIOException("no such file " + artifact.path());
    }
    return data.clone();
  }

  @Override
  public ArtifactLock lock(final Artifact artifact) {
    locks.incrementAndGet();
    return () -> { };
  }

  @Override
  public synchronized List<String> removeAllButCurrent(
      final Artifact current) {
    final String prefix = current.directory() + "/";
    final List<String> removed = new ArrayList<>();
    for (final String path : new ArrayList<>(files.keySet())) {
      if (path.startsWith(prefix) && !path.equals(current.path())
          && path.indexOf('/', prefix.length()) < 0) {
        files.remove(path);
        removed.add(path);
      }
    }
    return removed;
  }

  @Override
  public synchronized boolean removeAll(final ResourceKey key) {
    final String prefix = ArtifactPaths.directory(key) + "/";
    final boolean removed = files.keySet().removeIf(
        path -> path.startsWith(prefix));
    links.keySet().removeIf(path -> path.startsWith(prefix));
    return removed;
  }

  @Override
  public synchronized String symlink(final Artifact target,
      final String linkName) {
    final String linkPath = target.directory() + "/" + linkName;
    links.put(linkPath, target.fileName());
    return urlFor(linkPath);
  }
}
