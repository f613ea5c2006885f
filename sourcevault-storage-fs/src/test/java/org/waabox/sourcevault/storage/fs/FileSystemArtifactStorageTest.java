package org.waabox.sourcevault.storage.fs;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.sourcevault.StorageIOException;
import org.waabox.sourcevault.model.Artifact;
import org.waabox.sourcevault.model.ResourceKey;
import org.waabox.sourcevault.model.SourceKind;
import org.waabox.sourcevault.storage.ArtifactLock;

/**
 * Tests for {@link FileSystemArtifactStorage}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FileSystemArtifactStorageTest {

  private static final String HOST = "http://localhost:9090";

  private static final ResourceKey KEY =
      new ResourceKey(SourceKind.HELM_CHART, "default", "podinfo");

  @TempDir
  Path root;

  private FileSystemArtifactStorage storage;

  @BeforeEach
  void setUp() {
    storage = new FileSystemArtifactStorage(FileSystemStorageConfig.builder()
        .root(root)
        .hostname(HOST)
        .build());
  }

  @Test
  void whenWriting_givenArtifact_shouldPublishContentWithoutTempFiles()
      throws Exception {
    final Artifact artifact = write("podinfo-6.5.0-abc.tgz", "chart");

    final Path file = root.resolve("helmchart/default/podinfo/"
        + "podinfo-6.5.0-abc.tgz");
    assertArrayEquals(bytes("chart"), Files.readAllBytes(file));
    assertTrue(storage.exists(artifact));
    assertEquals(List.of("podinfo-6.5.0-abc.tgz"), names(file.getParent()));
  }

  @Test
  void whenWriting_givenExistingFile_shouldReplaceIt() throws Exception {
    write("a.tgz", "first");
    final Artifact artifact = write("a.tgz", "second");

    assertArrayEquals(bytes("second"), Files.readAllBytes(
        storage.resolve(artifact.path())));
  }

  @Test
  void whenWriting_givenDefaultMode_shouldApplyOwnerWriteOnly()
      throws Exception {
    assumeTrue(FileSystems.getDefault().supportedFileAttributeViews()
        .contains("posix"));

    final Artifact artifact = write("a.tgz", "data");

    assertEquals("rw-r--r--", PosixFilePermissions.toString(
        Files.getPosixFilePermissions(storage.resolve(artifact.path()))));
  }

  @Test
  void whenWriting_givenConfiguredMode_shouldApplyIt() throws Exception {
    assumeTrue(FileSystems.getDefault().supportedFileAttributeViews()
        .contains("posix"));
    storage = new FileSystemArtifactStorage(FileSystemStorageConfig.builder()
        .root(root)
        .hostname(HOST)
        .fileMode(0600)
        .build());

    final Artifact artifact = write("a.tgz", "data");

    assertEquals("rw-------", PosixFilePermissions.toString(
        Files.getPosixFilePermissions(storage.resolve(artifact.path()))));
  }

  @Test
  void whenCheckingExists_givenMissingFile_shouldReturnFalse() {
    assertFalse(storage.exists(storage.newArtifactFor(KEY, "1.0.0",
        "missing.tgz")));
  }

  @Test
  void whenCollectingGarbage_givenOlderFiles_shouldKeepCurrentAndLink()
      throws Exception {
    write("a.tgz", "a");
    write("b.tgz", "b");
    final Artifact current = write("c.tgz", "c");
    storage.symlink(current, "helmchart-latest.tgz");

    final ResourceKey sibling =
        new ResourceKey(SourceKind.HELM_CHART, "default", "nginx");
    final Artifact other = storage.newArtifactFor(sibling, "1.0.0",
        "nginx.tgz");
    storage.ensureDirectory(other);
    storage.atomicWrite(other, bytes("nginx"));

    final List<String> removed = storage.removeAllButCurrent(current);

    assertEquals(2, removed.size());
    assertTrue(removed.contains("helmchart/default/podinfo/a.tgz"));
    assertTrue(removed.contains("helmchart/default/podinfo/b.tgz"));
    assertEquals(List.of("c.tgz", "helmchart-latest.tgz"),
        names(storage.resolve(current.path()).getParent()));
    assertTrue(storage.exists(other));
  }

  @Test
  void whenCollectingGarbage_givenMissingDirectory_shouldRemoveNothing() {
    assertTrue(storage.removeAllButCurrent(storage.newArtifactFor(KEY,
        "1.0.0", "a.tgz")).isEmpty());
  }

  @Test
  void whenLinking_givenArtifact_shouldPointAtFileNameAndReturnUrl()
      throws Exception {
    write("a.tgz", "a");
    final Artifact current = write("b.tgz", "b");

    final String url = storage.symlink(current, "helmchart-latest.tgz");

    assertEquals(HOST + "/helmchart/default/podinfo/helmchart-latest.tgz",
        url);
    final Path link = storage.resolve(
        "helmchart/default/podinfo/helmchart-latest.tgz");
    if (Files.isSymbolicLink(link)) {
      assertEquals(Path.of("b.tgz"), Files.readSymbolicLink(link));
      assertArrayEquals(bytes("b"), Files.readAllBytes(link));
    } else {
      final Path record = link.resolveSibling("helmchart-latest.tgz"
          + FileSystemArtifactStorage.LINK_RECORD_SUFFIX);
      assertEquals("b.tgz\n", Files.readString(record));
    }
  }

  @Test
  void whenLinking_givenExistingLink_shouldRetarget() throws Exception {
    final Artifact first = write("a.tgz", "a");
    storage.symlink(first, "helmchart-latest.tgz");
    final Artifact second = write("b.tgz", "b");

    storage.symlink(second, "helmchart-latest.tgz");

    final Path link = storage.resolve(
        "helmchart/default/podinfo/helmchart-latest.tgz");
    assumeTrue(Files.isSymbolicLink(link));
    assertEquals(Path.of("b.tgz"), Files.readSymbolicLink(link));
    assertFalse(Files.exists(link.resolveSibling(".helmchart-latest.tgz.tmp"),
        LinkOption.NOFOLLOW_LINKS));
  }

  @Test
  void whenRemovingAll_givenStoredResource_shouldDeleteDirectory()
      throws Exception {
    final Artifact artifact = write("a.tgz", "a");
    storage.symlink(artifact, "helmchart-latest.tgz");

    assertTrue(storage.removeAll(KEY));

    assertFalse(Files.exists(root.resolve("helmchart/default/podinfo")));
    assertTrue(Files.isDirectory(root.resolve("helmchart/default")));
    assertFalse(storage.removeAll(KEY));
  }

  @Test
  void whenRemovingAll_givenHeldLock_shouldWaitForItsRelease()
      throws Exception {
    final Artifact artifact = write("a.tgz", "a");
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<Boolean> removal;
      try (ArtifactLock lock = storage.lock(artifact)) {
        removal = executor.submit(() -> storage.removeAll(KEY));
        assertThrows(TimeoutException.class, () ->
            removal.get(200, TimeUnit.MILLISECONDS));
        assertTrue(Files.exists(storage.resolve(artifact.path())));
      }

      assertTrue(removal.get(5, TimeUnit.SECONDS));
      assertFalse(Files.exists(root.resolve("helmchart/default/podinfo")));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void whenReading_givenConcurrentRewrites_shouldSeeWholePayloads()
      throws Exception {
    final byte[] first = new byte[2 * 1024 * 1024];
    final byte[] second = new byte[3 * 1024 * 1024];
    Arrays.fill(first, (byte) 'a');
    Arrays.fill(second, (byte) 'b');
    final Artifact artifact = storage.newArtifactFor(KEY, "1", "a.tgz");
    storage.ensureDirectory(artifact);
    storage.atomicWrite(artifact, first);

    final AtomicBoolean writing = new AtomicBoolean(true);
    final AtomicInteger reads = new AtomicInteger();
    final AtomicInteger torn = new AtomicInteger();
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<?> reader = executor.submit(() -> {
        while (writing.get()) {
          final byte[] read = storage.read(artifact);
          if (!Arrays.equals(first, read) && !Arrays.equals(second, read)) {
            torn.incrementAndGet();
          }
          reads.incrementAndGet();
        }
      });
      for (int i = 0; i < 20; i++) {
        storage.atomicWrite(artifact, i % 2 == 0 ? second : first);
      }
      writing.set(false);
      reader.get(30, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    assertTrue(reads.get() > 0);
    assertEquals(0, torn.get());
    assertEquals(List.of("a.tgz"), names(root.resolve(
        "helmchart/default/podinfo")));
  }

  @Test
  void whenWriting_givenStreamFailingMidway_shouldLeaveNoTempFile()
      throws Exception {
    final Artifact artifact = write("a.tgz", "previous");
    final InputStream failing = new InputStream() {
      private int served;

      @Override
      public int read() throws IOException {
        if (served++ >= 4096) {
          throw new IOException("connection reset");
        }
        return 'x';
      }
    };

    assertThrows(StorageIOException.class, () ->
        storage.atomicWrite(artifact, failing, 0644));

    assertEquals(List.of("a.tgz"), names(root.resolve(
        "helmchart/default/podinfo")));
    assertArrayEquals(bytes("previous"), storage.read(artifact));
  }

  @Test
  void whenResolving_givenPathOutsideRoot_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        storage.resolve("../etc/passwd"));
    assertThrows(IllegalArgumentException.class, () ->
        storage.resolve("/"));
  }

  @Test
  void whenSettingUrl_givenArtifact_shouldUseHostname() {
    final Artifact artifact = storage.newArtifactFor(KEY, "6.5.0", "a.tgz");

    assertEquals(HOST + "/helmchart/default/podinfo/a.tgz", artifact.url());
    assertEquals(artifact, storage.setUrl(artifact.withUrl(null)));
  }

  @Test
  void whenLocking_givenHeldLock_shouldBlockOtherThreads() throws Exception {
    final Artifact artifact = storage.newArtifactFor(KEY, "1", "a.tgz");
    final AtomicBoolean acquired = new AtomicBoolean(false);
    final CountDownLatch done = new CountDownLatch(1);

    final Thread other;
    try (ArtifactLock lock = storage.lock(artifact)) {
      other = new Thread(() -> {
        try (ArtifactLock inner = storage.lock(artifact)) {
          acquired.set(true);
        }
        done.countDown();
      });
      other.start();
      assertFalse(done.await(200, TimeUnit.MILLISECONDS));
      assertFalse(acquired.get());
    }

    assertTrue(done.await(5, TimeUnit.SECONDS));
    assertTrue(acquired.get());
    other.join();
  }

  @Test
  void whenLocking_givenSameThread_shouldBeReentrant() {
    final Artifact artifact = storage.newArtifactFor(KEY, "1", "a.tgz");

    try (ArtifactLock outer = storage.lock(artifact);
         ArtifactLock inner = storage.lock(artifact)) {
      assertTrue(Files.isDirectory(root.resolve(
          FileSystemArtifactStorage.LOCK_DIR)));
    }
  }

  @Test
  void whenConvertingMode_givenOctal_shouldMapPermissions() {
    assertEquals("rwxr-x---", PosixFilePermissions.toString(
        FileSystemArtifactStorage.permissions(0750)));
  }

  private Artifact write(final String fileName, final String content) {
    final Artifact artifact = storage.newArtifactFor(KEY, "1", fileName);
    storage.ensureDirectory(artifact);
    storage.atomicWrite(artifact, bytes(content));
    return artifact;
  }

  private static List<String> names(final Path dir) throws Exception {
    try (Stream<Path> files = Files.list(dir)) {
      return files.map(path -> path.getFileName().toString())
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private static byte[] bytes(final String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
