package com.ospicorp.anomalyapi.storage;

import com.ospicorp.anomalyapi.error.ModelNotFoundException;
import com.ospicorp.anomalyapi.error.StorageIntegrityException;
import com.ospicorp.anomalyapi.error.StorageReadException;
import com.ospicorp.anomalyapi.error.StorageWriteException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each version as {@code {root}/{seriesId}/v{N}.model}. Writes go to a temp file in the
 * series directory, are forced to disk and then hard-linked into place, so a reader never sees a
 * partial record and an existing version is never replaced. Version order is derived from the directory listing; there is no index file.
 */
public class FilesystemStorageBackend implements StorageBackend {

  private static final Logger log = LoggerFactory.getLogger(FilesystemStorageBackend.class);

  private static final String TEMP_SUFFIX = ".tmp";

  private final Path root;

  public FilesystemStorageBackend(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  @Override
  public String name() {
    return "filesystem";
  }

  @Override
  public StorageResult<Void> put(StorageLocator locator, byte[] data) {
    Path target;
    try {
      target = resolve(locator);
    } catch (IllegalArgumentException ex) {
      return StorageResult.permanentFailure(
          new StorageWriteException("Malformed locator " + locator, ex, false));
    }

    Path temp = null;
    try {
      Files.createDirectories(target.getParent());
      if (Files.exists(target)) {
        return StorageResult.permanentFailure(
            new StorageIntegrityException("Locator " + locator + " already holds a model"));
      }
      temp = Files.createTempFile(target.getParent(), "." + locator.fileName() + "-", TEMP_SUFFIX);
      writeFully(temp, data);
      linkIntoPlace(temp, target);
      log.debug("Wrote {} bytes to {}", data.length, target);
      return StorageResult.ok();
    } catch (FileAlreadyExistsException ex) {
      return StorageResult.permanentFailure(
          new StorageIntegrityException("Locator " + locator + " already holds a model", ex));
    } catch (ClosedByInterruptException ex) {
      Thread.currentThread().interrupt();
      return StorageResult.permanentFailure(
          new StorageWriteException("Write of " + locator + " interrupted", ex, false));
    } catch (AccessDeniedException | NotDirectoryException ex) {
      return StorageResult.permanentFailure(
          new StorageWriteException("Cannot write " + locator + ": " + ex.getMessage(), ex, false));
    } catch (IOException ex) {
      return StorageResult.transientFailure(
          new StorageWriteException("Failed to write " + locator + ": " + ex.getMessage(), ex, true));
    } finally {
      if (temp != null) {
        discardTemp(temp);
      }
    }
  }

  @Override
  public StorageResult<byte[]> get(StorageLocator locator) {
    Path target;
    try {
      target = resolve(locator);
    } catch (IllegalArgumentException ex) {
      return StorageResult.permanentFailure(
          new StorageReadException("Malformed locator " + locator, ex, false));
    }
    try {
      return StorageResult.ok(Files.readAllBytes(target));
    } catch (NoSuchFileException ex) {
      return StorageResult.notFound(
          new ModelNotFoundException(locator.seriesId(), locator.version()));
    } catch (ClosedByInterruptException ex) {
      Thread.currentThread().interrupt();
      return StorageResult.permanentFailure(
          new StorageReadException("Read of " + locator + " interrupted", ex, false));
    } catch (AccessDeniedException ex) {
      return StorageResult.permanentFailure(
          new StorageReadException("Cannot read " + locator + ": " + ex.getMessage(), ex, false));
    } catch (IOException ex) {
      return StorageResult.transientFailure(
          new StorageReadException("Failed to read " + locator + ": " + ex.getMessage(), ex, true));
    }
  }

  @Override
  public StorageResult<List<Integer>> listVersions(String seriesId) {
    Path seriesDir;
    try {
      seriesDir = seriesDirectory(seriesId);
    } catch (IllegalArgumentException ex) {
      return StorageResult.permanentFailure(
          new StorageReadException("Malformed series id '" + seriesId + "'", ex, false));
    }
    if (!Files.isDirectory(seriesDir)) {
      return StorageResult.ok(List.of());
    }
    List<Integer> versions = new ArrayList<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(seriesDir, "v*" + StorageLocator.EXTENSION)) {
      for (Path file : files) {
        OptionalInt version = StorageLocator.parseVersion(file.getFileName().toString());
        if (version.isPresent() && Files.isRegularFile(file)) {
          versions.add(version.getAsInt());
        }
      }
    } catch (NoSuchFileException ex) {
      return StorageResult.ok(List.of());
    } catch (AccessDeniedException ex) {
      return StorageResult.permanentFailure(
          new StorageReadException("Cannot list " + seriesDir + ": " + ex.getMessage(), ex, false));
    } catch (IOException ex) {
      return StorageResult.transientFailure(
          new StorageReadException("Failed to list " + seriesDir + ": " + ex.getMessage(), ex, true));
    }
    Collections.sort(versions);
    return StorageResult.ok(List.copyOf(versions));
  }

  @Override
  public boolean exists(StorageLocator locator) {
    try {
      return Files.isRegularFile(resolve(locator));
    } catch (IllegalArgumentException | SecurityException ex) {
      log.debug("Locator {} cannot exist: {}", locator, ex.getMessage());
      return false;
    }
  }

  @Override
  public StorageResult<List<String>> listSeries() {
    if (!Files.isDirectory(root)) {
      return StorageResult.ok(List.of());
    }
    List<String> series = new ArrayList<>();
    try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
      for (Path dir : dirs) {
        if (containsModel(dir)) {
          series.add(dir.getFileName().toString());
        }
      }
    } catch (AccessDeniedException ex) {
      return StorageResult.permanentFailure(
          new StorageReadException("Cannot list " + root + ": " + ex.getMessage(), ex, false));
    } catch (IOException ex) {
      return StorageResult.transientFailure(
          new StorageReadException("Failed to list " + root + ": " + ex.getMessage(), ex, true));
    }
    Collections.sort(series);
    return StorageResult.ok(List.copyOf(series));
  }

  @Override
  public StorageResult<Void> delete(StorageLocator locator) {
    try {
      Files.deleteIfExists(resolve(locator));
      return StorageResult.ok();
    } catch (IllegalArgumentException ex) {
      return StorageResult.permanentFailure(
          new StorageWriteException("Malformed locator " + locator, ex, false));
    } catch (AccessDeniedException ex) {
      return StorageResult.permanentFailure(
          new StorageWriteException("Cannot delete " + locator + ": " + ex.getMessage(), ex, false));
    } catch (IOException ex) {
      return StorageResult.transientFailure(
          new StorageWriteException("Failed to delete " + locator + ": " + ex.getMessage(), ex, true));
    }
  }

  private Path seriesDirectory(String seriesId) {
    Path dir = root.resolve(seriesId).normalize();
    if (!root.equals(dir.getParent())) {
      throw new IllegalArgumentException("Series id '" + seriesId + "' escapes the storage root");
    }
    return dir;
  }

  private Path resolve(StorageLocator locator) {
    return seriesDirectory(locator.seriesId()).resolve(locator.fileName());
  }

  private boolean containsModel(Path dir) throws IOException {
    try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "v*" + StorageLocator.EXTENSION)) {
      for (Path file : files) {
        if (StorageLocator.parseVersion(file.getFileName().toString()).isPresent()) {
          return true;
        }
      }
    }
    return false;
  }

  private static void writeFully(Path file, byte[] data) throws IOException {
    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE,
        StandardOpenOption.TRUNCATE_EXISTING)) {
      ByteBuffer buffer = ByteBuffer.wrap(data);
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      channel.force(true);
    }
  }

  /**
   * Publishes the temp file under the target name. Creating a link fails atomically with
   * {@link FileAlreadyExistsException} when the target exists; the temp name is removed by the
   * caller afterwards.
   */
  private static void linkIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.createLink(target, temp);
    } catch (UnsupportedOperationException ex) {
      log.debug("Hard links unsupported under {}, falling back to move", target.getParent());
      Files.move(temp, target);
    }
  }

  private static void discardTemp(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException ex) {
      log.warn("Could not remove temp file {}: {}", temp, ex.getMessage());
    }
  }
}
