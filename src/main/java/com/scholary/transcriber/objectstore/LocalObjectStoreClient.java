package com.scholary.transcriber.objectstore;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLConnection;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem implementation of ObjectStoreClient.
 *
 * <p>Keys map to paths under a root directory. Writes go to a temporary file in the target
 * directory and are moved into place, so a reader never sees a half-written blob.
 */
public class LocalObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalObjectStoreClient.class);

  private final Path root;

  public LocalObjectStoreClient(String rootDir) {
    this.root = Paths.get(rootDir).toAbsolutePath().normalize();
    try {
      Files.createDirectories(root);
    } catch (IOException e) {
      throw new ObjectStoreException("Failed to create storage root: " + root, e);
    }
    LOGGER.info("Initialized local object store: root={}", root);
  }

  @Override
  public InputStream getObjectStream(String key) {
    Path path = resolve(key);
    try {
      return Files.newInputStream(path);
    } catch (NoSuchFileException e) {
      throw new ObjectStoreException("Object not found: key=" + key, e);
    } catch (IOException e) {
      throw new ObjectStoreException("Failed to retrieve object: key=" + key, e);
    }
  }

  @Override
  public void putObject(String key, InputStream data, long contentLength, String contentType) {
    Path target = resolve(key);
    Path temp = null;
    try {
      Files.createDirectories(target.getParent());
      temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
      long written = Files.copy(data, temp, StandardCopyOption.REPLACE_EXISTING);
      if (contentLength >= 0 && written != contentLength) {
        throw new ObjectStoreException(
            String.format(
                "Short write for key=%s: expected %d bytes, wrote %d",
                key, contentLength, written));
      }
      moveIntoPlace(temp, target);
      temp = null;
      LOGGER.debug("Stored object: key={}, bytes={}", key, written);
    } catch (IOException e) {
      throw new ObjectStoreException("Failed to store object: key=" + key, e);
    } finally {
      if (temp != null) {
        deleteQuietly(temp);
      }
    }
  }

  @Override
  public ObjectMetadata getObjectMetadata(String key) {
    Path path = resolve(key);
    try {
      long size = Files.size(path);
      String contentType = URLConnection.guessContentTypeFromName(path.getFileName().toString());
      return new ObjectMetadata(
          size, contentType != null ? contentType : "application/octet-stream");
    } catch (NoSuchFileException e) {
      throw new ObjectStoreException("Object not found: key=" + key, e);
    } catch (IOException e) {
      throw new ObjectStoreException("Failed to get metadata: key=" + key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    return Files.isRegularFile(resolve(key));
  }

  @Override
  public void deleteObject(String key) {
    try {
      Files.deleteIfExists(resolve(key));
      LOGGER.debug("Deleted object: key={}", key);
    } catch (IOException e) {
      throw new ObjectStoreException("Failed to delete object: key=" + key, e);
    }
  }

  private Path resolve(String key) {
    Path path = root.resolve(key).normalize();
    if (!path.startsWith(root) || path.equals(root)) {
      throw new ObjectStoreException("Invalid object key: " + key);
    }
    return path;
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Could not remove temp file {}: {}", path, e.getMessage());
    }
  }
}
