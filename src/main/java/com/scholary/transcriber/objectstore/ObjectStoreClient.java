package com.scholary.transcriber.objectstore;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Abstraction for blob storage operations.
 *
 * <p>Chunk audio and cached artifacts are written through this interface. Implementations exist for
 * S3/MinIO and for the local filesystem; all keys are relative to the configured bucket or root
 * directory.
 *
 * <p>Writes must be all-or-nothing: once {@link #putObject} returns the object is fully readable,
 * and a failed write leaves no partially written object behind under the key.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller is responsible for closing the stream.
   *
   * @param key the object key
   * @return an input stream for reading the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String key);

  /**
   * Store an object from a stream, replacing any existing object under the same key.
   *
   * @param key the object key
   * @param data the input stream containing object data
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(String key, InputStream data, long contentLength, String contentType);

  /**
   * Get object metadata without downloading the content.
   *
   * @param key the object key
   * @return object metadata
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String key);

  /** Whether an object exists under the key. */
  boolean exists(String key);

  /**
   * Delete an object. Deleting a missing object is not an error.
   *
   * @param key the object key
   * @throws ObjectStoreException if the delete fails
   */
  void deleteObject(String key);

  /** Store a byte array. */
  default void putObject(String key, byte[] data, String contentType) {
    putObject(key, new ByteArrayInputStream(data), data.length, contentType);
  }

  /** Read a whole object into memory. Chunks and cached artifacts are small enough for this. */
  default byte[] getObjectBytes(String key) {
    try (InputStream stream = getObjectStream(key)) {
      return stream.readAllBytes();
    } catch (IOException e) {
      throw new ObjectStoreException("Failed to read object: key=" + key, e);
    }
  }

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
