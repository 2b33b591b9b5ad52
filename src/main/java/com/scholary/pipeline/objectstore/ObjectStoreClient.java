package com.scholary.pipeline.objectstore;

import java.io.InputStream;

/**
 * Read access to the object storage holding uploaded audio.
 *
 * <p>Only what the transcription step needs to stage a file locally: metadata and a stream.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller is responsible for closing the stream.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Get object metadata without downloading the content.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
