package com.scholary.meeting.handler.objectstore;

/**
 * Object storage as the pipeline sees it.
 *
 * <p>Transcripts, chunk files, per-chunk analysis results and merged documents are all small
 * enough to move as whole byte arrays.
 */
public interface ObjectStoreClient {

  /**
   * Read a whole object.
   *
   * @throws ObjectNotFoundException if the key does not exist
   * @throws ObjectStoreException if the read fails for any other reason
   */
  byte[] getObject(String bucket, String key);

  /**
   * Create or replace an object.
   *
   * @param contentType MIME type stored with the object
   * @throws ObjectStoreException if the write fails
   */
  void putObject(String bucket, String key, byte[] content, String contentType);
}
