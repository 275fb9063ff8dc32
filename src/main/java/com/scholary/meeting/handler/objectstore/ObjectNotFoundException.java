package com.scholary.meeting.handler.objectstore;

/** The requested key does not exist in the bucket. */
public class ObjectNotFoundException extends ObjectStoreException {

  private final String bucket;
  private final String key;

  public ObjectNotFoundException(String bucket, String key, Throwable cause) {
    super(String.format("Object not found: bucket=%s, key=%s", bucket, key), cause);
    this.bucket = bucket;
    this.key = key;
  }

  public String getBucket() {
    return bucket;
  }

  public String getKey() {
    return key;
  }
}
