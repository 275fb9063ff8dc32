package com.scholary.meeting.handler.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.handler.objectstore.ObjectStoreClient;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/**
 * Reads and writes pipeline artifacts (transcripts, chunk files, JSON documents).
 *
 * <p>Text is always UTF-8. JSON is pretty-printed so the documents stay readable in the bucket.
 */
@Component
public class ArtifactStore {

  static final String JSON = "application/json";
  static final String TEXT = "text/plain; charset=utf-8";

  private final ObjectMapper objectMapper;
  private final ObjectStoreClient objectStoreClient;

  public ArtifactStore(ObjectMapper objectMapper, ObjectStoreClient objectStoreClient) {
    this.objectMapper = objectMapper;
    this.objectStoreClient = objectStoreClient;
  }

  /** Read a whole object as UTF-8 text. */
  public String readText(String bucket, String key) {
    return new String(objectStoreClient.getObject(bucket, key), StandardCharsets.UTF_8);
  }

  /** Read and bind a JSON object. */
  public <T> T readJson(String bucket, String key, Class<T> type) throws IOException {
    return objectMapper.readValue(objectStoreClient.getObject(bucket, key), type);
  }

  public void writeText(String bucket, String key, String content) {
    put(bucket, key, content.getBytes(StandardCharsets.UTF_8), TEXT);
  }

  public void writeJson(String bucket, String key, Object document) throws IOException {
    put(bucket, key, toJson(document), JSON);
  }

  /**
   * Serialize a document the way it is stored.
   *
   * @param document any Jackson-serializable value
   * @return pretty-printed UTF-8 JSON
   */
  public byte[] toJson(Object document) throws IOException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
  }

  private void put(String bucket, String key, byte[] bytes, String contentType) {
    objectStoreClient.putObject(bucket, key, bytes, contentType);
  }
}
