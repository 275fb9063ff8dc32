package com.scholary.meeting.handler.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

import com.scholary.meeting.handler.objectstore.ObjectNotFoundException;
import com.scholary.meeting.handler.objectstore.ObjectStoreClient;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/** Backs a mocked {@link ObjectStoreClient} with a map so tests can inspect what was written. */
final class InMemoryObjectStore {

  private final Map<String, String> objects = new LinkedHashMap<>();

  InMemoryObjectStore(ObjectStoreClient mock) {
    lenient()
        .when(mock.getObject(anyString(), anyString()))
        .thenAnswer(
            invocation -> {
              String bucket = invocation.getArgument(0);
              String key = invocation.getArgument(1);
              String content = objects.get(key);
              if (content == null) {
                throw new ObjectNotFoundException(bucket, key, null);
              }
              return content.getBytes(StandardCharsets.UTF_8);
            });
    lenient()
        .doAnswer(
            invocation -> {
              byte[] content = invocation.getArgument(2);
              objects.put(invocation.getArgument(1), new String(content, StandardCharsets.UTF_8));
              return null;
            })
        .when(mock)
        .putObject(anyString(), anyString(), any(byte[].class), anyString());
  }

  void put(String key, String content) {
    objects.put(key, content);
  }

  String get(String key) {
    return objects.get(key);
  }

  Map<String, String> objects() {
    return objects;
  }
}
