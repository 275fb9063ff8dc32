package com.scholary.meeting.handler.objectstore;

import java.net.URI;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * ObjectStoreClient backed by AWS SDK v2, for S3 or MinIO.
 *
 * <p>The SDK retries transient failures itself. A missing key (404) surfaces as {@link
 * ObjectNotFoundException}; every other SDK failure as {@link ObjectStoreException}.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    this(buildClient(properties));
    LOGGER.info(
        "S3 client ready: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());
  }

  S3ObjectStoreClient(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  @Override
  public byte[] getObject(String bucket, String key) {
    byte[] content =
        execute(
            "read",
            bucket,
            key,
            () ->
                s3Client
                    .getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build())
                    .asByteArray());
    LOGGER.debug("Read {} bytes from {}/{}", content.length, bucket, key);
    return content;
  }

  @Override
  public void putObject(String bucket, String key, byte[] content, String contentType) {
    PutObjectRequest request =
        PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentType(contentType)
            .contentLength((long) content.length)
            .build();
    execute("write", bucket, key, () -> s3Client.putObject(request, RequestBody.fromBytes(content)));
    LOGGER.info("Wrote {}/{} ({} bytes, {})", bucket, key, content.length, contentType);
  }

  /** Release connections and threads; called by Spring on shutdown. */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }

  private <T> T execute(String action, String bucket, String key, Supplier<T> call) {
    try {
      return call.get();
    } catch (NoSuchKeyException e) {
      LOGGER.warn("Object not found: {}/{}", bucket, key);
      throw new ObjectNotFoundException(bucket, key, e);
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        LOGGER.warn("Object not found: {}/{}", bucket, key);
        throw new ObjectNotFoundException(bucket, key, e);
      }
      String message =
          String.format(
              "Failed to %s object: bucket=%s, key=%s, statusCode=%d",
              action, bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    } catch (SdkException e) {
      String message =
          String.format("Failed to %s object: bucket=%s, key=%s", action, bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    return S3Client.builder()
        .region(Region.of(properties.region()))
        .credentialsProvider(
            StaticCredentialsProvider.create(
                AwsBasicCredentials.create(properties.accessKey(), properties.secretKey())))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess())
        .build();
  }
}
