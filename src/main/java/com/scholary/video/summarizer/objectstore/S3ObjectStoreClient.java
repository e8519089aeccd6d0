package com.scholary.video.summarizer.objectstore;

import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>This uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * key difference is the endpoint and path-style access configuration.
 *
 * <p>The SDK retries transient failures (network issues, 500 errors, throttling) on its own. A
 * missing key is reported as {@link DownloadException.Reason#NOT_FOUND}; everything else that
 * escapes the SDK is a {@link DownloadException.Reason#TRANSPORT} failure.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final String bucket;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    this(buildClient(properties), properties.bucket());
  }

  public S3ObjectStoreClient(S3Client s3Client, String bucket) {
    this.s3Client = s3Client;
    this.bucket = bucket;
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing source video store: endpoint={}, bucket={}, region={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.region(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    return S3Client.builder()
        .region(Region.of(properties.region()))
        .credentialsProvider(StaticCredentialsProvider.create(credentials))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
        .build();
  }

  @Override
  public DownloadedObject download(String key) {
    LOGGER.debug("Downloading object: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);

      byte[] bytes = response.asByteArray();
      DownloadedObject object =
          new DownloadedObject(bytes, response.response().contentType(), bytes.length);

      LOGGER.info(
          "Downloaded object: bucket={}, key={}, size={} bytes, contentType={}",
          bucket,
          key,
          object.contentLength(),
          object.contentType());
      return object;

    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new DownloadException(DownloadException.Reason.NOT_FOUND, message, e);

    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
        LOGGER.error(message);
        throw new DownloadException(DownloadException.Reason.NOT_FOUND, message, e);
      }
      String message =
          String.format(
              "Failed to download object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new DownloadException(DownloadException.Reason.TRANSPORT, message, e);

    } catch (SdkException e) {
      String message =
          String.format(
              "Transport error downloading object: bucket=%s, key=%s, cause=%s",
              bucket, key, e.getMessage());
      LOGGER.error(message, e);
      throw new DownloadException(DownloadException.Reason.TRANSPORT, message, e);
    }
  }

  /** Release connections and threads held by the SDK client. */
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
