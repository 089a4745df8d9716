package com.scholary.bulkupload.objectstore;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>This uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * key difference is the endpoint and path-style access configuration.
 *
 * <p>The SDK retries transient failures of a single request on its own. Retrying a whole file is
 * left to the upload queue, which is why every failure surfaces as an {@link ObjectStoreException}
 * carrying the HTTP status when there was one.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    this(buildClient(properties));
    LOGGER.info(
        "S3 client initialized: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());
  }

  S3ObjectStoreClient(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    return S3Client.builder()
        .region(region)
        .credentialsProvider(StaticCredentialsProvider.create(credentials))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
        .build();
  }

  @Override
  public String putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        contentLength,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength(contentLength)
              .build();

      PutObjectResponse response =
          s3Client.putObject(request, RequestBody.fromInputStream(data, contentLength));

      LOGGER.info("Successfully uploaded object: bucket={}, key={}", bucket, key);
      return response.eTag();

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e.statusCode(), e);

    } catch (SdkException e) {
      String message =
          String.format("Unexpected error uploading object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public String putObjectMultipart(
      String bucket,
      String key,
      InputStream data,
      long contentLength,
      String contentType,
      long partSize,
      BooleanSupplier abortRequested) {
    LOGGER.debug(
        "Starting multipart upload: bucket={}, key={}, contentLength={}, partSize={}",
        bucket,
        key,
        contentLength,
        partSize);

    String uploadId;
    try {
      uploadId =
          s3Client
              .createMultipartUpload(
                  CreateMultipartUploadRequest.builder()
                      .bucket(bucket)
                      .key(key)
                      .contentType(contentType)
                      .build())
              .uploadId();
    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to start multipart upload: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e.statusCode(), e);
    } catch (SdkException e) {
      String message =
          String.format(
              "Unexpected error starting multipart upload: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }

    try {
      List<CompletedPart> parts =
          uploadParts(bucket, key, uploadId, data, contentLength, partSize, abortRequested);

      CompleteMultipartUploadResponse response =
          s3Client.completeMultipartUpload(
              CompleteMultipartUploadRequest.builder()
                  .bucket(bucket)
                  .key(key)
                  .uploadId(uploadId)
                  .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
                  .build());

      LOGGER.info(
          "Successfully completed multipart upload: bucket={}, key={}, parts={}",
          bucket,
          key,
          parts.size());
      return response.eTag();

    } catch (ObjectStoreException e) {
      abortMultipart(bucket, key, uploadId);
      throw e;

    } catch (S3Exception e) {
      abortMultipart(bucket, key, uploadId);
      String message =
          String.format(
              "Failed multipart upload: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e.statusCode(), e);

    } catch (IOException e) {
      abortMultipart(bucket, key, uploadId);
      String message =
          String.format("Failed reading upload data: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (SdkException e) {
      abortMultipart(bucket, key, uploadId);
      String message =
          String.format("Unexpected error in multipart upload: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  private List<CompletedPart> uploadParts(
      String bucket,
      String key,
      String uploadId,
      InputStream data,
      long contentLength,
      long partSize,
      BooleanSupplier abortRequested)
      throws IOException {
    List<CompletedPart> parts = new ArrayList<>();
    long remaining = contentLength;
    int partNumber = 1;

    while (remaining > 0) {
      if (abortRequested.getAsBoolean()) {
        throw new ObjectStoreException(
            String.format(
                "Multipart upload aborted: bucket=%s, key=%s, part=%d", bucket, key, partNumber));
      }

      int size = Math.toIntExact(Math.min(partSize, remaining));
      byte[] chunk = data.readNBytes(size);
      if (chunk.length < size) {
        throw new ObjectStoreException(
            String.format(
                "Upload data ended early: bucket=%s, key=%s, expected=%d, missing=%d",
                bucket, key, contentLength, remaining - chunk.length));
      }

      UploadPartResponse response =
          s3Client.uploadPart(
              UploadPartRequest.builder()
                  .bucket(bucket)
                  .key(key)
                  .uploadId(uploadId)
                  .partNumber(partNumber)
                  .contentLength((long) size)
                  .build(),
              RequestBody.fromBytes(chunk));
      parts.add(CompletedPart.builder().partNumber(partNumber).eTag(response.eTag()).build());

      LOGGER.debug("Uploaded part: key={}, part={}, size={}", key, partNumber, size);
      remaining -= size;
      partNumber++;
    }
    return parts;
  }

  private void abortMultipart(String bucket, String key, String uploadId) {
    try {
      s3Client.abortMultipartUpload(
          AbortMultipartUploadRequest.builder().bucket(bucket).key(key).uploadId(uploadId).build());
      LOGGER.info("Aborted multipart upload: bucket={}, key={}, uploadId={}", bucket, key, uploadId);
    } catch (SdkException e) {
      // Incomplete uploads are left for the bucket lifecycle rule to reap
      LOGGER.warn(
          "Failed to abort multipart upload: bucket={}, key={}, uploadId={}",
          bucket,
          key,
          uploadId,
          e);
    }
  }

  @Override
  public ObjectMetadata getObjectMetadata(String bucket, String key) {
    LOGGER.debug("Getting metadata for object: bucket={}, key={}", bucket, key);

    try {
      HeadObjectResponse response =
          s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());

      LOGGER.info(
          "Retrieved metadata: bucket={}, key={}, size={} bytes, contentType={}",
          bucket,
          key,
          response.contentLength(),
          response.contentType());

      return new ObjectMetadata(response.contentLength(), response.contentType());

    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e.statusCode(), e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to get metadata: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e.statusCode(), e);

    } catch (SdkException e) {
      String message =
          String.format("Unexpected error getting metadata: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  /**
   * Clean up resources when the client is no longer needed.
   *
   * <p>Called by Spring on shutdown to release connections and threads.
   */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
