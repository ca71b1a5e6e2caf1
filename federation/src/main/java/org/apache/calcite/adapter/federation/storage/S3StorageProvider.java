/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.federation.storage;

import org.apache.calcite.adapter.federation.credential.AwsCredentialPayload;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.SdkClientException;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectSummary;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Storage provider implementation for Amazon S3 and S3-compatible stores.
 */
public class S3StorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(S3StorageProvider.class);

  private final AmazonS3 s3Client;

  public S3StorageProvider(AmazonS3 s3Client) {
    this.s3Client = s3Client;
  }

  /**
   * Builds a client from a static key pair.
   *
   * @param credential Access key pair
   * @param region AWS region, also used as signing region for custom endpoints
   * @param endpoint Optional endpoint of an S3-compatible service (MinIO etc.)
   */
  public static S3StorageProvider create(AwsCredentialPayload credential, String region,
      @Nullable String endpoint) {
    ClientConfiguration clientConfig = new ClientConfiguration();
    clientConfig.setSocketTimeout(5 * 60 * 1000);
    clientConfig.setConnectionTimeout(60 * 1000);

    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
        .withClientConfiguration(clientConfig)
        .withCredentials(
            new AWSStaticCredentialsProvider(
                new BasicAWSCredentials(credential.getAccessKeyId(),
                    credential.getSecretAccessKey())));

    if (endpoint != null) {
      builder.withEndpointConfiguration(new EndpointConfiguration(endpoint, region));
      // S3-compatible services generally require path-style addressing
      builder.withPathStyleAccessEnabled(true);
    } else {
      builder.withRegion(region);
    }
    LOGGER.debug("Created S3 client for region {} (endpoint {})", region, endpoint);
    return new S3StorageProvider(builder.build());
  }

  @Override public List<FileEntry> listFiles(String path, boolean recursive) throws IOException {
    S3Uri location = parseS3Uri(path);
    String prefix = directoryPrefix(location.key);
    String base = "s3://" + location.bucket + "/";
    List<FileEntry> entries = new ArrayList<>();
    ListObjectsV2Request request = new ListObjectsV2Request()
        .withBucketName(location.bucket)
        .withPrefix(prefix)
        .withDelimiter(recursive ? null : "/");

    try {
      ListObjectsV2Result result;
      do {
        result = s3Client.listObjectsV2(request);
        for (S3ObjectSummary object : result.getObjectSummaries()) {
          String key = object.getKey();
          if (key.equals(prefix)) {
            continue; // directory marker
          }
          entries.add(
              new FileEntry(base + key, lastSegment(key), false, object.getSize(),
                  object.getLastModified().getTime()));
        }
        for (String common : result.getCommonPrefixes()) {
          entries.add(
              new FileEntry(base + common,
                  lastSegment(common.substring(0, common.length() - 1)), true, 0, 0));
        }
        request.setContinuationToken(result.getNextContinuationToken());
      } while (result.isTruncated());
    } catch (SdkClientException e) {
      throw failure("list", path, e);
    }
    return entries;
  }

  @Override public FileMetadata getMetadata(String path) throws IOException {
    S3Uri location = parseS3Uri(path);
    try {
      ObjectMetadata metadata = s3Client.getObjectMetadata(location.bucket, location.key);
      return new FileMetadata(path,
          metadata.getContentLength(),
          metadata.getLastModified() == null ? 0L : metadata.getLastModified().getTime(),
          metadata.getContentType(),
          metadata.getETag());
    } catch (SdkClientException e) {
      throw failure("read metadata of", path, e);
    }
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    S3Uri location = parseS3Uri(path);
    try {
      S3Object object = s3Client.getObject(new GetObjectRequest(location.bucket, location.key));
      return object.getObjectContent();
    } catch (SdkClientException e) {
      throw failure("open", path, e);
    }
  }

  @Override public boolean exists(String path) throws IOException {
    S3Uri location = parseS3Uri(path);
    try {
      return s3Client.doesObjectExist(location.bucket, location.key);
    } catch (SdkClientException e) {
      throw failure("check", path, e);
    }
  }

  @Override public boolean isDirectory(String path) throws IOException {
    S3Uri location = parseS3Uri(path);
    ListObjectsV2Request request = new ListObjectsV2Request()
        .withBucketName(location.bucket)
        .withPrefix(directoryPrefix(location.key))
        .withMaxKeys(1);
    try {
      return s3Client.listObjectsV2(request).getKeyCount() > 0;
    } catch (SdkClientException e) {
      throw failure("list", path, e);
    }
  }

  @Override public String getStorageType() {
    return "s3";
  }

  @Override public void close() {
    s3Client.shutdown();
  }

  static S3Uri parseS3Uri(String uri) throws IOException {
    if (!uri.startsWith("s3://")) {
      throw new IOException("Invalid S3 URI: " + uri);
    }
    try {
      // S3 keys can contain spaces, java.net.URI cannot
      URI parsed = new URI(uri.replace(" ", "%20"));
      String bucket = parsed.getHost();
      if (bucket == null || bucket.isEmpty()) {
        throw new IOException("S3 URI has no bucket: " + uri);
      }
      // getPath decodes percent escapes only; '+' is a literal key character
      String key = parsed.getPath() == null ? "" : parsed.getPath();
      if (key.startsWith("/")) {
        key = key.substring(1);
      }
      return new S3Uri(bucket, key);
    } catch (URISyntaxException e) {
      throw new IOException("Failed to parse S3 URI: " + uri, e);
    }
  }

  /** A 404 becomes {@link FileNotFoundException}; anything else an
   * {@link IOException} with the SDK exception as cause. */
  private static IOException failure(String action, String path, SdkClientException e) {
    if (e instanceof AmazonServiceException
        && ((AmazonServiceException) e).getStatusCode() == 404) {
      FileNotFoundException notFound = new FileNotFoundException("no such S3 object: " + path);
      notFound.initCause(e);
      return notFound;
    }
    return new IOException("cannot " + action + " " + path + ": " + e.getMessage(), e);
  }

  private static String directoryPrefix(String key) {
    return key.isEmpty() || key.endsWith("/") ? key : key + "/";
  }

  private static String lastSegment(String key) {
    int slash = key.lastIndexOf('/');
    return slash < 0 ? key : key.substring(slash + 1);
  }

  /** Bucket and key of an {@code s3://} URI. */
  static class S3Uri {
    final String bucket;
    final String key;

    S3Uri(String bucket, String key) {
      this.bucket = bucket;
      this.key = key;
    }
  }
}
