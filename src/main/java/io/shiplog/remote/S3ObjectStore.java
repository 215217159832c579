package io.shiplog.remote;

import io.shiplog.config.RemoteStoreSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ObjectStoreClient} on the AWS SDK v2 synchronous S3 client. Every call is bounded by
 * the configured call timeout and is not retried inside the SDK; retries belong to the queue.
 */
public final class S3ObjectStore implements ObjectStoreClient {
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);

    private final S3Client s3;
    private final String bucket;
    private final Map<String, String> openUploads = new ConcurrentHashMap<>();

    S3ObjectStore(S3Client s3, String bucket) {
        this.s3 = s3;
        this.bucket = bucket;
    }

    public static S3ObjectStore create(RemoteStoreSettings settings, URI endpoint, Duration callTimeout) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(settings.region()))
                .credentialsProvider(credentials(settings))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(callTimeout)
                        .apiCallAttemptTimeout(callTimeout)
                        .retryPolicy(RetryPolicy.none())
                        .build());
        if (endpoint != null) {
            builder.endpointOverride(endpoint).forcePathStyle(true);
            log.info("Using custom S3 endpoint {}", endpoint);
        }
        log.info("S3 store ready for bucket {} in {}", settings.bucket(), settings.region());
        return new S3ObjectStore(builder.build(), settings.bucket());
    }

    private static AwsCredentialsProvider credentials(RemoteStoreSettings settings) {
        if (settings.profile() != null && !settings.profile().isBlank()) {
            return ProfileCredentialsProvider.create(settings.profile());
        }
        return DefaultCredentialsProvider.create();
    }

    public String bucket() {
        return bucket;
    }

    @Override
    public String putObject(String key, Path source) throws IOException {
        return call("PutObject", key, () -> s3.putObject(
                PutObjectRequest.builder().bucket(bucket).key(key).build(),
                RequestBody.fromFile(source)).eTag());
    }

    @Override
    public String createMultipart(String key) throws IOException {
        String uploadId = call("CreateMultipartUpload", key, () -> s3.createMultipartUpload(
                CreateMultipartUploadRequest.builder().bucket(bucket).key(key).build()).uploadId());
        openUploads.put(uploadId, key);
        return uploadId;
    }

    @Override
    public String uploadPart(String uploadId, int partNumber, byte[] data) throws IOException {
        String key = keyOf(uploadId);
        return call("UploadPart", key, () -> s3.uploadPart(
                UploadPartRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .uploadId(uploadId)
                        .partNumber(partNumber)
                        .contentLength((long) data.length)
                        .build(),
                RequestBody.fromBytes(data)).eTag());
    }

    @Override
    public String completeMultipart(String uploadId, List<CompletedPart> parts) throws IOException {
        String key = keyOf(uploadId);
        List<software.amazon.awssdk.services.s3.model.CompletedPart> completed = new ArrayList<>(parts.size());
        for (CompletedPart part : parts) {
            completed.add(software.amazon.awssdk.services.s3.model.CompletedPart.builder()
                    .partNumber(part.partNumber())
                    .eTag(part.etag())
                    .build());
        }
        completed.sort((a, b) -> Integer.compare(a.partNumber(), b.partNumber()));
        String etag = call("CompleteMultipartUpload", key, () -> s3.completeMultipartUpload(
                CompleteMultipartUploadRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .uploadId(uploadId)
                        .multipartUpload(CompletedMultipartUpload.builder().parts(completed).build())
                        .build()).eTag());
        openUploads.remove(uploadId);
        return etag;
    }

    @Override
    public void abortMultipart(String uploadId) throws IOException {
        String key = openUploads.remove(uploadId);
        if (key == null) {
            return;
        }
        try {
            call("AbortMultipartUpload", key, () -> s3.abortMultipartUpload(
                    AbortMultipartUploadRequest.builder().bucket(bucket).key(key).uploadId(uploadId).build()));
        } catch (ObjectStoreException e) {
            if (!"NoSuchUpload".equals(e.errorCode())) {
                throw e;
            }
        }
    }

    @Override
    public List<ObjectSummary> list(String prefix) throws IOException {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix == null ? "" : prefix)
                .build();
        return call("ListObjectsV2", prefix, () -> {
            List<ObjectSummary> out = new ArrayList<>();
            for (S3Object object : s3.listObjectsV2Paginator(request).contents()) {
                out.add(new ObjectSummary(object.key(), object.size() == null ? 0L : object.size(), object.lastModified()));
            }
            return out;
        });
    }

    @Override
    public Optional<ObjectSummary> head(String key) throws IOException {
        try {
            HeadObjectResponse response = call("HeadObject", key, () -> s3.headObject(
                    HeadObjectRequest.builder().bucket(bucket).key(key).build()));
            long size = response.contentLength() == null ? 0L : response.contentLength();
            return Optional.of(new ObjectSummary(key, size, response.lastModified()));
        } catch (ObjectStoreException e) {
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public void delete(String key) throws IOException {
        call("DeleteObject", key, () -> s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build()));
    }

    @Override
    public void close() {
        s3.close();
    }

    private String keyOf(String uploadId) throws ObjectStoreException {
        String key = openUploads.get(uploadId);
        if (key == null) {
            throw new ObjectStoreException(404, "NoSuchUpload", "unknown upload id: " + uploadId);
        }
        return key;
    }

    private static <T> T call(String operation, String key, SdkCall<T> call) throws IOException {
        try {
            return call.run();
        } catch (AwsServiceException e) {
            throw storeError(operation, key, e);
        } catch (AbortedException e) {
            InterruptedIOException interrupted = new InterruptedIOException(operation + " interrupted: " + key);
            interrupted.initCause(e);
            Thread.currentThread().interrupt();
            throw interrupted;
        } catch (SdkClientException e) {
            throw new IOException(operation + " failed for " + key + ": " + e.getMessage(), e);
        }
    }

    static ObjectStoreException storeError(String operation, String key, AwsServiceException e) {
        String code;
        if (e instanceof NoSuchKeyException) {
            code = "NoSuchKey";
        } else if (e.awsErrorDetails() != null && e.awsErrorDetails().errorCode() != null) {
            code = e.awsErrorDetails().errorCode();
        } else {
            code = "HTTP" + e.statusCode();
        }
        String detail = e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null
                ? e.awsErrorDetails().errorMessage()
                : String.valueOf(e.getMessage());
        return new ObjectStoreException(e.statusCode(), code, operation + " " + key + ": " + detail, e);
    }

    @FunctionalInterface
    private interface SdkCall<T> {
        T run();
    }
}
