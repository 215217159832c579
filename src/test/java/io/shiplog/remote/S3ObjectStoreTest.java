package io.shiplog.remote;

import io.shiplog.config.RemoteStoreSettings;
import io.shiplog.model.ErrorKind;
import io.shiplog.upload.FailureClassifier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.lang.reflect.Proxy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

final class S3ObjectStoreTest {

    @Test
    void serviceErrorsKeepStatusAndErrorCode() {
        AwsServiceException denied = S3Exception.builder()
                .statusCode(403)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("AccessDenied").errorMessage("Access Denied").build())
                .message("Access Denied")
                .build();

        ObjectStoreException mapped = S3ObjectStore.storeError("PutObject", "veh/a.log", denied);

        Assertions.assertEquals(403, mapped.statusCode());
        Assertions.assertEquals("AccessDenied", mapped.errorCode());
        Assertions.assertSame(denied, mapped.getCause());
        Assertions.assertEquals(ErrorKind.AUTH_FAILED, FailureClassifier.classify(mapped));
    }

    @Test
    void throttlingAndBucketErrorsClassifyFromErrorCode() {
        AwsServiceException slowDown = S3Exception.builder()
                .statusCode(503)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("SlowDown").build())
                .build();
        AwsServiceException noBucket = S3Exception.builder()
                .statusCode(404)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("NoSuchBucket").build())
                .build();

        Assertions.assertEquals(ErrorKind.THROTTLED,
                FailureClassifier.classify(S3ObjectStore.storeError("UploadPart", "k", slowDown)));
        Assertions.assertEquals(ErrorKind.BUCKET_MISSING,
                FailureClassifier.classify(S3ObjectStore.storeError("PutObject", "k", noBucket)));
    }

    @Test
    void headTreatsMissingKeyAsAbsent() throws Exception {
        Map<String, Object> replies = new ConcurrentHashMap<>();
        replies.put("headObject", NoSuchKeyException.builder().statusCode(404).message("Not Found").build());
        try (S3ObjectStore store = new S3ObjectStore(s3(replies, new ArrayList<>()), "fleet")) {
            Assertions.assertTrue(store.head("veh/a.log").isEmpty());

            replies.put("headObject", HeadObjectResponse.builder().contentLength(42L).build());
            Assertions.assertEquals(42L, store.head("veh/a.log").orElseThrow().size());
        }
    }

    @Test
    void clientFailuresSurfaceAsIoErrors() throws Exception {
        Map<String, Object> replies = new ConcurrentHashMap<>();
        Path dir = Files.createTempDirectory("shiplog-s3-");
        try (S3ObjectStore store = new S3ObjectStore(s3(replies, new ArrayList<>()), "fleet")) {
            Path source = Files.writeString(dir.resolve("a.log"), "payload");

            replies.put("putObject", SdkClientException.create("Unable to execute HTTP request: connect timed out"));
            IOException network = Assertions.assertThrows(IOException.class, () -> store.putObject("veh/a.log", source));
            Assertions.assertFalse(network instanceof ObjectStoreException);
            Assertions.assertEquals(ErrorKind.NETWORK_TIMEOUT, FailureClassifier.classify(network));

            replies.put("putObject", AbortedException.builder().message("Thread was interrupted").build());
            Assertions.assertThrows(InterruptedIOException.class, () -> store.putObject("veh/a.log", source));
            Assertions.assertTrue(Thread.interrupted());
        } finally {
            Files.deleteIfExists(dir.resolve("a.log"));
            Files.deleteIfExists(dir);
        }
    }

    @Test
    void multipartCompletesWithPartsInOrder() throws Exception {
        Map<String, Object> replies = new ConcurrentHashMap<>();
        replies.put("createMultipartUpload", CreateMultipartUploadResponse.builder().uploadId("up-1").build());
        replies.put("uploadPart", UploadPartResponse.builder().eTag("\"p\"").build());
        replies.put("completeMultipartUpload", CompleteMultipartUploadResponse.builder().eTag("\"mp\"").build());
        List<Object> requests = new ArrayList<>();
        try (S3ObjectStore store = new S3ObjectStore(s3(replies, requests), "fleet")) {
            String uploadId = store.createMultipart("veh/big.log");
            store.uploadPart(uploadId, 1, new byte[]{1});
            store.completeMultipart(uploadId, List.of(
                    new ObjectStoreClient.CompletedPart(2, "b"),
                    new ObjectStoreClient.CompletedPart(1, "a")));

            CompleteMultipartUploadRequest complete = (CompleteMultipartUploadRequest) requests.get(requests.size() - 1);
            Assertions.assertEquals("veh/big.log", complete.key());
            Assertions.assertEquals(List.of(1, 2), complete.multipartUpload().parts().stream()
                    .map(software.amazon.awssdk.services.s3.model.CompletedPart::partNumber).toList());

            ObjectStoreException unknown = Assertions.assertThrows(ObjectStoreException.class,
                    () -> store.uploadPart(uploadId, 3, new byte[]{3}));
            Assertions.assertEquals("NoSuchUpload", unknown.errorCode());
        }
    }

    @Test
    void factorySelectsS3ForAwsAndHttpEndpoints() {
        try (ObjectStoreClient aws = ObjectStoreFactory.create(
                new RemoteStoreSettings("fleet", "eu-west-1", null, null), Duration.ofSeconds(5));
             ObjectStoreClient local = ObjectStoreFactory.create(
                     new RemoteStoreSettings("fleet", "us-east-1", "http://localhost:4566", null), Duration.ofSeconds(5))) {
            Assertions.assertEquals("fleet", ((S3ObjectStore) aws).bucket());
            Assertions.assertInstanceOf(S3ObjectStore.class, local);
        }
    }

    private static S3Client s3(Map<String, Object> replies, List<Object> requests) {
        return (S3Client) Proxy.newProxyInstance(S3Client.class.getClassLoader(), new Class<?>[]{S3Client.class},
                (proxy, method, args) -> {
                    if ("close".equals(method.getName())) {
                        return null;
                    }
                    if ("serviceName".equals(method.getName())) {
                        return S3Client.SERVICE_NAME;
                    }
                    if (args != null && args.length > 0) {
                        requests.add(args[0]);
                    }
                    Object reply = replies.get(method.getName());
                    if (reply instanceof RuntimeException) {
                        throw (RuntimeException) reply;
                    }
                    if (reply == null) {
                        throw new UnsupportedOperationException(method.getName());
                    }
                    return reply;
                });
    }
}
