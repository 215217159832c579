package io.shiplog.upload;

import io.shiplog.model.ErrorKind;
import io.shiplog.remote.ObjectStoreException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps whatever an upload attempt threw onto an {@link ErrorKind}. Unknown failures are
 * treated as transient so they get the retry budget instead of being dropped.
 */
public final class FailureClassifier {
    private static final Set<String> AUTH_CODES = Set.of(
            "InvalidAccessKeyId", "SignatureDoesNotMatch", "AccessDenied", "ExpiredToken", "InvalidToken");
    private static final Set<String> THROTTLE_CODES = Set.of(
            "SlowDown", "Throttling", "ThrottlingException", "RequestLimitExceeded", "TooManyRequests");

    private FailureClassifier() {
    }

    public static ErrorKind classify(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof UploadFailure) {
            return ((UploadFailure) t).kind();
        }
        if (t instanceof ObjectStoreException) {
            return classifyStore((ObjectStoreException) t);
        }
        if (t instanceof NoSuchFileException || t instanceof FileNotFoundException) {
            return ErrorKind.SOURCE_MISSING;
        }
        if (t instanceof AccessDeniedException) {
            return ErrorKind.PERMISSION_DENIED;
        }
        if (t instanceof TimeoutException || t instanceof IOException) {
            return ErrorKind.NETWORK_TIMEOUT;
        }
        return ErrorKind.UNKNOWN;
    }

    static ErrorKind classifyStore(ObjectStoreException e) {
        String code = e.errorCode() == null ? "" : e.errorCode();
        if (AUTH_CODES.contains(code)) {
            return ErrorKind.AUTH_FAILED;
        }
        if ("NoSuchBucket".equals(code)) {
            return ErrorKind.BUCKET_MISSING;
        }
        if ("EntityTooLarge".equals(code)) {
            return ErrorKind.OBJECT_TOO_LARGE;
        }
        if (THROTTLE_CODES.contains(code) || e.statusCode() == 429) {
            return ErrorKind.THROTTLED;
        }
        if ("RequestTimeout".equals(code)) {
            return ErrorKind.NETWORK_TIMEOUT;
        }
        if (e.statusCode() == 401 || e.statusCode() == 403) {
            return ErrorKind.AUTH_FAILED;
        }
        if (e.statusCode() >= 500) {
            return ErrorKind.SERVER_ERROR;
        }
        return ErrorKind.UNKNOWN;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof ExecutionException || t instanceof CompletionException || t instanceof UncheckedIOException)
                && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
