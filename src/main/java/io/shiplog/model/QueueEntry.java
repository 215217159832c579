package io.shiplog.model;

public record QueueEntry(
        FileIdentity identity,
        long enqueuedAtMs,
        int attemptCount,
        ErrorKind lastErrorKind,
        Long lastErrorAtMs,
        long nextAttemptAtMs,
        QueueStatus status
) {
    public static QueueEntry pending(FileIdentity identity, long nowMs) {
        return new QueueEntry(identity, nowMs, 0, null, null, nowMs, QueueStatus.PENDING);
    }

    public QueueEntry withStatus(QueueStatus next) {
        return new QueueEntry(identity, enqueuedAtMs, attemptCount, lastErrorKind, lastErrorAtMs, nextAttemptAtMs, next);
    }

    public QueueEntry failed(ErrorKind kind, long nowMs, long retryAtMs, QueueStatus next) {
        return new QueueEntry(identity, enqueuedAtMs, attemptCount + 1, kind, nowMs, retryAtMs, next);
    }

    public QueueEntry notBefore(long notBeforeMs) {
        return new QueueEntry(identity, enqueuedAtMs, attemptCount, lastErrorKind, lastErrorAtMs, notBeforeMs, status);
    }

    public QueueEntry requeued(long nowMs) {
        return new QueueEntry(identity, enqueuedAtMs, 0, lastErrorKind, lastErrorAtMs, nowMs, QueueStatus.PENDING);
    }

    public boolean dueAt(long nowMs) {
        return status == QueueStatus.PENDING && nextAttemptAtMs <= nowMs;
    }
}
