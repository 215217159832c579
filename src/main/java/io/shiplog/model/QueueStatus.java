package io.shiplog.model;

public enum QueueStatus {
    PENDING,
    IN_FLIGHT,
    PERMANENTLY_FAILED
}
