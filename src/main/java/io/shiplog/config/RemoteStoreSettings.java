package io.shiplog.config;

public record RemoteStoreSettings(String bucket, String region, String endpoint, String profile) {
}
