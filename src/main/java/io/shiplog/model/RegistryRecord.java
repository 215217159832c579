package io.shiplog.model;

public record RegistryRecord(
        String identityHash,
        String path,
        long sizeBytes,
        long modifiedAtMs,
        String remoteKey,
        long uploadedAtMs,
        long expiresAtMs
) {
    public boolean expiredAt(long nowMs) {
        return expiresAtMs <= nowMs;
    }

    public boolean matches(FileIdentity identity) {
        return identity != null
                && path.equals(identity.path())
                && sizeBytes == identity.sizeBytes()
                && modifiedAtMs == identity.modifiedAtMs();
    }

    public FileIdentity identity() {
        return new FileIdentity(path, sizeBytes, modifiedAtMs);
    }
}
