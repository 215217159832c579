package io.shiplog.model;

public enum ErrorKind {
    NETWORK_TIMEOUT(false),
    SERVER_ERROR(false),
    THROTTLED(false),
    UNKNOWN(false),
    AUTH_FAILED(true),
    BUCKET_MISSING(true),
    OBJECT_TOO_LARGE(true),
    SOURCE_MISSING(true),
    PERMISSION_DENIED(true),
    PATH_ESCAPE(true),
    RETRIES_EXHAUSTED(true);

    private final boolean permanent;

    ErrorKind(boolean permanent) {
        this.permanent = permanent;
    }

    public boolean permanent() {
        return permanent;
    }

    public String label() {
        return name().toLowerCase();
    }
}
