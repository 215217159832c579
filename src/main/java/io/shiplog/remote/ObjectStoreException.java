package io.shiplog.remote;

import java.io.IOException;

public final class ObjectStoreException extends IOException {
    private final int statusCode;
    private final String errorCode;

    public ObjectStoreException(int statusCode, String errorCode, String message) {
        super(errorCode + " (" + statusCode + "): " + message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public ObjectStoreException(int statusCode, String errorCode, String message, Throwable cause) {
        this(statusCode, errorCode, message);
        initCause(cause);
    }

    public int statusCode() {
        return statusCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
