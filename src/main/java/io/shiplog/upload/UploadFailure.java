package io.shiplog.upload;

import io.shiplog.model.ErrorKind;

public final class UploadFailure extends RuntimeException {
    private final ErrorKind kind;

    public UploadFailure(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public UploadFailure(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
