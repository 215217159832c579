package io.shiplog.config;

public final class ConfigValidationException extends RuntimeException {
    private final String key;

    public ConfigValidationException(String key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public ConfigValidationException(String key, String message, Throwable cause) {
        super(key + ": " + message, cause);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
