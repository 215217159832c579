package io.shiplog.remote;

import io.shiplog.config.ConfigValidationException;
import io.shiplog.config.RemoteStoreSettings;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

public final class ObjectStoreFactory {
    private ObjectStoreFactory() {
    }

    public static ObjectStoreClient create(RemoteStoreSettings settings, Duration callTimeout) {
        String endpoint = settings.endpoint();
        if (endpoint == null || endpoint.isBlank()) {
            return S3ObjectStore.create(settings, null, callTimeout);
        }
        URI uri;
        try {
            uri = new URI(endpoint.trim());
        } catch (URISyntaxException e) {
            throw new ConfigValidationException("remote.endpoint", "invalid URI: " + endpoint, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        switch (scheme) {
            case "http":
            case "https":
                if (uri.getHost() == null) {
                    throw new ConfigValidationException("remote.endpoint", "missing host: " + endpoint);
                }
                return S3ObjectStore.create(settings, uri, callTimeout);
            case "file":
                Path base;
                try {
                    base = Path.of(uri);
                } catch (IllegalArgumentException e) {
                    throw new ConfigValidationException("remote.endpoint", "must be an absolute file:/// URI: " + endpoint, e);
                }
                return new FileSystemObjectStore(base.resolve(settings.bucket()));
            default:
                throw new ConfigValidationException("remote.endpoint",
                        "unsupported scheme '" + uri.getScheme() + "' (supported: https://, http://, file://)");
        }
    }
}
