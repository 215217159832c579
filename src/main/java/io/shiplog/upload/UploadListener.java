package io.shiplog.upload;

import io.shiplog.model.RegistryRecord;

@FunctionalInterface
public interface UploadListener {
    void onUploaded(RegistryRecord record);

    UploadListener NONE = record -> {
    };
}
