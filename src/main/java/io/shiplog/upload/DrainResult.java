package io.shiplog.upload;

public record DrainResult(int uploaded, int skipped, int changed, int failed, long bytesUploaded, boolean halted) {
    public static DrainResult empty(boolean halted) {
        return new DrainResult(0, 0, 0, 0, 0L, halted);
    }

    public int attempted() {
        return uploaded + skipped + changed + failed;
    }
}
