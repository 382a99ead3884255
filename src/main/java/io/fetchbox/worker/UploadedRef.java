package io.fetchbox.worker;

public record UploadedRef(String bucket, String key, long sizeBytes, String location) {
}
