package io.fetchbox.worker;

public record StorageDestination(String bucket, String key) {
}
