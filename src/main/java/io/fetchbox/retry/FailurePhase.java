package io.fetchbox.retry;

public enum FailurePhase {
    DOWNLOAD,
    UPLOAD,
    SYSTEM
}
