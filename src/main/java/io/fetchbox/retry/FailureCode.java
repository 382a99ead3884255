package io.fetchbox.retry;

/**
 * Failure taxonomy. {@link #DOWNLOAD_HTTP_STATUS} decides retryability from the
 * status code, see {@link TaskFailure#retryable()}.
 */
public enum FailureCode {
    DOWNLOAD_TIMEOUT("download.timeout", FailurePhase.DOWNLOAD, true),
    DOWNLOAD_CONNECTION("download.connection", FailurePhase.DOWNLOAD, true),
    DOWNLOAD_DNS("download.dns", FailurePhase.DOWNLOAD, true),
    DOWNLOAD_HTTP_STATUS("download.http_status", FailurePhase.DOWNLOAD, false),
    DOWNLOAD_PROXY_TIERS_EXHAUSTED("download.proxy_tiers_exhausted", FailurePhase.DOWNLOAD, false),
    DOWNLOAD_MALFORMED_URL("download.malformed_url", FailurePhase.DOWNLOAD, false),
    UPLOAD_NETWORK("upload.network", FailurePhase.UPLOAD, true),
    UPLOAD_THROTTLED("upload.throttled", FailurePhase.UPLOAD, true),
    UPLOAD_SERVER_ERROR("upload.server_error", FailurePhase.UPLOAD, true),
    UPLOAD_ACCESS_DENIED("upload.access_denied", FailurePhase.UPLOAD, false),
    UPLOAD_INVALID_DESTINATION("upload.invalid_destination", FailurePhase.UPLOAD, false),
    SYSTEM_INTERNAL_FAULT("system.internal_fault", FailurePhase.SYSTEM, false),
    SYSTEM_QUEUE_CORRUPTION("system.queue_corruption", FailurePhase.SYSTEM, false);

    private final String code;
    private final FailurePhase phase;
    private final boolean retryable;

    FailureCode(String code, FailurePhase phase, boolean retryable) {
        this.code = code;
        this.phase = phase;
        this.retryable = retryable;
    }

    public String code() {
        return code;
    }

    public FailurePhase phase() {
        return phase;
    }

    public boolean retryable() {
        return retryable;
    }

    public static FailureCode fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("failure code must not be blank");
        }
        String value = raw.trim();
        int colon = value.indexOf(':');
        if (colon > 0) {
            value = value.substring(0, colon);
        }
        for (FailureCode candidate : values()) {
            if (candidate.code.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown failure code: " + raw);
    }
}
