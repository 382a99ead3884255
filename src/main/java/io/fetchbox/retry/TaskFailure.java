package io.fetchbox.retry;

/**
 * Classified failure of one pipeline step. Thrown by the downloader and storage
 * collaborators and turned into a {@link RetryDecision} by {@link BackoffEngine}.
 */
public final class TaskFailure extends Exception {
    private final FailureCode code;
    private final Integer httpStatus;

    private TaskFailure(FailureCode code, Integer httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public static TaskFailure of(FailureCode code, String message) {
        return new TaskFailure(code, null, message, null);
    }

    public static TaskFailure of(FailureCode code, String message, Throwable cause) {
        return new TaskFailure(code, null, message, cause);
    }

    public static TaskFailure httpStatus(int status, String url) {
        return new TaskFailure(FailureCode.DOWNLOAD_HTTP_STATUS, status, "HTTP " + status + " from " + url, null);
    }

    public static TaskFailure internalFault(Throwable cause) {
        String detail = cause.getMessage() == null ? "" : ": " + cause.getMessage();
        return new TaskFailure(
                FailureCode.SYSTEM_INTERNAL_FAULT,
                null,
                cause.getClass().getSimpleName() + detail,
                cause
        );
    }

    public FailureCode code() {
        return code;
    }

    public FailurePhase phase() {
        return code.phase();
    }

    public Integer httpStatus() {
        return httpStatus;
    }

    public boolean retryable() {
        if (code == FailureCode.DOWNLOAD_HTTP_STATUS) {
            int status = httpStatus == null ? 0 : httpStatus;
            return status >= 500 || status == 408 || status == 429;
        }
        return code.retryable();
    }

    /**
     * Code recorded with dead letters and ledger deltas, e.g. {@code download.timeout}
     * or {@code download.http_status:404}.
     */
    public String failureCode() {
        if (httpStatus == null) {
            return code.code();
        }
        return code.code() + ":" + httpStatus;
    }
}
