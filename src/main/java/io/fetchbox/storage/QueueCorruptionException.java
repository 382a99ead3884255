package io.fetchbox.storage;

public final class QueueCorruptionException extends RuntimeException {
    private final long sequence;

    public QueueCorruptionException(long sequence, String message, Throwable cause) {
        super(message, cause);
        this.sequence = sequence;
    }

    public long sequence() {
        return sequence;
    }
}
