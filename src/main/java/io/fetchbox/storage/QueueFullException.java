package io.fetchbox.storage;

/**
 * Enqueue rejected because the queue already holds {@code capacity} active
 * (pending or leased) entries.
 */
public final class QueueFullException extends RuntimeException {
    private final int capacity;

    public QueueFullException(int capacity) {
        super("Queue is full (capacity=" + capacity + ")");
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }
}
