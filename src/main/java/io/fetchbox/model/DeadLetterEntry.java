package io.fetchbox.model;

public record DeadLetterEntry(
        long sequence,
        Task task,
        String failureCode,
        String failureMessage,
        int attempts,
        long failedAtMs
) {
}
