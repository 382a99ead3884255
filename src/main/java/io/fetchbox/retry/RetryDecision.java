package io.fetchbox.retry;

public record RetryDecision(Action action, long delayMs) {
    public enum Action { RETRY, DEAD_LETTER }

    public static RetryDecision retry(long delayMs) {
        return new RetryDecision(Action.RETRY, Math.max(0L, delayMs));
    }

    public static RetryDecision deadLetter() {
        return new RetryDecision(Action.DEAD_LETTER, 0L);
    }

    public boolean shouldRetry() {
        return action == Action.RETRY;
    }
}
