package com.example.prism.provider;

import java.time.Duration;

/**
 * Absolute point in time by which a provider call must complete.
 */
public final class Deadline {

    private static final Duration MIN_TIMEOUT = Duration.ofMillis(1);

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static Deadline after(Duration timeout) {
        return new Deadline(System.nanoTime() + timeout.toNanos());
    }

    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    /**
     * The smaller of the remaining time and {@code max}, never below one millisecond
     * so it can be handed to APIs that reject a zero timeout.
     */
    public Duration cap(Duration max) {
        Duration remaining = remaining();
        Duration capped = remaining.compareTo(max) < 0 ? remaining : max;
        return capped.compareTo(MIN_TIMEOUT) < 0 ? MIN_TIMEOUT : capped;
    }

    public void check(String provider) throws ProviderException {
        if (isExpired()) {
            throw new ProviderException(provider, "deadline exceeded");
        }
    }

    @Override
    public String toString() {
        return "Deadline[remaining=" + remaining().toMillis() + "ms]";
    }
}
