package io.mailqueue.dispatch;

/**
 * Retry policy whose delay grows linearly with the retry count.
 *
 * <p>Delay formula: {@code unitMs * retries}. With a one-second unit the first three
 * retries wait 1 s, 2 s and 3 s. No jitter is applied.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
    private final long unitMs;

    /**
     * @param unitMs delay added per retry (milliseconds), must be &gt; 0
     */
    public LinearBackoffRetryPolicy(long unitMs) {
        if (unitMs <= 0) {
            throw new IllegalArgumentException("unitMs must be > 0, got: " + unitMs);
        }
        this.unitMs = unitMs;
    }

    @Override
    public long computeDelayMs(int retries) {
        if (retries <= 0) {
            return 0L;
        }
        if (retries > Long.MAX_VALUE / unitMs) {
            return Long.MAX_VALUE;
        }
        return unitMs * retries;
    }

    public long unitMs() {
        return unitMs;
    }
}
