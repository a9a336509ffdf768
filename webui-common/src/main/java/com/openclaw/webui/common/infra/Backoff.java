package com.openclaw.webui.common.infra;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff computation.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Backoff policy configuration.
     *
     * @param initialMs initial delay in milliseconds
     * @param maxMs     maximum delay in milliseconds
     * @param factor    multiplicative factor per attempt
     * @param jitter    jitter ratio (0..1)
     */
    public record Policy(long initialMs, long maxMs, double factor, double jitter) {

        /** Gateway reconnect policy: 2s initial, 30s max, factor 1.5, no jitter. */
        public static final Policy GATEWAY_RECONNECT = new Policy(2_000, 30_000, 1.5, 0.0);
    }

    /**
     * Compute the backoff delay for a given attempt.
     *
     * @param policy  backoff policy
     * @param attempt 1-based attempt number
     * @return delay in milliseconds (capped at {@code policy.maxMs})
     */
    public static long compute(Policy policy, int attempt) {
        double base = policy.initialMs * Math.pow(policy.factor, Math.max(attempt - 1, 0));
        double jitter = policy.jitter > 0
                ? base * policy.jitter * ThreadLocalRandom.current().nextDouble()
                : 0;
        return Math.min(policy.maxMs, Math.round(base + jitter));
    }
}
