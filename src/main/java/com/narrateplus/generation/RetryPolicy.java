package com.narrateplus.generation;

import com.narrateplus.NarratePlusConfig;
import lombok.Value;

/**
 * Exponential backoff for transient generation failures.
 */
@Value
public class RetryPolicy
{
    /**
     * Retries after the first attempt; total attempts are {@code maxRetries + 1}.
     */
    int maxRetries;

    long initialDelayMs;

    long maxDelayMs;

    double multiplier;

    public static RetryPolicy fromConfig(NarratePlusConfig config)
    {
        return new RetryPolicy(
                Math.max(0, config.maxRetries()),
                Math.max(0, config.initialBackoffMs()),
                Math.max(0, config.maxBackoffMs()),
                Math.max(1d, config.backoffMultiplier()));
    }

    public boolean allowsRetryAfter(int failedAttempt)
    {
        return failedAttempt <= maxRetries;
    }

    /**
     * Delay before the attempt that follows failed attempt {@code failedAttempt} (1-based).
     */
    public long delayAfter(int failedAttempt)
    {
        double delay = initialDelayMs * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        return (long) Math.min(delay, maxDelayMs);
    }
}
